package com.example.estoque.config;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * PostgreSQL embarcado (zonky) para execução local sem banco externo. Com
 * {@code app.embedded-postgres.enabled=false} vale o {@code spring.datasource.*}
 * configurado, e o Liquibase migra o banco que estiver ativo.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.embedded-postgres", name = "enabled", havingValue = "true")
public class EmbeddedPostgresConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedPostgresConfig.class);
    private static final Duration STARTUP_WAIT = Duration.ofSeconds(30);

    @Bean(destroyMethod = "close")
    public EmbeddedPostgres embeddedPostgres(AppProperties props) throws IOException {
        AppProperties.EmbeddedPostgres cfg = props.getEmbeddedPostgres();
        EmbeddedPostgres.Builder builder = EmbeddedPostgres.builder().setPGStartupWait(STARTUP_WAIT);

        if (cfg.getPort() > 0) {
            builder.setPort(cfg.getPort());
        }
        if (cfg.getDataDir() != null && !cfg.getDataDir().isBlank()) {
            Path dataDir = Paths.get(cfg.getDataDir()).toAbsolutePath();
            Files.createDirectories(dataDir);
            builder.setDataDirectory(dataDir).setCleanDataDirectory(false);
            log.info("Embedded Postgres data directory: {}", dataDir);
        }

        EmbeddedPostgres postgres = builder.start();
        log.info("Embedded Postgres iniciado na porta {}", postgres.getPort());
        return postgres;
    }

    @Bean
    public DataSource dataSource(EmbeddedPostgres embeddedPostgres) {
        return embeddedPostgres.getPostgresDatabase();
    }
}
