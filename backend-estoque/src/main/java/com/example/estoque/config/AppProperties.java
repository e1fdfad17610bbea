package com.example.estoque.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Propriedades customizadas da aplicação (prefixo {@code app}).
 */
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Estoque estoque = new Estoque();
    private final Paginacao paginacao = new Paginacao();
    private final EmbeddedPostgres embeddedPostgres = new EmbeddedPostgres();

    public Estoque getEstoque() {
        return estoque;
    }

    public Paginacao getPaginacao() {
        return paginacao;
    }

    public EmbeddedPostgres getEmbeddedPostgres() {
        return embeddedPostgres;
    }

    public static class Estoque {
        // limite usado pelo relatório de baixo estoque quando a requisição não informa um
        private int limiteBaixoEstoque = 10;

        public int getLimiteBaixoEstoque() {
            return limiteBaixoEstoque;
        }

        public void setLimiteBaixoEstoque(int limiteBaixoEstoque) {
            this.limiteBaixoEstoque = limiteBaixoEstoque;
        }
    }

    public static class Paginacao {
        private int limitePadrao = 100;
        private int limiteMaximo = 1000;

        public int getLimitePadrao() {
            return limitePadrao;
        }

        public void setLimitePadrao(int limitePadrao) {
            this.limitePadrao = limitePadrao;
        }

        public int getLimiteMaximo() {
            return limiteMaximo;
        }

        public void setLimiteMaximo(int limiteMaximo) {
            this.limiteMaximo = limiteMaximo;
        }
    }

    public static class EmbeddedPostgres {
        private boolean enabled = false;
        private String dataDir = "data/pg";
        // 0 = porta livre escolhida pelo zonky
        private int port = 0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }
    }
}
