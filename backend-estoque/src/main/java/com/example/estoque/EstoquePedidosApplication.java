package com.example.estoque;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EstoquePedidosApplication {
    public static void main(String[] args) {
        SpringApplication.run(EstoquePedidosApplication.class, args);
    }
}
