package com.example.estoque.common;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

@RestController
public class ApiController {

    private static final String KEY_MENSAGEM = "mensagem";
    private static final String KEY_VERSAO = "versao";
    private static final String KEY_STATUS = "status";
    private static final String KEY_TIMESTAMP = "timestamp";
    private static final String VERSION_VALUE = "1.0.0";

    @GetMapping("/")
    public Map<String, Object> root() {
        return Map.of(
                KEY_MENSAGEM, "API de Gestão de Estoque e Pedidos",
                KEY_VERSAO, VERSION_VALUE,
                "recursos", "/api/produtos, /api/pedidos, /api/estatisticas");
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
                KEY_STATUS, "OK",
                KEY_TIMESTAMP, OffsetDateTime.now(ZoneOffset.UTC).toString());
    }
}
