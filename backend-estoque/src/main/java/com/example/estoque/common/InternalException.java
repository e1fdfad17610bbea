package com.example.estoque.common;

import org.springframework.http.HttpStatus;

/**
 * Falha de persistência ou inesperada, não atribuível à entrada do cliente.
 * A causa fica no log; o cliente recebe apenas a mensagem genérica.
 */
public class InternalException extends ApiException {

    public static final String MENSAGEM_PADRAO = "Erro interno do servidor";

    public InternalException(Throwable cause) {
        super(MENSAGEM_PADRAO, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
