package com.example.estoque.common;

import org.springframework.http.HttpStatus;

/**
 * Base para os erros de negócio expostos pela API. Cada subtipo carrega o
 * status HTTP correspondente; a mensagem vai no corpo da resposta.
 */
public abstract class ApiException extends RuntimeException {

    protected ApiException(String message) {
        super(message);
    }

    protected ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatus getStatus();
}
