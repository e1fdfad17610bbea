package com.example.estoque.common;

import org.springframework.http.HttpStatus;

/**
 * Violação de unicidade ou de integridade referencial (nome duplicado,
 * produto em uso, estoque insuficiente).
 */
public class ConflictException extends ApiException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }
}
