package com.example.estoque.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String KEY_ERROR = "error";

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, Object>> handleApi(ApiException e) {
        return ResponseEntity.status(e.getStatus()).body(Map.of(KEY_ERROR, e.getMessage()));
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientStock(InsufficientStockException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(KEY_ERROR, e.getMessage());
        body.put("produto_id", e.getProdutoId());
        body.put("disponivel", e.getDisponivel());
        body.put("solicitado", e.getSolicitado());
        return ResponseEntity.status(e.getStatus()).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String message = fieldError != null
                ? fieldError.getField() + ": " + fieldError.getDefaultMessage()
                : "Dados inválidos";
        return ResponseEntity.badRequest().body(Map.of(KEY_ERROR, message));
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class })
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception e) {
        log.debug("Requisição inválida: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(KEY_ERROR, "Requisição inválida"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        // rota inexistente, método não suportado etc. mantêm o status do Spring MVC
        if (e instanceof ErrorResponse errorResponse) {
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(Map.of(KEY_ERROR, String.valueOf(errorResponse.getBody().getTitle())));
        }
        log.error("Erro interno", e);
        return ResponseEntity.status(500).body(Map.of(KEY_ERROR, InternalException.MENSAGEM_PADRAO));
    }
}
