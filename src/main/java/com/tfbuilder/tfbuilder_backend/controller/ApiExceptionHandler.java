package com.tfbuilder.tfbuilder_backend.controller;

import com.tfbuilder.tfbuilder_backend.engine.GenerationRefusedException;
import com.tfbuilder.tfbuilder_backend.service.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.NoSuchElementException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NoSuchElementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NoSuchElementException e) {
        return body("NOT_FOUND", e);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(RuntimeException e) {
        return body("BAD_REQUEST", e);
    }

    @ExceptionHandler(GenerationRefusedException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleRefused(GenerationRefusedException e) {
        return body("GENERATION_REFUSED", e);
    }

    @ExceptionHandler(PersistenceException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handlePersistence(PersistenceException e) {
        log.error("Persistence failure on {} ({})", e.getFile(), e.getOperation());
        return body("PERSISTENCE_ERROR", e);
    }

    private static Map<String, Object> body(String code, Exception e) {
        return Map.of(
                "error", code,
                "message", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()
        );
    }
}
