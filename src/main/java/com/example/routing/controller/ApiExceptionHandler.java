package com.example.routing.controller;

import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.example.routing.config.RuleLoadException;
import com.example.routing.dialog.DialogStateException;
import com.example.routing.gateway.SchemaValidationException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SchemaValidationException.class)
    public ResponseEntity<Map<String, Object>> schemaValidation(SchemaValidationException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of(
            "error", "schema_validation",
            "source", e.source().value(),
            "errors", e.errors()));
    }

    @ExceptionHandler(DialogStateException.class)
    public ResponseEntity<Map<String, Object>> dialogState(DialogStateException e) {
        HttpStatus status = e.reason() == DialogStateException.Reason.NOT_FOUND
            ? HttpStatus.NOT_FOUND : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(Map.of(
            "error", e.reason().name().toLowerCase(Locale.ROOT),
            "message", e.getMessage()));
    }

    @ExceptionHandler(RuleLoadException.class)
    public ResponseEntity<Map<String, Object>> ruleLoad(RuleLoadException e) {
        log.error("Rule reload rejected: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of(
            "error", "rule_load",
            "message", e.getMessage()));
    }
}
