package com.shelfsync.converter.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Every rejected request gets the trigger API's body shape: {@code status: rejected}, a
 * snake_case {@code error} and the details. Invalid trigger bodies are 400, framework status
 * errors (415, 405, ...) keep their own status, anything else is 500.
 */
@RestControllerAdvice
public class GlobalErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBind(WebExchangeBindException ex) {
        List<Map<String, Object>> fields = ex.getFieldErrors().stream().map(err -> {
            Map<String, Object> field = new LinkedHashMap<>();
            field.put("field", err.getField());
            field.put("code", err.getCode());
            field.put("message", err.getDefaultMessage());
            return field;
        }).collect(Collectors.toList());
        log.warn("Trigger request rejected, invalid fields: {}", fields);
        Map<String, Object> body = rejected("bad_request");
        body.put("details", fields);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        log.warn("Trigger request rejected, unreadable body: {}", ex.getReason());
        Map<String, Object> body = rejected("bad_request");
        body.put("reason", ex.getReason());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        log.warn("Request rejected with {}: {}", status.value(), ex.getReason());
        HttpStatus known = HttpStatus.resolve(status.value());
        Map<String, Object> body = rejected(known != null ? known.name().toLowerCase(Locale.ROOT) : "http_" + status.value());
        body.put("reason", ex.getReason());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        log.error("Request failed", ex);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("error", "server_error");
        body.put("message", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static Map<String, Object> rejected(String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "rejected");
        body.put("error", error);
        return body;
    }
}
