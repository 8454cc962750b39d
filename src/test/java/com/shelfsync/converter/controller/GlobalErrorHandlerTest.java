package com.shelfsync.converter.controller;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ServerWebInputException;
import org.springframework.web.server.UnsupportedMediaTypeStatusException;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GlobalErrorHandlerTest {

    private final GlobalErrorHandler handler = new GlobalErrorHandler();

    @Test
    public void nonJsonTriggerBodyKeeps415() {
        UnsupportedMediaTypeStatusException ex =
                new UnsupportedMediaTypeStatusException(MediaType.TEXT_PLAIN, List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<Map<String, Object>> res = handler.handleStatus(ex);
        assertEquals(415, res.getStatusCode().value());
        assertEquals("rejected", res.getBody().get("status"));
        assertEquals("unsupported_media_type", res.getBody().get("error"));
    }

    @Test
    public void unreadableBodyIs400() {
        ResponseEntity<Map<String, Object>> res = handler.handleInput(new ServerWebInputException("Failed to read HTTP message"));
        assertEquals(HttpStatus.BAD_REQUEST, res.getStatusCode());
        assertEquals("bad_request", res.getBody().get("error"));
        assertEquals("Failed to read HTTP message", res.getBody().get("reason"));
    }

    @Test
    public void unexpectedErrorIs500() {
        ResponseEntity<Map<String, Object>> res = handler.handleOther(new IllegalStateException("boom"));
        assertEquals(500, res.getStatusCode().value());
        assertEquals("server_error", res.getBody().get("error"));
        assertEquals("boom", res.getBody().get("message"));
    }
}
