package com.shelfsync.converter.config;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the enqueue endpoints with the configured token, supplied either as
 * {@code Authorization: Bearer <token>} or {@code X-Converter-Token: <token>}.
 * No token configured means no check.
 */
@Component
public class TriggerTokenFilter implements WebFilter {
    static final String TOKEN_HEADER = "X-Converter-Token";

    private final ConverterProperties properties;

    public TriggerTokenFilter(ConverterProperties properties) {
        this.properties = properties;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value().replaceAll("/+$", "");
        boolean guarded = HttpMethod.POST.equals(exchange.getRequest().getMethod())
                && (path.equals("/trigger") || path.equals("/enqueue"));
        String expected = properties.getAuthToken();
        if (!guarded || expected == null || expected.isBlank()) {
            return chain.filter(exchange);
        }

        HttpHeaders headers = exchange.getRequest().getHeaders();
        String auth = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (auth != null && auth.trim().regionMatches(true, 0, "Bearer ", 0, 7)
                && matches(expected.trim(), auth.trim().substring(7).trim())) {
            return chain.filter(exchange);
        }
        String token = headers.getFirst(TOKEN_HEADER);
        if (token != null && matches(expected.trim(), token.trim())) {
            return chain.filter(exchange);
        }
        return unauthorized(exchange.getResponse());
    }

    private static boolean matches(String expected, String supplied) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), supplied.getBytes(StandardCharsets.UTF_8));
    }

    private Mono<Void> unauthorized(ServerHttpResponse response) {
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        response.getHeaders().add(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        DataBuffer body = response.bufferFactory().wrap("{\"status\":\"unauthorized\"}".getBytes(StandardCharsets.UTF_8));
        return response.writeWith(Mono.just(body));
    }
}
