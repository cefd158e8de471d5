package com.example.scheduler.gateway;

import com.example.scheduler.api.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Lets a request through only when it carries the API key, either as {@code x-api-key} or as
 * {@code Authorization: Bearer <key>}.
 */
public class ApiKeyFilter extends Filter {
    private static final String BEARER = "Bearer ";

    private final byte[] apiKey;
    private final ObjectMapper mapper;

    public ApiKeyFilter(String apiKey, ObjectMapper mapper) {
        this.apiKey = apiKey.getBytes(StandardCharsets.UTF_8);
        this.mapper = mapper;
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        String presented = exchange.getRequestHeaders().getFirst("x-api-key");
        if (presented == null) {
            String auth = exchange.getRequestHeaders().getFirst("Authorization");
            if (auth != null && auth.startsWith(BEARER)) {
                presented = auth.substring(BEARER.length());
            }
        }
        if (presented == null || presented.isEmpty()
                || !MessageDigest.isEqual(apiKey, presented.getBytes(StandardCharsets.UTF_8))) {
            JsonResponses.respondJson(exchange, 401, new ErrorResponse("Unauthorized"), mapper);
            return;
        }
        chain.doFilter(exchange);
    }

    @Override
    public String description() {
        return "API key gate";
    }
}
