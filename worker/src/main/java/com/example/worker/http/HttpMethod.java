package com.example.worker.http;

import java.util.Locale;
import java.util.Optional;

/** Methods a scheduled call may use. */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    /** Case-insensitive lookup; empty for anything outside the supported set. */
    public static Optional<HttpMethod> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (HttpMethod m : values()) {
            if (m.name().equals(normalized)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }
}
