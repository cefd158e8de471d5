package com.example.scheduler.gateway;

import com.example.scheduler.api.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * HTTP Basic gate for the dashboard. Any missing, malformed or wrong credential gets a 401 with
 * a Basic challenge.
 */
public class BasicAuthFilter extends Filter {
    static final String CHALLENGE = "Basic realm=\"Scheduler Dashboard\", charset=\"UTF-8\"";
    private static final String BASIC = "Basic ";

    private final byte[] user;
    private final byte[] password;
    private final ObjectMapper mapper;

    public BasicAuthFilter(String user, String password, ObjectMapper mapper) {
        this.user = user.getBytes(StandardCharsets.UTF_8);
        this.password = password.getBytes(StandardCharsets.UTF_8);
        this.mapper = mapper;
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        if (!authorized(exchange.getRequestHeaders().getFirst("Authorization"))) {
            exchange.getResponseHeaders().set("WWW-Authenticate", CHALLENGE);
            JsonResponses.respondJson(exchange, 401, new ErrorResponse("Unauthorized"), mapper);
            return;
        }
        chain.doFilter(exchange);
    }

    private boolean authorized(String header) {
        if (header == null || !header.startsWith(BASIC)) {
            return false;
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(header.substring(BASIC.length()).trim()),
                    StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return false;
        }
        int sep = decoded.indexOf(':');
        if (sep < 0) {
            return false;
        }
        byte[] u = decoded.substring(0, sep).getBytes(StandardCharsets.UTF_8);
        byte[] p = decoded.substring(sep + 1).getBytes(StandardCharsets.UTF_8);
        // evaluate both so timing does not reveal which one was wrong
        boolean userOk = MessageDigest.isEqual(user, u);
        boolean passwordOk = MessageDigest.isEqual(password, p);
        return userOk && passwordOk;
    }

    @Override
    public String description() {
        return "Dashboard basic auth";
    }
}
