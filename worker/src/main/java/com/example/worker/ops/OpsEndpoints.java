package com.example.worker.ops;

import com.example.jobstore.JobStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.function.BooleanSupplier;

/**
 * Health, readiness and metrics endpoints shared by the scheduler and worker processes.
 */
public final class OpsEndpoints {
    private static final Logger log = LoggerFactory.getLogger(OpsEndpoints.class);

    private OpsEndpoints() {
    }

    public static void register(HttpServer server, JobStore store, BooleanSupplier ready, CollectorRegistry registry) {
        server.createContext("/healthz", exchange -> {
            int code = 200;
            try {
                store.ping();
            } catch (RuntimeException e) {
                log.warn("Health check failed: {}", e.getMessage());
                code = 503;
            }
            respondText(exchange, code, code == 200 ? "OK" : "UNHEALTHY");
        });
        server.createContext("/readyz", exchange -> {
            boolean r = ready.getAsBoolean();
            respondText(exchange, r ? 200 : 503, r ? "READY" : "NOT_READY");
        });
        server.createContext("/metrics", new MetricsHandlerProm(registry));
    }

    public static void respondText(HttpExchange exchange, int code, String body) throws IOException {
        byte[] data = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(code, data.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(data);
        }
    }
}
