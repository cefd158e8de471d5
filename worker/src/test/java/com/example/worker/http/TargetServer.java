package com.example.worker.http;

import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;

/**
 * Local HTTP endpoint that records what it receives. {@code /status/<code>} answers with that
 * code and body {@code "status <code>"}; {@code /slow} never answers within a test's timeout.
 */
public final class TargetServer implements AutoCloseable {
    private final HttpServer server;
    private final List<String> received = new CopyOnWriteArrayList<>();
    private final List<Integer> requestBodySizes = new CopyOnWriteArrayList<>();

    public TargetServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/status/", exchange -> {
            received.add(exchange.getRequestMethod() + " " + exchange.getRequestURI());
            try (InputStream is = exchange.getRequestBody()) {
                requestBodySizes.add(is.readAllBytes().length);
            }
            String path = exchange.getRequestURI().getPath();
            int code = Integer.parseInt(path.substring("/status/".length()));
            byte[] body = ("status " + code).getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(code, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.createContext("/slow", exchange -> {
            received.add(exchange.getRequestMethod() + " " + exchange.getRequestURI());
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.setExecutor(Executors.newCachedThreadPool());
        server.start();
    }

    public String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    public List<String> received() {
        return received;
    }

    public List<Integer> requestBodySizes() {
        return requestBodySizes;
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
