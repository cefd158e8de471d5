package com.example.worker.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * Performs exactly one outbound request per call. No body, no custom headers, no retry, no
 * redirects. Each request is bounded by {@code requestTimeout} so a hung target cannot hold a
 * dispatcher slot forever.
 */
public class HttpCaller {
    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpCaller(Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(requestTimeout)
                .build(), requestTimeout);
    }

    public HttpCaller(HttpClient client, Duration requestTimeout) {
        this.client = client;
        this.requestTimeout = requestTimeout;
    }

    public HttpCallResult call(String targetUrl, HttpMethod method) throws HttpCallException {
        URI uri = toHttpUri(targetUrl);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .method(method.name(), HttpRequest.BodyPublishers.noBody())
                .timeout(requestTimeout)
                .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new HttpCallException(method + " " + targetUrl + " failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpCallException(method + " " + targetUrl + " interrupted", e);
        }

        int status = response.statusCode();
        String body = response.body() == null ? "" : response.body();
        if (status >= 200 && status < 300) {
            return new HttpCallResult(status, body);
        }
        throw new HttpCallException(status, body);
    }

    static URI toHttpUri(String targetUrl) throws HttpCallException {
        URI uri;
        try {
            uri = URI.create(targetUrl);
        } catch (IllegalArgumentException e) {
            throw new HttpCallException("Invalid target URL " + targetUrl, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new HttpCallException("Unsupported URL scheme '" + scheme + "' in " + targetUrl, null);
        }
        if (uri.getHost() == null) {
            throw new HttpCallException("Target URL has no host: " + targetUrl, null);
        }
        return uri;
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
