package com.example.worker.http;

/**
 * A scheduled call that did not succeed: either a non-2xx response or a transport failure.
 */
public class HttpCallException extends Exception {
    /** Status used when no HTTP response was received. */
    public static final int NO_RESPONSE = 0;

    private final int status;
    private final String body;

    public HttpCallException(int status, String body) {
        super("Request failed with status " + status + ": " + body);
        this.status = status;
        this.body = body;
    }

    public HttpCallException(String message, Throwable cause) {
        super(message, cause);
        this.status = NO_RESPONSE;
        this.body = null;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    public boolean isTransportError() {
        return status == NO_RESPONSE;
    }
}
