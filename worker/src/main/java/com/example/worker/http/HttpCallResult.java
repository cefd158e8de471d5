package com.example.worker.http;

public class HttpCallResult {
    private final int status;
    private final String body;

    public HttpCallResult(int status, String body) {
        this.status = status;
        this.body = body;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "HttpCallResult{status=" + status + "}";
    }
}
