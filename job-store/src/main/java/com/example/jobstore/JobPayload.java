package com.example.jobstore;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Data persisted with every job: where to call and with which HTTP method.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobPayload {
    private final String targetUrl;
    private final String method;

    public JobPayload(String targetUrl, String method) {
        this.targetUrl = Objects.requireNonNull(targetUrl, "targetUrl");
        this.method = Objects.requireNonNull(method, "method");
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    public String getMethod() {
        return method;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JobPayload)) {
            return false;
        }
        JobPayload that = (JobPayload) o;
        return targetUrl.equals(that.targetUrl) && method.equals(that.method);
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetUrl, method);
    }

    @Override
    public String toString() {
        return "JobPayload{targetUrl=" + targetUrl + ", method=" + method + "}";
    }
}
