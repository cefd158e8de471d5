package com.example.jobstore;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

/**
 * Outcome recorded when a dispatcher finishes a job.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobResult {
    private final UUID jobId;
    private final int status;
    private final String body;

    public JobResult(UUID jobId, int status, String body) {
        this.jobId = jobId;
        this.status = status;
        this.body = body;
    }

    public UUID getJobId() {
        return jobId;
    }

    /** HTTP status of the call, or 0 when the call never produced a response. */
    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "JobResult{jobId=" + jobId + ", status=" + status + "}";
    }
}
