package com.example.scheduler.api;

import com.example.jobstore.ScheduledJob;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Read-only projection of a stored job for the dashboard.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobView {
    private String jobId;
    private String name;
    private String state;
    private String targetUrl;
    private String method;
    private Instant runAt;
    private Instant createdAt;
    private String claimedBy;
    private Instant finishedAt;
    private Integer resultStatus;
    private String failedReason;

    public JobView() {
    }

    public static JobView of(ScheduledJob job) {
        JobView v = new JobView();
        v.jobId = job.getJobId().toString();
        v.name = job.getName();
        v.state = job.getState().wireName();
        v.targetUrl = job.getPayload().getTargetUrl();
        v.method = job.getPayload().getMethod();
        v.runAt = job.getRunAt();
        v.createdAt = job.getCreatedAt();
        v.claimedBy = job.getClaimedBy();
        v.finishedAt = job.getFinishedAt();
        v.resultStatus = job.getResult() == null ? null : job.getResult().getStatus();
        v.failedReason = job.getFailedReason();
        return v;
    }

    public String getJobId() {
        return jobId;
    }

    public String getName() {
        return name;
    }

    public String getState() {
        return state;
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    public String getMethod() {
        return method;
    }

    public Instant getRunAt() {
        return runAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getClaimedBy() {
        return claimedBy;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Integer getResultStatus() {
        return resultStatus;
    }

    public String getFailedReason() {
        return failedReason;
    }
}
