package com.example.jobstore;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Snapshot of a job as held by a {@link JobStore}. Instances are immutable; state changes
 * produce a new snapshot through the store.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScheduledJob {
    private final UUID jobId;
    private final String name;
    private final JobPayload payload;
    private final Instant runAt;
    private final JobState state;
    private final Instant createdAt;
    private final boolean removeOnComplete;
    private final String claimedBy;
    private final Instant finishedAt;
    private final JobResult result;
    private final String failedReason;

    private ScheduledJob(Builder b) {
        this.jobId = Objects.requireNonNull(b.jobId, "jobId");
        this.name = Objects.requireNonNull(b.name, "name");
        this.payload = Objects.requireNonNull(b.payload, "payload");
        this.runAt = Objects.requireNonNull(b.runAt, "runAt");
        this.state = Objects.requireNonNull(b.state, "state");
        this.createdAt = b.createdAt;
        this.removeOnComplete = b.removeOnComplete;
        this.claimedBy = b.claimedBy;
        this.finishedAt = b.finishedAt;
        this.result = b.result;
        this.failedReason = b.failedReason;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.jobId = jobId;
        b.name = name;
        b.payload = payload;
        b.runAt = runAt;
        b.state = state;
        b.createdAt = createdAt;
        b.removeOnComplete = removeOnComplete;
        b.claimedBy = claimedBy;
        b.finishedAt = finishedAt;
        b.result = result;
        b.failedReason = failedReason;
        return b;
    }

    public UUID getJobId() {
        return jobId;
    }

    public String getName() {
        return name;
    }

    public JobPayload getPayload() {
        return payload;
    }

    public Instant getRunAt() {
        return runAt;
    }

    public JobState getState() {
        return state;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isRemoveOnComplete() {
        return removeOnComplete;
    }

    public String getClaimedBy() {
        return claimedBy;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public JobResult getResult() {
        return result;
    }

    public String getFailedReason() {
        return failedReason;
    }

    @Override
    public String toString() {
        return "ScheduledJob{jobId=" + jobId + ", name=" + name + ", state=" + state + ", runAt=" + runAt + "}";
    }

    public static class Builder {
        private UUID jobId;
        private String name;
        private JobPayload payload;
        private Instant runAt;
        private JobState state = JobState.PENDING;
        private Instant createdAt;
        private boolean removeOnComplete;
        private String claimedBy;
        private Instant finishedAt;
        private JobResult result;
        private String failedReason;

        public Builder jobId(UUID jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder payload(JobPayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder runAt(Instant runAt) {
            this.runAt = runAt;
            return this;
        }

        public Builder state(JobState state) {
            this.state = state;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder removeOnComplete(boolean removeOnComplete) {
            this.removeOnComplete = removeOnComplete;
            return this;
        }

        public Builder claimedBy(String claimedBy) {
            this.claimedBy = claimedBy;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder result(JobResult result) {
            this.result = result;
            return this;
        }

        public Builder failedReason(String failedReason) {
            this.failedReason = failedReason;
            return this;
        }

        public ScheduledJob build() {
            return new ScheduledJob(this);
        }
    }
}
