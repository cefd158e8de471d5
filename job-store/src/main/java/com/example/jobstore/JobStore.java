package com.example.jobstore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Durable queue of timed jobs.
 *
 * Implementations must guarantee that:
 * - a job is never returned by {@link #claimNext(String)} before its run-at instant;
 * - a pending job is claimed by at most one caller, across processes;
 * - a claimed (active) job cannot be removed; a concurrent claim and removal of the same job
 *   resolve to exactly one winner.
 */
public interface JobStore extends AutoCloseable {

    /** Stores a new pending job that becomes claimable once {@code options.getDelay()} has elapsed. */
    ScheduledJob enqueue(String name, JobPayload payload, EnqueueOptions options);

    /** All jobs called {@code name} that are currently in one of {@code states}. */
    List<ScheduledJob> findByName(String name, Set<JobState> states);

    Optional<ScheduledJob> get(UUID jobId);

    /** Up to {@code limit} jobs in {@code states}, ordered by run-at. */
    List<ScheduledJob> list(Set<JobState> states, int limit);

    Map<JobState, Long> counts();

    RemoveOutcome remove(UUID jobId);

    /** Atomically moves one due pending job to {@link JobState#ACTIVE} on behalf of {@code workerId}. */
    Optional<ScheduledJob> claimNext(String workerId);

    void complete(UUID jobId, JobResult result);

    void fail(UUID jobId, JobResult result, String reason);

    void appendLog(UUID jobId, String line);

    List<String> logs(UUID jobId);

    /** Throws if the backing store is unreachable. */
    void ping();

    @Override
    void close();
}
