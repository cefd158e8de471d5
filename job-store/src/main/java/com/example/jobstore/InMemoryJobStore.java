package com.example.jobstore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Process-local job store. All operations are serialized on the instance monitor, which gives
 * the same claim/remove exclusivity the Cassandra store gets from LWT, but nothing survives a
 * restart.
 */
public class InMemoryJobStore implements JobStore {
    private static final Comparator<Entry> DUE_ORDER = Comparator
            .comparing((Entry e) -> e.job.getRunAt())
            .thenComparingLong(e -> e.seq);

    private final Clock clock;
    private final StoreMetrics metrics;
    private final Map<UUID, Entry> jobs = new LinkedHashMap<>();
    private long nextSeq;

    public InMemoryJobStore() {
        this(Clock.systemUTC(), StoreMetrics.noop());
    }

    public InMemoryJobStore(Clock clock) {
        this(clock, StoreMetrics.noop());
    }

    public InMemoryJobStore(Clock clock, StoreMetrics metrics) {
        this.clock = clock;
        this.metrics = (metrics == null ? StoreMetrics.noop() : metrics);
    }

    @Override
    public synchronized ScheduledJob enqueue(String name, JobPayload payload, EnqueueOptions options) {
        Instant now = clock.instant();
        ScheduledJob job = ScheduledJob.builder()
                .jobId(UUID.randomUUID())
                .name(name)
                .payload(payload)
                .runAt(now.plus(options.getDelay()))
                .state(JobState.PENDING)
                .createdAt(now)
                .removeOnComplete(options.isRemoveOnComplete())
                .build();
        jobs.put(job.getJobId(), new Entry(job, nextSeq++));
        return job;
    }

    @Override
    public synchronized List<ScheduledJob> findByName(String name, Set<JobState> states) {
        List<ScheduledJob> out = new ArrayList<>();
        for (Entry e : jobs.values()) {
            if (e.job.getName().equals(name) && states.contains(e.job.getState())) {
                out.add(e.job);
            }
        }
        return out;
    }

    @Override
    public synchronized Optional<ScheduledJob> get(UUID jobId) {
        Entry e = jobs.get(jobId);
        return e == null ? Optional.empty() : Optional.of(e.job);
    }

    @Override
    public synchronized List<ScheduledJob> list(Set<JobState> states, int limit) {
        return jobs.values().stream()
                .filter(e -> states.contains(e.job.getState()))
                .sorted(DUE_ORDER)
                .limit(Math.max(0, limit))
                .map(e -> e.job)
                .toList();
    }

    @Override
    public synchronized Map<JobState, Long> counts() {
        Map<JobState, Long> counts = new EnumMap<>(JobState.class);
        for (JobState s : JobState.values()) {
            counts.put(s, 0L);
        }
        for (Entry e : jobs.values()) {
            counts.merge(e.job.getState(), 1L, Long::sum);
        }
        return counts;
    }

    @Override
    public synchronized RemoveOutcome remove(UUID jobId) {
        Entry e = jobs.get(jobId);
        if (e == null) {
            return RemoveOutcome.MISSING;
        }
        if (e.job.getState() == JobState.ACTIVE) {
            return RemoveOutcome.LOCKED;
        }
        jobs.remove(jobId);
        return RemoveOutcome.REMOVED;
    }

    @Override
    public synchronized Optional<ScheduledJob> claimNext(String workerId) {
        Instant now = clock.instant();
        Optional<Entry> due = jobs.values().stream()
                .filter(e -> e.job.getState() == JobState.PENDING)
                .filter(e -> !e.job.getRunAt().isAfter(now))
                .min(DUE_ORDER);
        if (due.isEmpty()) {
            return Optional.empty();
        }
        Entry e = due.get();
        e.job = e.job.toBuilder().state(JobState.ACTIVE).claimedBy(workerId).build();
        metrics.incClaimSuccess();
        return Optional.of(e.job);
    }

    @Override
    public synchronized void complete(UUID jobId, JobResult result) {
        Entry e = activeEntry(jobId);
        if (e.job.isRemoveOnComplete()) {
            jobs.remove(jobId);
            return;
        }
        e.job = e.job.toBuilder()
                .state(JobState.COMPLETED)
                .finishedAt(clock.instant())
                .result(result)
                .build();
    }

    @Override
    public synchronized void fail(UUID jobId, JobResult result, String reason) {
        Entry e = activeEntry(jobId);
        e.job = e.job.toBuilder()
                .state(JobState.FAILED)
                .finishedAt(clock.instant())
                .result(result)
                .failedReason(reason)
                .build();
    }

    @Override
    public synchronized void appendLog(UUID jobId, String line) {
        Entry e = jobs.get(jobId);
        if (e != null) {
            e.logs.add(line);
        }
    }

    @Override
    public synchronized List<String> logs(UUID jobId) {
        Entry e = jobs.get(jobId);
        return e == null ? List.of() : List.copyOf(e.logs);
    }

    @Override
    public void ping() {
    }

    @Override
    public synchronized void close() {
        jobs.clear();
    }

    private Entry activeEntry(UUID jobId) {
        Entry e = jobs.get(jobId);
        if (e == null || e.job.getState() != JobState.ACTIVE) {
            throw new IllegalStateException("job " + jobId + " is not active");
        }
        return e;
    }

    private static final class Entry {
        private ScheduledJob job;
        private final long seq;
        private final List<String> logs = new ArrayList<>();

        Entry(ScheduledJob job, long seq) {
            this.job = job;
            this.seq = seq;
        }
    }
}
