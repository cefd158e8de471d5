package com.example.jobstore;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Job store backed by Cassandra.
 *
 * Tables:
 * - http_jobs: one row per job, the source of truth for its state;
 * - http_jobs_by_name: name to job ids, used for cancellation lookups;
 * - http_jobs_due: pending jobs sharded into buckets and clustered by run_at, polled by dispatchers;
 * - http_job_logs: per-job audit lines.
 *
 * Every write to http_jobs is an LWT conditioned on the current state, so claim, removal and
 * completion of the same job are Paxos-serialized and exactly one of a racing claim/removal wins.
 * Index tables are maintained with plain writes and may briefly point at rows that are gone;
 * readers tolerate that.
 */
public class CassandraJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(CassandraJobStore.class);
    private static final int DUE_BATCH = 32;

    private final CqlSession session;
    private final boolean ownsSession;
    private final int buckets;
    private final Clock clock;
    private final StoreMetrics metrics;
    private final AtomicInteger bucketCursor = new AtomicInteger();

    private final PreparedStatement insertJobStmt;
    private final PreparedStatement insertByNameStmt;
    private final PreparedStatement insertDueStmt;
    private final PreparedStatement selectJobStmt;
    private final PreparedStatement selectIdsByNameStmt;
    private final PreparedStatement selectDueStmt;
    private final PreparedStatement claimStmt;
    private final PreparedStatement deleteIfStateStmt;
    private final PreparedStatement completeStmt;
    private final PreparedStatement failStmt;
    private final PreparedStatement deleteByNameStmt;
    private final PreparedStatement deleteDueStmt;
    private final PreparedStatement insertLogStmt;
    private final PreparedStatement selectLogsStmt;
    private final PreparedStatement deleteLogsStmt;
    private final PreparedStatement selectAllStmt;

    public CassandraJobStore(CqlSession session, int buckets, Clock clock, StoreMetrics metrics) {
        this(session, false, buckets, clock, metrics);
    }

    private CassandraJobStore(CqlSession session, boolean ownsSession, int buckets, Clock clock,
            StoreMetrics metrics) {
        if (buckets < 1) {
            throw new IllegalArgumentException("buckets must be >= 1, got: " + buckets);
        }
        this.session = session;
        this.ownsSession = ownsSession;
        this.buckets = buckets;
        this.clock = clock;
        this.metrics = (metrics == null ? StoreMetrics.noop() : metrics);

        this.insertJobStmt = session.prepare(
                "INSERT INTO http_jobs (job_id, name, target_url, method, run_at, state, bucket_id, remove_on_complete, created_at) "
                        + "VALUES (?, ?, ?, ?, ?, 'pending', ?, ?, ?) IF NOT EXISTS");
        this.insertByNameStmt = session.prepare(
                "INSERT INTO http_jobs_by_name (name, job_id) VALUES (?, ?)");
        this.insertDueStmt = session.prepare(
                "INSERT INTO http_jobs_due (bucket_id, run_at, job_id) VALUES (?, ?, ?)");
        this.selectJobStmt = session.prepare(
                "SELECT * FROM http_jobs WHERE job_id = ?");
        this.selectIdsByNameStmt = session.prepare(
                "SELECT job_id FROM http_jobs_by_name WHERE name = ?");
        this.selectDueStmt = session.prepare(
                "SELECT run_at, job_id FROM http_jobs_due WHERE bucket_id = ? AND run_at <= ? LIMIT " + DUE_BATCH);
        this.claimStmt = session.prepare(
                "UPDATE http_jobs SET state = 'active', claimed_by = ?, claimed_at = ? WHERE job_id = ? IF state = 'pending'");
        this.deleteIfStateStmt = session.prepare(
                "DELETE FROM http_jobs WHERE job_id = ? IF state = ?");
        this.completeStmt = session.prepare(
                "UPDATE http_jobs SET state = 'completed', finished_at = ?, result_status = ?, result_body = ? "
                        + "WHERE job_id = ? IF state = 'active'");
        this.failStmt = session.prepare(
                "UPDATE http_jobs SET state = 'failed', finished_at = ?, result_status = ?, result_body = ?, failed_reason = ? "
                        + "WHERE job_id = ? IF state = 'active'");
        this.deleteByNameStmt = session.prepare(
                "DELETE FROM http_jobs_by_name WHERE name = ? AND job_id = ?");
        this.deleteDueStmt = session.prepare(
                "DELETE FROM http_jobs_due WHERE bucket_id = ? AND run_at = ? AND job_id = ?");
        this.insertLogStmt = session.prepare(
                "INSERT INTO http_job_logs (job_id, logged_at, line) VALUES (?, now(), ?)");
        this.selectLogsStmt = session.prepare(
                "SELECT line FROM http_job_logs WHERE job_id = ?");
        this.deleteLogsStmt = session.prepare(
                "DELETE FROM http_job_logs WHERE job_id = ?");
        this.selectAllStmt = session.prepare(
                "SELECT * FROM http_jobs");
    }

    /**
     * Connects to Cassandra, creates the keyspace and tables if needed and returns a store that
     * closes the session on {@link #close()}.
     */
    public static CassandraJobStore connect(String contactPoint, int port, String localDc, String keyspace,
            String username, String password, int replicationFactor, int buckets, StoreMetrics metrics) {
        try (CqlSession bootstrap = sessionBuilder(contactPoint, port, localDc, username, password).build()) {
            CassandraSchema.ensureKeyspace(bootstrap, keyspace, replicationFactor);
        }
        // Rebuild session bound to keyspace to avoid runtime keyspace change warnings
        CqlSession session = sessionBuilder(contactPoint, port, localDc, username, password)
                .withKeyspace(keyspace)
                .build();
        try {
            CassandraSchema.ensureTables(session);
            return new CassandraJobStore(session, true, buckets, Clock.systemUTC(), metrics);
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }
    }

    private static CqlSessionBuilder sessionBuilder(String contactPoint, int port, String localDc,
            String username, String password) {
        CqlSessionBuilder b = CqlSession.builder()
                .addContactPoint(new InetSocketAddress(contactPoint, port))
                .withLocalDatacenter(localDc);
        if (username != null && !username.isBlank()) {
            b = b.withAuthCredentials(username, password == null ? "" : password);
        }
        return b;
    }

    @Override
    public ScheduledJob enqueue(String name, JobPayload payload, EnqueueOptions options) {
        UUID jobId = UUID.randomUUID();
        Instant now = clock.instant();
        Instant runAt = now.plus(options.getDelay());
        int bucket = bucketOf(jobId);

        long t0 = System.nanoTime();
        ResultSet rs = session.execute(insertJobStmt.bind(jobId, name, payload.getTargetUrl(), payload.getMethod(),
                runAt, bucket, options.isRemoveOnComplete(), now));
        metrics.observeLwtLatencySeconds("enqueue.insert", elapsedSeconds(t0));
        if (!rs.wasApplied()) {
            throw new IllegalStateException("job id collision: " + jobId);
        }
        session.execute(insertByNameStmt.bind(name, jobId));
        session.execute(insertDueStmt.bind(bucket, runAt, jobId));

        return ScheduledJob.builder()
                .jobId(jobId)
                .name(name)
                .payload(payload)
                .runAt(runAt)
                .state(JobState.PENDING)
                .createdAt(now)
                .removeOnComplete(options.isRemoveOnComplete())
                .build();
    }

    @Override
    public List<ScheduledJob> findByName(String name, Set<JobState> states) {
        List<ScheduledJob> out = new ArrayList<>();
        for (Row idRow : session.execute(selectIdsByNameStmt.bind(name))) {
            UUID jobId = idRow.getUuid("job_id");
            get(jobId).filter(j -> states.contains(j.getState())).ifPresent(out::add);
        }
        return out;
    }

    @Override
    public Optional<ScheduledJob> get(UUID jobId) {
        Row r = session.execute(selectJobStmt.bind(jobId)).one();
        return r == null || r.isNull("state") ? Optional.empty() : Optional.of(toJob(r));
    }

    @Override
    public List<ScheduledJob> list(Set<JobState> states, int limit) {
        // state filtering is done client-side to avoid ALLOW FILTERING
        List<ScheduledJob> out = new ArrayList<>();
        for (Row r : session.execute(selectAllStmt.bind())) {
            if (r.isNull("state")) {
                continue;
            }
            ScheduledJob job = toJob(r);
            if (states.contains(job.getState())) {
                out.add(job);
            }
        }
        out.sort(Comparator.comparing(ScheduledJob::getRunAt));
        return out.size() > limit ? new ArrayList<>(out.subList(0, Math.max(0, limit))) : out;
    }

    @Override
    public Map<JobState, Long> counts() {
        Map<JobState, Long> counts = new EnumMap<>(JobState.class);
        for (JobState s : JobState.values()) {
            counts.put(s, 0L);
        }
        for (Row r : session.execute(selectAllStmt.bind())) {
            if (!r.isNull("state")) {
                counts.merge(JobState.fromWireName(r.getString("state")), 1L, Long::sum);
            }
        }
        return counts;
    }

    @Override
    public RemoveOutcome remove(UUID jobId) {
        Optional<ScheduledJob> current = get(jobId);
        if (current.isEmpty()) {
            return RemoveOutcome.MISSING;
        }
        ScheduledJob job = current.get();
        if (job.getState() == JobState.ACTIVE) {
            return RemoveOutcome.LOCKED;
        }

        long t0 = System.nanoTime();
        ResultSet rs = session.execute(deleteIfStateStmt.bind(jobId, job.getState().wireName()));
        metrics.observeLwtLatencySeconds("remove.delete", elapsedSeconds(t0));
        if (!rs.wasApplied()) {
            // lost the race: either claimed by a dispatcher or already gone
            Row now = rs.one();
            String state = (now == null || !now.getColumnDefinitions().contains("state") || now.isNull("state"))
                    ? null
                    : now.getString("state");
            return JobState.ACTIVE.wireName().equals(state) ? RemoveOutcome.LOCKED : RemoveOutcome.MISSING;
        }
        dropIndexes(job);
        return RemoveOutcome.REMOVED;
    }

    @Override
    public Optional<ScheduledJob> claimNext(String workerId) {
        for (int i = 0; i < buckets; i++) {
            int bucket = Math.floorMod(bucketCursor.getAndIncrement(), buckets);
            Optional<ScheduledJob> claimed = claimFromBucket(bucket, workerId);
            if (claimed.isPresent()) {
                return claimed;
            }
        }
        return Optional.empty();
    }

    private Optional<ScheduledJob> claimFromBucket(int bucket, String workerId) {
        Instant now = clock.instant();
        ResultSet due = session.execute(selectDueStmt.bind(bucket, now));
        for (Row row : due) {
            UUID jobId = row.getUuid("job_id");
            Instant runAt = row.getInstant("run_at");

            long t0 = System.nanoTime();
            ResultSet rs = session.execute(claimStmt.bind(workerId, now, jobId));
            metrics.observeLwtLatencySeconds("claim.update", elapsedSeconds(t0));
            // the due entry is stale whether we won or not: the job is no longer pending
            session.execute(deleteDueStmt.bind(bucket, runAt, jobId));
            if (!rs.wasApplied()) {
                metrics.incClaimConflict();
                continue;
            }
            metrics.incClaimSuccess();
            Optional<ScheduledJob> job = get(jobId);
            if (job.isPresent()) {
                return job;
            }
            log.warn("Claimed job {} disappeared before it could be loaded", jobId);
        }
        return Optional.empty();
    }

    @Override
    public void complete(UUID jobId, JobResult result) {
        ScheduledJob job = get(jobId).orElseThrow(() -> new IllegalStateException("job " + jobId + " not found"));
        if (job.isRemoveOnComplete()) {
            ResultSet rs = session.execute(deleteIfStateStmt.bind(jobId, JobState.ACTIVE.wireName()));
            requireApplied(rs, jobId);
            dropIndexes(job);
            return;
        }
        ResultSet rs = session.execute(completeStmt.bind(clock.instant(), result.getStatus(), result.getBody(), jobId));
        requireApplied(rs, jobId);
    }

    @Override
    public void fail(UUID jobId, JobResult result, String reason) {
        ResultSet rs = session.execute(failStmt.bind(clock.instant(), result.getStatus(), result.getBody(), reason,
                jobId));
        requireApplied(rs, jobId);
    }

    @Override
    public void appendLog(UUID jobId, String line) {
        session.execute(insertLogStmt.bind(jobId, line));
    }

    @Override
    public List<String> logs(UUID jobId) {
        List<String> out = new ArrayList<>();
        for (Row r : session.execute(selectLogsStmt.bind(jobId))) {
            out.add(r.getString("line"));
        }
        return out;
    }

    @Override
    public void ping() {
        session.execute("SELECT now() FROM system.local");
    }

    @Override
    public void close() {
        if (ownsSession) {
            session.close();
        }
    }

    int bucketOf(UUID jobId) {
        return Math.floorMod(jobId.hashCode(), buckets);
    }

    private void dropIndexes(ScheduledJob job) {
        session.execute(deleteByNameStmt.bind(job.getName(), job.getJobId()));
        session.execute(deleteDueStmt.bind(bucketOf(job.getJobId()), job.getRunAt(), job.getJobId()));
        session.execute(deleteLogsStmt.bind(job.getJobId()));
    }

    private static void requireApplied(ResultSet rs, UUID jobId) {
        if (!rs.wasApplied()) {
            throw new IllegalStateException("job " + jobId + " is not active");
        }
    }

    private static ScheduledJob toJob(Row r) {
        JobResult result = null;
        if (!r.isNull("result_status")) {
            result = new JobResult(r.getUuid("job_id"), r.getInt("result_status"), r.getString("result_body"));
        }
        return ScheduledJob.builder()
                .jobId(r.getUuid("job_id"))
                .name(r.getString("name"))
                .payload(new JobPayload(r.getString("target_url"), r.getString("method")))
                .runAt(r.getInstant("run_at"))
                .state(JobState.fromWireName(r.getString("state")))
                .createdAt(r.getInstant("created_at"))
                .removeOnComplete(!r.isNull("remove_on_complete") && r.getBoolean("remove_on_complete"))
                .claimedBy(r.getString("claimed_by"))
                .finishedAt(r.getInstant("finished_at"))
                .result(result)
                .failedReason(r.getString("failed_reason"))
                .build();
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
