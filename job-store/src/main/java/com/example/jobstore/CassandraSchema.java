package com.example.jobstore;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the keyspace and tables used by {@link CassandraJobStore} when they are missing.
 */
public final class CassandraSchema {
    private static final Logger log = LoggerFactory.getLogger(CassandraSchema.class);

    static final String CREATE_JOBS = "CREATE TABLE IF NOT EXISTS http_jobs ("
            + "job_id uuid PRIMARY KEY, name text, target_url text, method text, run_at timestamp, "
            + "state text, bucket_id int, remove_on_complete boolean, created_at timestamp, "
            + "claimed_by text, claimed_at timestamp, finished_at timestamp, "
            + "result_status int, result_body text, failed_reason text)";
    static final String CREATE_JOBS_BY_NAME = "CREATE TABLE IF NOT EXISTS http_jobs_by_name ("
            + "name text, job_id uuid, PRIMARY KEY ((name), job_id))";
    static final String CREATE_JOBS_DUE = "CREATE TABLE IF NOT EXISTS http_jobs_due ("
            + "bucket_id int, run_at timestamp, job_id uuid, PRIMARY KEY ((bucket_id), run_at, job_id))";
    static final String CREATE_JOB_LOGS = "CREATE TABLE IF NOT EXISTS http_job_logs ("
            + "job_id uuid, logged_at timeuuid, line text, PRIMARY KEY ((job_id), logged_at))";

    private CassandraSchema() {
    }

    /**
     * Session must not be bound to {@code keyspace} yet, since it may not exist.
     */
    public static void ensureKeyspace(CqlSession session, String keyspace, int replicationFactor) {
        ResultSet rs = session.execute(
                "SELECT keyspace_name FROM system_schema.keyspaces WHERE keyspace_name='" + keyspace + "'");
        if (rs.one() == null) {
            log.info("Keyspace '{}' not found. Creating with replication_factor={}", keyspace, replicationFactor);
            session.execute("CREATE KEYSPACE IF NOT EXISTS " + keyspace
                    + " WITH replication = {'class':'SimpleStrategy','replication_factor':" + replicationFactor + "}");
        }
    }

    /** Session must be bound to the target keyspace. */
    public static void ensureTables(CqlSession session) {
        session.execute(CREATE_JOBS);
        session.execute(CREATE_JOBS_BY_NAME);
        session.execute(CREATE_JOBS_DUE);
        session.execute(CREATE_JOB_LOGS);
    }
}
