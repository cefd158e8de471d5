package com.example.worker;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Store and dispatcher settings, read once from environment-style variables.
 */
public class WorkerConfig {
    public enum StoreBackend {
        CASSANDRA,
        MEMORY
    }

    private final StoreBackend storeBackend;
    private final String contactPoint;
    private final int cassandraPort;
    private final String cassandraUsername;
    private final String cassandraPassword;
    private final String keyspace;
    private final String localDc;
    private final int replicationFactor;
    private final int buckets;
    private final String workerId;
    private final Duration pollInterval;
    private final int concurrency;
    private final Duration httpCallTimeout;
    private final int workerHttpPort;

    private WorkerConfig(Map<String, String> env) {
        this.storeBackend = parseBackend(get(env, "STORE_BACKEND", "cassandra"));
        this.contactPoint = get(env, "CASSANDRA_CONTACT_POINT", "127.0.0.1");
        this.cassandraPort = intValue(env, "CASSANDRA_PORT", 9042);
        this.cassandraUsername = get(env, "CASSANDRA_USERNAME", null);
        this.cassandraPassword = get(env, "CASSANDRA_PASSWORD", null);
        this.keyspace = get(env, "CASSANDRA_KEYSPACE", "scheduler");
        this.localDc = get(env, "CASS_LOCAL_DC", "DC1");
        this.replicationFactor = positive(env, "CASSANDRA_REPLICATION_FACTOR", 1);
        this.buckets = positive(env, "STORE_BUCKETS", 16);
        this.workerId = get(env, "WORKER_ID", "worker-" + UUID.randomUUID());
        this.pollInterval = Duration.ofMillis(positive(env, "WORKER_POLL_INTERVAL_MS", 1000));
        this.concurrency = positive(env, "WORKER_CONCURRENCY", 4);
        this.httpCallTimeout = Duration.ofMillis(positive(env, "HTTP_CALL_TIMEOUT_MS", 30000));
        this.workerHttpPort = intValue(env, "WORKER_HTTP_PORT", 8080);
    }

    public static WorkerConfig fromEnv(Map<String, String> env) {
        return new WorkerConfig(env);
    }

    public static WorkerConfig fromSystemEnv() {
        return new WorkerConfig(System.getenv());
    }

    static String get(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    static int intValue(Map<String, String> env, String key, int defaultValue) {
        String v = get(env, key, null);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be an integer, got: " + v, e);
        }
    }

    static int positive(Map<String, String> env, String key, int defaultValue) {
        int v = intValue(env, key, defaultValue);
        if (v < 1) {
            throw new IllegalStateException(key + " must be >= 1, got: " + v);
        }
        return v;
    }

    private static StoreBackend parseBackend(String value) {
        try {
            return StoreBackend.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("STORE_BACKEND must be 'cassandra' or 'memory', got: " + value, e);
        }
    }

    public StoreBackend getStoreBackend() {
        return storeBackend;
    }

    public String getContactPoint() {
        return contactPoint;
    }

    public int getCassandraPort() {
        return cassandraPort;
    }

    public String getCassandraUsername() {
        return cassandraUsername;
    }

    public String getCassandraPassword() {
        return cassandraPassword;
    }

    public String getKeyspace() {
        return keyspace;
    }

    public String getLocalDc() {
        return localDc;
    }

    public int getReplicationFactor() {
        return replicationFactor;
    }

    public int getBuckets() {
        return buckets;
    }

    public String getWorkerId() {
        return workerId;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public Duration getHttpCallTimeout() {
        return httpCallTimeout;
    }

    public int getWorkerHttpPort() {
        return workerHttpPort;
    }
}
