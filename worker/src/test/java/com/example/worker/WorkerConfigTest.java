package com.example.worker;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import java.time.Duration;
import java.util.Map;

import org.junit.Test;

public class WorkerConfigTest {

    @Test
    public void defaultsApplyWhenUnset() {
        WorkerConfig c = WorkerConfig.fromEnv(Map.of());
        assertThat(c.getStoreBackend(), is(WorkerConfig.StoreBackend.CASSANDRA));
        assertThat(c.getContactPoint(), is("127.0.0.1"));
        assertThat(c.getCassandraPort(), is(9042));
        assertThat(c.getKeyspace(), is("scheduler"));
        assertThat(c.getBuckets(), is(16));
        assertThat(c.getPollInterval(), is(Duration.ofSeconds(1)));
        assertThat(c.getHttpCallTimeout(), is(Duration.ofSeconds(30)));
        assertThat(c.getWorkerId().startsWith("worker-"), is(true));
    }

    @Test
    public void readsOverrides() {
        WorkerConfig c = WorkerConfig.fromEnv(Map.of(
                "STORE_BACKEND", "memory",
                "CASSANDRA_USERNAME", "app",
                "WORKER_ID", "w-7",
                "WORKER_CONCURRENCY", "9",
                "HTTP_CALL_TIMEOUT_MS", "1500"));
        assertThat(c.getStoreBackend(), is(WorkerConfig.StoreBackend.MEMORY));
        assertThat(c.getCassandraUsername(), is("app"));
        assertThat(c.getWorkerId(), is("w-7"));
        assertThat(c.getConcurrency(), is(9));
        assertThat(c.getHttpCallTimeout(), is(Duration.ofMillis(1500)));
    }

    @Test(expected = IllegalStateException.class)
    public void rejectsUnknownBackend() {
        WorkerConfig.fromEnv(Map.of("STORE_BACKEND", "redis"));
    }

    @Test(expected = IllegalStateException.class)
    public void rejectsNonNumericPort() {
        WorkerConfig.fromEnv(Map.of("CASSANDRA_PORT", "ninety"));
    }

    @Test(expected = IllegalStateException.class)
    public void rejectsZeroConcurrency() {
        WorkerConfig.fromEnv(Map.of("WORKER_CONCURRENCY", "0"));
    }
}
