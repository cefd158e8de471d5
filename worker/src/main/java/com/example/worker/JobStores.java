package com.example.worker;

import com.example.jobstore.CassandraJobStore;
import com.example.jobstore.InMemoryJobStore;
import com.example.jobstore.JobStore;
import com.example.jobstore.StoreMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

public final class JobStores {
    private static final Logger log = LoggerFactory.getLogger(JobStores.class);

    private JobStores() {
    }

    /** Opens the configured store. Fails fast when Cassandra is unreachable. */
    public static JobStore open(WorkerConfig config, StoreMetrics metrics) {
        switch (config.getStoreBackend()) {
            case MEMORY:
                log.warn("Using in-memory job store: scheduled jobs will not survive a restart");
                return new InMemoryJobStore(Clock.systemUTC(), metrics);
            case CASSANDRA:
                log.info("Connecting to Cassandra at {}:{} keyspace={}", config.getContactPoint(),
                        config.getCassandraPort(), config.getKeyspace());
                return CassandraJobStore.connect(config.getContactPoint(), config.getCassandraPort(),
                        config.getLocalDc(), config.getKeyspace(), config.getCassandraUsername(),
                        config.getCassandraPassword(), config.getReplicationFactor(), config.getBuckets(), metrics);
            default:
                throw new IllegalStateException("unknown store backend " + config.getStoreBackend());
        }
    }
}
