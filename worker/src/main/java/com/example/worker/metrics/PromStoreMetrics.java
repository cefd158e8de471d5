package com.example.worker.metrics;

import com.example.jobstore.StoreMetrics;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;

/**
 * Prometheus-backed implementation of StoreMetrics.
 */
public class PromStoreMetrics implements StoreMetrics {
    private final Counter claimSuccess;
    private final Counter claimConflict;
    private final Histogram lwtLatencySeconds;

    public PromStoreMetrics(CollectorRegistry registry) {
        this.claimSuccess = Counter.build()
                .name("job_claim_success_total")
                .help("Total jobs claimed by this process")
                .register(registry);
        this.claimConflict = Counter.build()
                .name("job_claim_conflict_total")
                .help("Total claim attempts lost to another claimer or a removal")
                .register(registry);
        this.lwtLatencySeconds = Histogram.build()
                .name("lwt_latency_seconds")
                .help("Latency of LWT operations in seconds")
                .buckets(0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0)
                .labelNames("op")
                .register(registry);
    }

    @Override
    public void observeLwtLatencySeconds(String op, double seconds) {
        lwtLatencySeconds.labels(op).observe(seconds);
    }

    @Override
    public void incClaimSuccess() {
        claimSuccess.inc();
    }

    @Override
    public void incClaimConflict() {
        claimConflict.inc();
    }
}
