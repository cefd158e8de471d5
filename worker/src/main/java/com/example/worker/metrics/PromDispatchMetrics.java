package com.example.worker.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

/**
 * Prometheus-backed implementation of DispatchMetrics.
 */
public class PromDispatchMetrics implements DispatchMetrics {
    private final Counter jobsProcessedTotal;
    private final Gauge jobsInProgress;
    private final Histogram jobDurationSeconds;

    public PromDispatchMetrics(CollectorRegistry registry) {
        this.jobsProcessedTotal = Counter.build()
                .name("jobs_processed_total")
                .help("Total jobs processed by status")
                .labelNames("status")
                .register(registry);
        this.jobsInProgress = Gauge.build()
                .name("jobs_in_progress")
                .help("Current jobs in progress")
                .register(registry);
        this.jobDurationSeconds = Histogram.build()
                .name("job_duration_seconds")
                .help("Outbound call duration in seconds")
                .buckets(0.05, 0.1, 0.25, 0.5, 1, 2, 5, 10, 30, 60)
                .register(registry);
    }

    @Override
    public void jobStarted() {
        jobsInProgress.inc();
    }

    @Override
    public void jobFinished(boolean success, double durationSeconds) {
        jobsInProgress.dec();
        jobsProcessedTotal.labels(success ? "success" : "failed").inc();
        jobDurationSeconds.observe(durationSeconds);
    }
}
