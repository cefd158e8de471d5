package com.example.scheduler.gateway;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;

import java.io.IOException;

/**
 * Request and scheduling counters for the gateway.
 */
public class GatewayMetrics {
    private final Counter httpRequestsTotal;
    private final Counter jobsScheduledTotal;
    private final Counter jobsRemovedTotal;

    public GatewayMetrics(CollectorRegistry registry) {
        this.httpRequestsTotal = Counter.build()
                .name("scheduler_http_requests_total")
                .help("Scheduler HTTP requests")
                .labelNames("path", "method", "status")
                .register(registry);
        this.jobsScheduledTotal = Counter.build()
                .name("jobs_scheduled_total")
                .help("Jobs accepted by add-job")
                .register(registry);
        this.jobsRemovedTotal = Counter.build()
                .name("jobs_removed_total")
                .help("Jobs targeted by delete-job, by outcome")
                .labelNames("outcome")
                .register(registry);
    }

    public void jobScheduled() {
        jobsScheduledTotal.inc();
    }

    public void jobsRemoved(int removed, int failed) {
        jobsRemovedTotal.labels("removed").inc(removed);
        jobsRemovedTotal.labels("failed").inc(failed);
    }

    /** Counts every request passing through a context once its response code is known. */
    public Filter requestCounter() {
        return new Filter() {
            @Override
            public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
                try {
                    chain.doFilter(exchange);
                } finally {
                    httpRequestsTotal.labels(normalizePath(exchange.getRequestURI().getPath()),
                            exchange.getRequestMethod(), String.valueOf(exchange.getResponseCode())).inc();
                }
            }

            @Override
            public String description() {
                return "Request counter";
            }
        };
    }

    static String normalizePath(String rawPath) {
        if (rawPath == null) {
            return "";
        }
        if (rawPath.startsWith("/dashboard/jobs/") && rawPath.endsWith("/logs")) {
            return "/dashboard/jobs/:id/logs";
        }
        return rawPath;
    }
}
