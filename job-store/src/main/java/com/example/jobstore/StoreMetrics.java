package com.example.jobstore;

/**
 * Minimal metrics hook for job stores. Default is no-op.
 */
public interface StoreMetrics {
    void observeLwtLatencySeconds(String op, double seconds);

    void incClaimSuccess();

    void incClaimConflict();

    static StoreMetrics noop() {
        return new StoreMetrics() {
            public void observeLwtLatencySeconds(String op, double seconds) {
            }

            public void incClaimSuccess() {
            }

            public void incClaimConflict() {
            }
        };
    }
}
