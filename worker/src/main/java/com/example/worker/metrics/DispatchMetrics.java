package com.example.worker.metrics;

/**
 * Minimal metrics hook for the dispatcher. Default is no-op.
 */
public interface DispatchMetrics {
    void jobStarted();

    void jobFinished(boolean success, double durationSeconds);

    static DispatchMetrics noop() {
        return new DispatchMetrics() {
            public void jobStarted() {
            }

            public void jobFinished(boolean success, double durationSeconds) {
            }
        };
    }
}
