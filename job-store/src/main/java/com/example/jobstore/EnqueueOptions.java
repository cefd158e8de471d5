package com.example.jobstore;

import java.time.Duration;
import java.util.Objects;

public class EnqueueOptions {
    private final Duration delay;
    private final boolean removeOnComplete;

    public EnqueueOptions(Duration delay, boolean removeOnComplete) {
        this.delay = Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0, got: " + delay);
        }
        this.removeOnComplete = removeOnComplete;
    }

    public static EnqueueOptions delayed(Duration delay) {
        return new EnqueueOptions(delay, true);
    }

    public Duration getDelay() {
        return delay;
    }

    /** When set, the store discards the job as soon as it completes successfully. */
    public boolean isRemoveOnComplete() {
        return removeOnComplete;
    }
}
