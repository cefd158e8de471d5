package com.example.scheduler;

/**
 * Outcome of cancelling every job registered under one id.
 */
public class RemovalResult {
    private final int removed;
    private final int failed;

    public RemovalResult(int removed, int failed) {
        this.removed = removed;
        this.failed = failed;
    }

    public int getRemoved() {
        return removed;
    }

    /** Matches that could not be removed, typically because a dispatcher already claimed them. */
    public int getFailed() {
        return failed;
    }

    /** True when no job matched the id at all. */
    public boolean isNotFound() {
        return removed == 0 && failed == 0;
    }

    @Override
    public String toString() {
        return "RemovalResult{removed=" + removed + ", failed=" + failed + "}";
    }
}
