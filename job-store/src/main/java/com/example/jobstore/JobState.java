package com.example.jobstore;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle state of a stored job. Owned by the {@link JobStore}; callers only observe it.
 */
public enum JobState {
    PENDING,
    ACTIVE,
    COMPLETED,
    FAILED;

    /** States a job can still be found in before it has finished running. */
    public static final Set<JobState> NON_TERMINAL = EnumSet.of(PENDING, ACTIVE);

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobState fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("job state is required");
        }
        return JobState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
