package com.example.jobstore;

public enum RemoveOutcome {
    /** The job was deleted from the store. */
    REMOVED,
    /** The job is held by a dispatcher and cannot be removed. */
    LOCKED,
    /** The job no longer exists. */
    MISSING
}
