package com.example.scheduler;

/**
 * A scheduling request was rejected before anything reached the job store.
 */
public class ScheduleValidationException extends IllegalArgumentException {
    private final ErrorCode code;

    public ScheduleValidationException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
