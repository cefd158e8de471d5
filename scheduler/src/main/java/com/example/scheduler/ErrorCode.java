package com.example.scheduler;

public enum ErrorCode {
    MISSING_PARAMETER,
    INVALID_URL,
    UNSUPPORTED_METHOD,
    INVALID_RUN_AT,
    PAST_RUN_AT,
    NON_POSITIVE_DELAY
}
