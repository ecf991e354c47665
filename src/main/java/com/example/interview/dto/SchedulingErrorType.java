package com.example.interview.dto;

public enum SchedulingErrorType {
    VALIDATION_FAILED("validation_failed", false),
    NO_SLOTS_AVAILABLE("no_slots_available", false),
    INTERVIEW_NOT_FOUND("interview_not_found", false),
    CANNOT_RESCHEDULE("cannot_reschedule", false),
    INVALID_TRANSITION("invalid_transition", false),
    SCHEDULING_ERROR("scheduling_error", true),
    AVAILABILITY_GATHER_TIMEOUT("availability_gather_timeout", true);

    private final String code;
    private final boolean retryable;

    SchedulingErrorType(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    public String code() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
