package com.example.interview.dto;

import java.util.List;

public record LifecycleResult(boolean success, SchedulingErrorType errorType, List<String> errors,
                              InterviewDTO interview) {

    public LifecycleResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static LifecycleResult success(InterviewDTO interview) {
        return new LifecycleResult(true, null, List.of(), interview);
    }

    public static LifecycleResult failure(SchedulingErrorType type, String error) {
        return new LifecycleResult(false, type, List.of(error), null);
    }
}
