package com.example.interview.dto;

import java.util.List;

public record RescheduleResult(boolean success,
                               SchedulingErrorType errorType,
                               List<String> errors,
                               Long originalInterviewId,
                               InterviewDTO newInterview,
                               String rescheduleReason,
                               int rescheduleCount) {

    public RescheduleResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static RescheduleResult success(Long originalId, InterviewDTO newInterview, String reason, int count) {
        return new RescheduleResult(true, null, List.of(), originalId, newInterview, reason, count);
    }

    public static RescheduleResult failure(Long originalId, SchedulingErrorType type, List<String> errors) {
        return new RescheduleResult(false, type, errors, originalId, null, null, 0);
    }
}
