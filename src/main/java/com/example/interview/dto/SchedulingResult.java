package com.example.interview.dto;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one ScheduleInterview call. On failure only errorType, errors and metadata are set.
 */
public record SchedulingResult(boolean success,
                               SchedulingErrorType errorType,
                               List<String> errors,
                               InterviewDTO interview,
                               SlotDetails slotDetails,
                               List<AlternativeSlot> alternatives,
                               SchedulingMetadata metadata) {

    public SchedulingResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public static SchedulingResult success(InterviewDTO interview, SlotDetails details,
                                           List<AlternativeSlot> alternatives, SchedulingMetadata metadata) {
        return new SchedulingResult(true, null, List.of(), interview, details, alternatives, metadata);
    }

    public static SchedulingResult failure(SchedulingErrorType type, List<String> errors, Instant timestamp) {
        return new SchedulingResult(false, type, errors, null, null, List.of(),
                new SchedulingMetadata(0, 0, null, timestamp));
    }
}
