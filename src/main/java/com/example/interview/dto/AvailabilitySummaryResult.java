package com.example.interview.dto;

import java.util.List;

public record AvailabilitySummaryResult(boolean success, SchedulingErrorType errorType, List<String> errors,
                                        List<AvailabilitySummary> summaries) {

    public AvailabilitySummaryResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        summaries = summaries == null ? List.of() : List.copyOf(summaries);
    }

    public static AvailabilitySummaryResult of(List<AvailabilitySummary> summaries) {
        return new AvailabilitySummaryResult(true, null, List.of(), summaries);
    }

    public static AvailabilitySummaryResult failure(SchedulingErrorType type, List<String> errors) {
        return new AvailabilitySummaryResult(false, type, errors, List.of());
    }
}
