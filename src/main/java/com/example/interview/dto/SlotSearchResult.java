package com.example.interview.dto;

import java.util.List;

public record SlotSearchResult(boolean success, SchedulingErrorType errorType, List<String> errors,
                               List<TimeSlot> slots, int slotsEvaluated) {

    public SlotSearchResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        slots = slots == null ? List.of() : List.copyOf(slots);
    }

    public static SlotSearchResult found(List<TimeSlot> slots, int slotsEvaluated) {
        return new SlotSearchResult(true, null, List.of(), slots, slotsEvaluated);
    }

    public static SlotSearchResult failure(SchedulingErrorType type, List<String> errors) {
        return new SlotSearchResult(false, type, errors, List.of(), 0);
    }
}
