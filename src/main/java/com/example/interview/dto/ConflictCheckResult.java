package com.example.interview.dto;

import java.util.List;
import java.util.Map;

public record ConflictCheckResult(boolean success, SchedulingErrorType errorType, List<String> errors,
                                  Map<String, List<ParticipantConflict>> conflicts) {

    public ConflictCheckResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        conflicts = conflicts == null ? Map.of() : Map.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    public static ConflictCheckResult of(Map<String, List<ParticipantConflict>> conflicts) {
        return new ConflictCheckResult(true, null, List.of(), conflicts);
    }

    public static ConflictCheckResult failure(SchedulingErrorType type, List<String> errors) {
        return new ConflictCheckResult(false, type, errors, Map.of());
    }
}
