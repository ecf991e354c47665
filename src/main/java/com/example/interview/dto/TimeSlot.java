package com.example.interview.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * Candidate slot. Built by the generation pipeline with its conflicts and participant split, then
 * copied with a score and reasons by the scorer.
 */
@Value
@Builder(toBuilder = true)
public class TimeSlot {

    LocalDateTime start;
    LocalDateTime end;

    double score;

    @Singular
    List<String> conflicts;

    @Singular("participantAvailable")
    Set<String> participantsAvailable;

    @Singular("participantUnavailable")
    Set<String> participantsUnavailable;

    @Singular
    List<String> reasons;

    ScoreBreakdown breakdown;

    public SlotWindow window() {
        return new SlotWindow(start, end);
    }

    public long durationMinutes() {
        return Duration.between(start, end).toMinutes();
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
