package com.example.interview.dto;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Half-open interval [start, end).
 */
public record SlotWindow(LocalDateTime start, LocalDateTime end) {

    public SlotWindow {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
    }

    public boolean overlaps(LocalDateTime otherStart, LocalDateTime otherEnd) {
        return start.isBefore(otherEnd) && otherStart.isBefore(end);
    }

    public boolean overlaps(SlotWindow other) {
        return overlaps(other.start(), other.end());
    }
}
