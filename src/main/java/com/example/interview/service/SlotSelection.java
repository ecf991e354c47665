package com.example.interview.service;

import com.example.interview.dto.TimeSlot;

import java.util.Collections;
import java.util.List;

public record SlotSelection(List<TimeSlot> ranked) {

    public static final int MAX_ALTERNATES = 3;

    public SlotSelection {
        ranked = ranked == null ? Collections.emptyList() : List.copyOf(ranked);
    }

    public TimeSlot best() {
        return ranked.isEmpty() ? null : ranked.get(0);
    }

    public List<TimeSlot> alternates() {
        if (ranked.size() <= 1) {
            return List.of();
        }
        return ranked.subList(1, Math.min(ranked.size(), 1 + MAX_ALTERNATES));
    }

    /** Ranked slots after the given position, used when the preferred slot is lost at commit time */
    public List<TimeSlot> from(int index) {
        return index >= ranked.size() ? List.of() : ranked.subList(index, ranked.size());
    }
}
