package com.example.interview.dto;

import java.time.LocalDateTime;
import java.util.List;

public record AlternativeSlot(LocalDateTime start, LocalDateTime end, double score, List<String> reasons) {

    static final int TOP_REASONS = 3;

    public static AlternativeSlot from(TimeSlot slot) {
        List<String> reasons = slot.getReasons();
        return new AlternativeSlot(slot.getStart(), slot.getEnd(), slot.getScore(),
                List.copyOf(reasons.subList(0, Math.min(TOP_REASONS, reasons.size()))));
    }
}
