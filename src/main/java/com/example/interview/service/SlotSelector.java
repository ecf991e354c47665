package com.example.interview.service;

import com.example.interview.dto.TimeSlot;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

@Component
public class SlotSelector {

    /** Highest score first, earliest start on equal scores. */
    public static final Comparator<TimeSlot> RANKING = Comparator
            .comparingDouble(TimeSlot::getScore).reversed()
            .thenComparing(TimeSlot::getStart);

    public SlotSelection select(List<TimeSlot> scored) {
        if (scored == null || scored.isEmpty()) {
            throw new IllegalArgumentException("Cannot select from an empty candidate set");
        }
        return new SlotSelection(scored.stream().sorted(RANKING).toList());
    }
}
