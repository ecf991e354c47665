package com.example.interview.dto;

import java.util.List;
import java.util.Set;

public record SlotDetails(double score, List<String> conflicts, List<String> reasons,
                          Set<String> participantsAvailable) {

    public static SlotDetails from(TimeSlot slot) {
        return new SlotDetails(slot.getScore(), slot.getConflicts(), slot.getReasons(),
                slot.getParticipantsAvailable());
    }
}
