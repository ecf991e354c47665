package com.example.interview.dto;

import java.time.LocalDateTime;
import java.util.List;

/**
 * An existing scheduled or confirmed interview as seen by the availability gateway.
 */
public record BookedInterval(Long interviewId, String title, List<String> participantIds,
                             LocalDateTime start, LocalDateTime end) {

    public BookedInterval {
        participantIds = participantIds == null ? List.of() : List.copyOf(participantIds);
    }

    public boolean involves(String participantId) {
        return participantIds.contains(participantId);
    }
}
