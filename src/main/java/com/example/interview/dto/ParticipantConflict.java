package com.example.interview.dto;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public record ParticipantConflict(String participantId, String reason,
                                  LocalDateTime conflictStart, LocalDateTime conflictEnd) {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");

    public String describe() {
        return "%s: %s (%s-%s)".formatted(participantId, reason,
                conflictStart.format(TIME), conflictEnd.format(TIME));
    }
}
