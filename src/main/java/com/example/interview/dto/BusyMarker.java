package com.example.interview.dto;

import com.example.interview.model.AvailabilityType;

import java.time.LocalDateTime;

public record BusyMarker(String participantId, LocalDateTime start, LocalDateTime end,
                         AvailabilityType type, boolean recurring, String notes) {

    public boolean isBusy() {
        return type == AvailabilityType.BUSY;
    }
}
