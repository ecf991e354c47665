package com.example.interview.dto;

import java.time.LocalDateTime;

public record SearchWindow(LocalDateTime start, LocalDateTime end) {

    public boolean isEmpty() {
        return start == null || end == null || !start.isBefore(end);
    }
}
