package com.example.interview.dto;

import java.time.DayOfWeek;
import java.time.LocalTime;

/** Caller hint, e.g. "tuesdays after 14:00". */
public record PreferredTime(DayOfWeek day, LocalTime from, LocalTime to) {

    @Override
    public String toString() {
        return (day != null ? day + " " : "") + from + "-" + to;
    }
}
