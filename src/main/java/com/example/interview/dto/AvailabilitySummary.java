package com.example.interview.dto;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Set;

public record AvailabilitySummary(String participantId,
                                  int totalInterviews,
                                  int busySlots,
                                  int availableSlots,
                                  LocalTime workingHoursStart,
                                  LocalTime workingHoursEnd,
                                  Set<DayOfWeek> workingDays) {
}
