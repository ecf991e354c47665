package com.example.interview.dto;

import java.time.LocalDateTime;

public record SchedulingAnalytics(LocalDateTime since,
                                  int totalAttempts,
                                  int successfulSchedules,
                                  int failedSchedules,
                                  int successfulReschedules,
                                  double successRate,
                                  double averageProcessingTimeMs,
                                  double averageScore) {
}
