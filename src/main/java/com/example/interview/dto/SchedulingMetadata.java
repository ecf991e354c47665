package com.example.interview.dto;

import com.example.interview.model.SchedulingStrategy;

import java.time.Instant;

public record SchedulingMetadata(int slotsEvaluated, long processingTimeMs, SchedulingStrategy strategyUsed,
                                 Instant timestamp) {
}
