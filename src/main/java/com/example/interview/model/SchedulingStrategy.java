package com.example.interview.model;

public enum SchedulingStrategy {
    OPTIMIZE_TIME,
    OPTIMIZE_QUALITY,
    OPTIMIZE_CANDIDATE,
    BALANCED
}
