package com.example.interview.model;

public enum SchedulingPriority {
    URGENT,
    HIGH,
    MEDIUM,
    LOW
}
