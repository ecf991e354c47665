package com.example.interview.model;

public enum AvailabilityType {
    BUSY,
    AVAILABLE
}
