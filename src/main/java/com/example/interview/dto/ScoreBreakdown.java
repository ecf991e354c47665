package com.example.interview.dto;

public record ScoreBreakdown(double timePreference,
                             double availabilityQuality,
                             double interviewerWorkload,
                             double candidateConvenience,
                             double urgencyFactor,
                             double unpenalizedTotal,
                             boolean conflictPenaltyApplied) {
}
