package com.example.interview.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Working-hours calendar and scoring constants. The bands and weights are heuristics without a
 * documented calibration, so all of them are tunable.
 */
@Data
@ConfigurationProperties(prefix = "scheduler")
public class SchedulingProperties {

    private WorkingHours workingHours = new WorkingHours();

    private Scoring scoring = new Scoring();

    @Data
    public static class WorkingHours {
        private Set<DayOfWeek> days = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);
        private LocalTime start = LocalTime.of(9, 0);
        private LocalTime end = LocalTime.of(17, 0);
        private int stepMinutes = 30;
    }

    @Data
    public static class Scoring {
        private Weights weights = new Weights();

        /** multiplier applied to the total when a slot carries any conflict */
        private double conflictPenalty = 0.7;

        private Thresholds reasonThresholds = new Thresholds();

        // time_preference, hour of day (inclusive ranges)
        private int morningPeakFrom = 9;
        private int morningPeakTo = 11;
        private double morningPeakScore = 1.0;
        private int afternoonPeakFrom = 13;
        private int afternoonPeakTo = 15;
        private double afternoonPeakScore = 0.9;
        private int businessFrom = 8;
        private int businessTo = 17;
        private double businessScore = 0.7;
        private double offHoursScore = 0.3;

        // interviewer_workload, same-day bookings per interviewer
        private int lightLoadMax = 2;
        private int moderateLoadMax = 4;
        private double idleScore = 1.0;
        private double lightLoadScore = 0.8;
        private double moderateLoadScore = 0.6;
        private double heavyLoadScore = 0.3;

        // candidate_convenience, hour in the candidate timezone
        private int candidateCoreFrom = 9;
        private int candidateCoreTo = 17;
        private double candidateCoreScore = 1.0;
        private int candidateExtendedFrom = 8;
        private int candidateExtendedTo = 18;
        private double candidateExtendedScore = 0.8;
        private double candidateOffHoursScore = 0.4;
        private double unknownTimezoneScore = 0.8;
    }

    @Data
    public static class Weights {
        private double timePreference = 0.30;
        private double availabilityQuality = 0.25;
        private double interviewerWorkload = 0.20;
        private double candidateConvenience = 0.15;
        private double urgencyFactor = 0.10;

        public double sum() {
            return timePreference + availabilityQuality + interviewerWorkload + candidateConvenience + urgencyFactor;
        }

        public void validate() {
            if (Math.abs(sum() - 1.0) > 1e-6) {
                throw new IllegalStateException("Scoring weights must sum to 1.0 but were " + sum());
            }
        }
    }

    @Data
    public static class Thresholds {
        private double timePreference = 0.7;
        private double availabilityQuality = 0.8;
        private double interviewerWorkload = 0.7;
        private double candidateConvenience = 0.8;
        private double urgencyFactor = 0.5;
    }
}
