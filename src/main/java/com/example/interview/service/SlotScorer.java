package com.example.interview.service;

import com.example.interview.config.SchedulingProperties;
import com.example.interview.dto.AvailabilitySnapshot;
import com.example.interview.dto.SchedulingRequest;
import com.example.interview.dto.ScoreBreakdown;
import com.example.interview.dto.TimeSlot;
import com.example.interview.model.SchedulingPriority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Weighted multi-factor score in [0, 1]. Every sub-score is normalized to [0, 1]; a slot that carries
 * conflicts has its total multiplied by the conflict penalty. Higher is better.
 */
@Slf4j
@Component
public class SlotScorer {

    private final SchedulingProperties.Scoring scoring;
    private final Clock clock;

    public SlotScorer(SchedulingProperties properties, Clock clock) {
        this.scoring = properties.getScoring();
        this.scoring.getWeights().validate();
        this.clock = clock;
    }

    public List<TimeSlot> scoreAll(List<TimeSlot> slots, SchedulingRequest request, AvailabilitySnapshot snapshot) {
        LocalDateTime now = LocalDateTime.now(clock);
        return slots.stream()
                .map(slot -> score(slot, request, snapshot, now))
                .toList();
    }

    public TimeSlot score(TimeSlot slot, SchedulingRequest request, AvailabilitySnapshot snapshot, LocalDateTime now) {
        SchedulingProperties.Weights weights = scoring.getWeights();
        SchedulingProperties.Thresholds thresholds = scoring.getReasonThresholds();
        List<String> reasons = new ArrayList<>();

        double time = timePreference(slot);
        if (time > thresholds.getTimePreference()) {
            reasons.add(String.format(Locale.ROOT, "Good time match (score: %.1f)", time));
        }

        double availability = availabilityQuality(slot, request);
        if (availability > thresholds.getAvailabilityQuality()) {
            reasons.add("High availability quality");
        }

        double workload = interviewerWorkload(slot, snapshot);
        if (workload > thresholds.getInterviewerWorkload()) {
            reasons.add("Good interviewer availability");
        }

        double convenience = candidateConvenience(slot, request.getTimezone());
        if (convenience > thresholds.getCandidateConvenience()) {
            reasons.add("Convenient for candidate");
        }

        double urgency = urgencyFactor(slot, request.getPriority(), now);
        if (urgency > thresholds.getUrgencyFactor()) {
            reasons.add("Meets urgency requirements");
        }

        double total = time * weights.getTimePreference()
                + availability * weights.getAvailabilityQuality()
                + workload * weights.getInterviewerWorkload()
                + convenience * weights.getCandidateConvenience()
                + urgency * weights.getUrgencyFactor();

        double finalScore = total;
        boolean penalized = slot.hasConflicts();
        if (penalized) {
            finalScore = total * scoring.getConflictPenalty();
            reasons.add("Has " + slot.getConflicts().size() + " conflicts");
        }

        ScoreBreakdown breakdown = new ScoreBreakdown(time, availability, workload, convenience, urgency,
                total, penalized);

        log.debug("Scored slot {}: time={} availability={} workload={} convenience={} urgency={} total={}",
                slot.getStart(), time, availability, workload, convenience, urgency, finalScore);

        return slot.toBuilder()
                .score(finalScore)
                .clearReasons()
                .reasons(reasons)
                .breakdown(breakdown)
                .build();
    }

    double timePreference(TimeSlot slot) {
        int hour = slot.getStart().getHour();
        if (hour >= scoring.getMorningPeakFrom() && hour <= scoring.getMorningPeakTo()) {
            return scoring.getMorningPeakScore();
        }
        if (hour >= scoring.getAfternoonPeakFrom() && hour <= scoring.getAfternoonPeakTo()) {
            return scoring.getAfternoonPeakScore();
        }
        if (hour >= scoring.getBusinessFrom() && hour <= scoring.getBusinessTo()) {
            return scoring.getBusinessScore();
        }
        return scoring.getOffHoursScore();
    }

    double availabilityQuality(TimeSlot slot, SchedulingRequest request) {
        int requested = request.getInterviewerIds().size();
        int available = slot.getParticipantsAvailable().size();
        if (requested == 0 || available == 0) {
            return 0.0;
        }
        return (double) available / requested;
    }

    double interviewerWorkload(TimeSlot slot, AvailabilitySnapshot snapshot) {
        if (slot.getParticipantsAvailable().isEmpty()) {
            return 0.0;
        }
        LocalDate day = slot.getStart().toLocalDate();
        double sum = 0.0;
        for (String participant : slot.getParticipantsAvailable()) {
            sum += workloadBucket(snapshot.countBookingsOn(participant, day));
        }
        return sum / slot.getParticipantsAvailable().size();
    }

    double workloadBucket(long sameDayBookings) {
        if (sameDayBookings == 0) {
            return scoring.getIdleScore();
        }
        if (sameDayBookings <= scoring.getLightLoadMax()) {
            return scoring.getLightLoadScore();
        }
        if (sameDayBookings <= scoring.getModerateLoadMax()) {
            return scoring.getModerateLoadScore();
        }
        return scoring.getHeavyLoadScore();
    }

    double candidateConvenience(TimeSlot slot, String timezone) {
        int hour;
        try {
            if (timezone == null || timezone.isBlank()) {
                return scoring.getUnknownTimezoneScore();
            }
            hour = slot.getStart()
                    .atZone(clock.getZone())
                    .withZoneSameInstant(ZoneId.of(timezone))
                    .getHour();
        } catch (DateTimeException e) {
            log.debug("Cannot resolve timezone '{}': {}", timezone, e.getMessage());
            return scoring.getUnknownTimezoneScore();
        }

        if (hour >= scoring.getCandidateCoreFrom() && hour <= scoring.getCandidateCoreTo()) {
            return scoring.getCandidateCoreScore();
        }
        if (hour >= scoring.getCandidateExtendedFrom() && hour <= scoring.getCandidateExtendedTo()) {
            return scoring.getCandidateExtendedScore();
        }
        return scoring.getCandidateOffHoursScore();
    }

    double urgencyFactor(TimeSlot slot, SchedulingPriority priority, LocalDateTime now) {
        double hoursUntil = Duration.between(now, slot.getStart()).toMinutes() / 60.0;
        return switch (priority) {
            case URGENT -> hoursUntil <= 24 ? 1.0 : hoursUntil <= 48 ? 0.8 : 0.5;
            case HIGH -> hoursUntil <= 72 ? 1.0 : 0.7;
            // not too soon for routine requests
            case MEDIUM, LOW -> hoursUntil >= 24 ? 1.0 : 0.6;
        };
    }
}
