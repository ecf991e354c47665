package com.example.interview.service;

import com.example.interview.config.SchedulingProperties;
import com.example.interview.dto.AvailabilitySnapshot;
import com.example.interview.dto.BookedInterval;
import com.example.interview.dto.SchedulingRequest;
import com.example.interview.dto.TimeSlot;
import com.example.interview.model.InterviewType;
import com.example.interview.model.SchedulingPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SlotScorerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-30T09:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);
    // Monday, 73 hours after NOW
    private static final LocalDateTime MONDAY_1000 = LocalDateTime.of(2026, 11, 2, 10, 0);

    private SchedulingProperties properties;
    private SlotScorer scorer;
    private SchedulingRequest request;

    @BeforeEach
    void setUp() {
        properties = new SchedulingProperties();
        scorer = new SlotScorer(properties, CLOCK);
        request = SchedulingRequest.builder()
                .candidateId("cand-1")
                .jobPositionId("job-1")
                .interviewType(InterviewType.TECHNICAL)
                .interviewerId("alice")
                .interviewerId("bob")
                .earliestStart(MONDAY_1000.withHour(9))
                .latestEnd(MONDAY_1000.withHour(17))
                .build();
    }

    private static TimeSlot slotAt(LocalDateTime start, String... available) {
        TimeSlot.TimeSlotBuilder builder = TimeSlot.builder().start(start).end(start.plusHours(1));
        for (String id : available) {
            builder.participantAvailable(id);
        }
        return builder.build();
    }

    @Test
    void timePreferenceFollowsHourBands() {
        assertThat(scorer.timePreference(slotAt(MONDAY_1000.withHour(9), "alice"))).isEqualTo(1.0);
        assertThat(scorer.timePreference(slotAt(MONDAY_1000.withHour(11), "alice"))).isEqualTo(1.0);
        assertThat(scorer.timePreference(slotAt(MONDAY_1000.withHour(12), "alice"))).isEqualTo(0.7);
        assertThat(scorer.timePreference(slotAt(MONDAY_1000.withHour(14), "alice"))).isEqualTo(0.9);
        assertThat(scorer.timePreference(slotAt(MONDAY_1000.withHour(16), "alice"))).isEqualTo(0.7);
        assertThat(scorer.timePreference(slotAt(MONDAY_1000.withHour(18), "alice"))).isEqualTo(0.3);
        assertThat(scorer.timePreference(slotAt(MONDAY_1000.withHour(7), "alice"))).isEqualTo(0.3);
    }

    @Test
    void availabilityQualityIsShareOfRequestedInterviewers() {
        assertThat(scorer.availabilityQuality(slotAt(MONDAY_1000, "alice", "bob"), request)).isEqualTo(1.0);
        assertThat(scorer.availabilityQuality(slotAt(MONDAY_1000, "alice"), request)).isEqualTo(0.5);
    }

    @Test
    void workloadBucketsBySameDayBookings() {
        assertThat(scorer.workloadBucket(0)).isEqualTo(1.0);
        assertThat(scorer.workloadBucket(1)).isEqualTo(0.8);
        assertThat(scorer.workloadBucket(2)).isEqualTo(0.8);
        assertThat(scorer.workloadBucket(3)).isEqualTo(0.6);
        assertThat(scorer.workloadBucket(4)).isEqualTo(0.6);
        assertThat(scorer.workloadBucket(5)).isEqualTo(0.3);
    }

    @Test
    void workloadAveragesOverAvailableInterviewers() {
        LocalDateTime day = MONDAY_1000.toLocalDate().atStartOfDay();
        AvailabilitySnapshot snapshot = new AvailabilitySnapshot(List.of(
                new BookedInterval(1L, "a", List.of("alice"), day.withHour(13), day.withHour(14)),
                new BookedInterval(2L, "b", List.of("alice"), day.plusDays(1).withHour(13), day.plusDays(1).withHour(14))),
                List.of());

        double workload = scorer.interviewerWorkload(slotAt(MONDAY_1000, "alice", "bob"), snapshot);

        assertThat(workload).isCloseTo((0.8 + 1.0) / 2, within(1e-9));
    }

    @Test
    void candidateConvenienceUsesCandidateTimezone() {
        TimeSlot tenUtc = slotAt(MONDAY_1000, "alice");

        // 11:00 in Berlin
        assertThat(scorer.candidateConvenience(tenUtc, "Europe/Berlin")).isEqualTo(1.0);
        // 05:00 in New York
        assertThat(scorer.candidateConvenience(tenUtc, "America/New_York")).isEqualTo(0.4);
        // 18:00 in Berlin
        assertThat(scorer.candidateConvenience(slotAt(MONDAY_1000.withHour(17), "alice"), "Europe/Berlin"))
                .isEqualTo(0.8);
    }

    @Test
    void unknownTimezoneFallsBackToNeutralScore() {
        TimeSlot slot = slotAt(MONDAY_1000, "alice");

        assertThat(scorer.candidateConvenience(slot, "Mars/Olympus_Mons")).isEqualTo(0.8);
        assertThat(scorer.candidateConvenience(slot, "")).isEqualTo(0.8);
    }

    @Test
    void urgencyDependsOnPriorityAndLeadTime() {
        assertThat(scorer.urgencyFactor(slotAt(NOW.plusHours(10)), SchedulingPriority.URGENT, NOW)).isEqualTo(1.0);
        assertThat(scorer.urgencyFactor(slotAt(NOW.plusHours(30)), SchedulingPriority.URGENT, NOW)).isEqualTo(0.8);
        assertThat(scorer.urgencyFactor(slotAt(NOW.plusHours(72)), SchedulingPriority.URGENT, NOW)).isEqualTo(0.5);

        assertThat(scorer.urgencyFactor(slotAt(NOW.plusHours(72)), SchedulingPriority.HIGH, NOW)).isEqualTo(1.0);
        assertThat(scorer.urgencyFactor(slotAt(NOW.plusHours(73)), SchedulingPriority.HIGH, NOW)).isEqualTo(0.7);

        assertThat(scorer.urgencyFactor(slotAt(NOW.plusHours(23)), SchedulingPriority.MEDIUM, NOW)).isEqualTo(0.6);
        assertThat(scorer.urgencyFactor(slotAt(NOW.plusHours(24)), SchedulingPriority.MEDIUM, NOW)).isEqualTo(1.0);
        assertThat(scorer.urgencyFactor(slotAt(NOW.plusHours(2)), SchedulingPriority.LOW, NOW)).isEqualTo(0.6);
    }

    @Test
    void fullyAvailableMorningSlotScoresTopMarks() {
        TimeSlot scored = scorer.score(slotAt(MONDAY_1000, "alice", "bob"), request, AvailabilitySnapshot.EMPTY, NOW);

        assertThat(scored.getScore()).isCloseTo(1.0, within(1e-9));
        assertThat(scored.getBreakdown().conflictPenaltyApplied()).isFalse();
        assertThat(scored.getReasons()).containsExactly(
                "Good time match (score: 1.0)",
                "High availability quality",
                "Good interviewer availability",
                "Convenient for candidate",
                "Meets urgency requirements");
    }

    @Test
    void conflictsMultiplyTotalByPenalty() {
        TimeSlot clean = slotAt(MONDAY_1000.withHour(14), "alice");
        TimeSlot conflicted = clean.toBuilder()
                .participantUnavailable("bob")
                .conflict("bob: Existing interview: Panel (14:00-15:00)")
                .build();

        TimeSlot cleanScored = scorer.score(clean, request, AvailabilitySnapshot.EMPTY, NOW);
        TimeSlot conflictedScored = scorer.score(conflicted, request, AvailabilitySnapshot.EMPTY, NOW);

        assertThat(conflictedScored.getScore()).isCloseTo(cleanScored.getScore() * 0.7, within(1e-9));
        assertThat(conflictedScored.getBreakdown().unpenalizedTotal())
                .isCloseTo(cleanScored.getScore(), within(1e-9));
        assertThat(conflictedScored.getBreakdown().conflictPenaltyApplied()).isTrue();
        assertThat(conflictedScored.getReasons()).contains("Has 1 conflicts");
    }

    @Test
    void scoreStaysInUnitInterval() {
        for (int hour = 0; hour < 24; hour++) {
            for (SchedulingPriority priority : SchedulingPriority.values()) {
                SchedulingRequest r = request.toBuilder().priority(priority).timezone("Asia/Tokyo").build();
                TimeSlot slot = slotAt(MONDAY_1000.withHour(hour), "alice").toBuilder()
                        .conflict("bob: Busy: Unavailable")
                        .build();

                double score = scorer.score(slot, r, AvailabilitySnapshot.EMPTY, NOW).getScore();

                assertThat(score).isBetween(0.0, 1.0);
            }
        }
    }

    @Test
    void rescoringReplacesReasons() {
        TimeSlot once = scorer.score(slotAt(MONDAY_1000, "alice", "bob"), request, AvailabilitySnapshot.EMPTY, NOW);
        TimeSlot twice = scorer.score(once, request, AvailabilitySnapshot.EMPTY, NOW);

        assertThat(twice.getReasons()).isEqualTo(once.getReasons());
        assertThat(twice.getScore()).isEqualTo(once.getScore());
    }

    @Test
    void rejectsWeightsThatDoNotSumToOne() {
        SchedulingProperties broken = new SchedulingProperties();
        broken.getScoring().getWeights().setUrgencyFactor(0.5);

        assertThatThrownBy(() -> new SlotScorer(broken, CLOCK))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sum to 1.0");
    }
}
