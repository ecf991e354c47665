package com.example.interview.service;

import com.example.interview.dto.AvailabilitySnapshot;
import com.example.interview.dto.BookedInterval;
import com.example.interview.dto.BusyMarker;
import com.example.interview.dto.ParticipantConflict;
import com.example.interview.dto.SlotWindow;
import com.example.interview.dto.TimeSlot;
import com.example.interview.model.AvailabilityType;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConflictDetectorTest {

    private static final LocalDateTime DAY = LocalDateTime.of(2026, 11, 2, 0, 0);

    private final ConflictDetector detector = new ConflictDetector();

    private static LocalDateTime at(int hour, int minute) {
        return DAY.withHour(hour).withMinute(minute);
    }

    private static AvailabilitySnapshot bookingFor(String participant, LocalDateTime start, LocalDateTime end) {
        return new AvailabilitySnapshot(
                List.of(new BookedInterval(7L, "Technical Interview - Jane", List.of(participant), start, end)),
                List.of());
    }

    @Test
    void overlappingIntervalsConflict() {
        AvailabilitySnapshot snapshot = bookingFor("bob", at(10, 30), at(11, 30));

        Map<String, List<ParticipantConflict>> conflicts =
                detector.detect(new SlotWindow(at(10, 0), at(11, 0)), List.of("bob"), snapshot);

        assertThat(conflicts).containsOnlyKeys("bob");
        assertThat(conflicts.get("bob")).singleElement()
                .satisfies(c -> assertThat(c.reason()).contains("Technical Interview - Jane"));
    }

    @Test
    void touchingIntervalsDoNotConflict() {
        AvailabilitySnapshot snapshot = bookingFor("bob", at(11, 0), at(12, 0));

        assertThat(detector.detect(new SlotWindow(at(10, 0), at(11, 0)), List.of("bob"), snapshot)).isEmpty();
    }

    @Test
    void containedAndContainingIntervalsConflict() {
        SlotWindow slot = new SlotWindow(at(10, 0), at(12, 0));

        assertThat(detector.detect(slot, List.of("bob"), bookingFor("bob", at(10, 30), at(11, 0)))).isNotEmpty();
        assertThat(detector.detect(slot, List.of("bob"), bookingFor("bob", at(9, 0), at(13, 0)))).isNotEmpty();
    }

    @Test
    void onlyBusyMarkersCount() {
        AvailabilitySnapshot snapshot = new AvailabilitySnapshot(List.of(), List.of(
                new BusyMarker("alice", at(10, 0), at(11, 0), AvailabilityType.BUSY, false, "Dentist"),
                new BusyMarker("bob", at(10, 0), at(11, 0), AvailabilityType.AVAILABLE, false, null)));

        Map<String, List<ParticipantConflict>> conflicts =
                detector.detect(new SlotWindow(at(10, 0), at(11, 0)), List.of("alice", "bob"), snapshot);

        assertThat(conflicts).containsOnlyKeys("alice");
        assertThat(conflicts.get("alice").get(0).describe()).isEqualTo("alice: Busy: Dentist (10:00-11:00)");
    }

    @Test
    void candidateSplitsParticipants() {
        AvailabilitySnapshot snapshot = bookingFor("bob", at(10, 0), at(11, 0));

        TimeSlot slot = detector.toCandidate(new SlotWindow(at(10, 0), at(11, 0)), List.of("alice", "bob"), snapshot);

        assertThat(slot).isNotNull();
        assertThat(slot.getParticipantsAvailable()).containsExactly("alice");
        assertThat(slot.getParticipantsUnavailable()).containsExactly("bob");
        assertThat(slot.getConflicts()).hasSize(1);
    }

    @Test
    void candidateWithNobodyAvailableIsDropped() {
        AvailabilitySnapshot snapshot = bookingFor("bob", at(10, 0), at(11, 0));

        assertThat(detector.toCandidate(new SlotWindow(at(10, 0), at(11, 0)), List.of("bob"), snapshot)).isNull();
    }
}
