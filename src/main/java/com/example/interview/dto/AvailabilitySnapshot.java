package com.example.interview.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * Merged bookings and markers for all requested participants over one search window.
 */
public record AvailabilitySnapshot(List<BookedInterval> bookings, List<BusyMarker> markers) {

    public static final AvailabilitySnapshot EMPTY = new AvailabilitySnapshot(List.of(), List.of());

    public AvailabilitySnapshot {
        bookings = bookings == null ? List.of() : List.copyOf(bookings);
        markers = markers == null ? List.of() : List.copyOf(markers);
    }

    public List<BookedInterval> bookingsFor(String participantId) {
        return bookings.stream().filter(b -> b.involves(participantId)).toList();
    }

    public List<BusyMarker> busyMarkersFor(String participantId) {
        return markers.stream()
                .filter(BusyMarker::isBusy)
                .filter(m -> participantId.equals(m.participantId()))
                .toList();
    }

    public long countBookingsOn(String participantId, LocalDate day) {
        return bookings.stream()
                .filter(b -> b.involves(participantId))
                .filter(b -> b.start().toLocalDate().equals(day))
                .count();
    }

    /** Drops the interview that is being replaced so it does not block its own successor. */
    public AvailabilitySnapshot withoutInterview(Long interviewId) {
        if (interviewId == null) {
            return this;
        }
        return new AvailabilitySnapshot(
                bookings.stream().filter(b -> !interviewId.equals(b.interviewId())).toList(),
                markers);
    }
}
