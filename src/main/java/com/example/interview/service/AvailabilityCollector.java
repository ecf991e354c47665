package com.example.interview.service;

import com.example.interview.config.SchedulerConfig;
import com.example.interview.config.SchedulingProperties;
import com.example.interview.dto.AvailabilitySnapshot;
import com.example.interview.dto.AvailabilitySummary;
import com.example.interview.dto.BookedInterval;
import com.example.interview.dto.BusyMarker;
import com.example.interview.dto.SearchWindow;
import com.example.interview.model.AvailabilityType;
import com.example.interview.service.util.BoundedCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Loads every participant's bookings and markers concurrently and merges them into one snapshot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityCollector {

    private final AvailabilityGateway gateway;
    private final ExecutorService availabilityExecutor;
    private final SchedulerConfig config;
    private final SchedulingProperties properties;

    public AvailabilitySnapshot gather(List<String> participantIds, SearchWindow window) {
        if (participantIds.isEmpty() || window.isEmpty()) {
            return AvailabilitySnapshot.EMPTY;
        }

        List<CompletableFuture<AvailabilitySnapshot>> futures = participantIds.stream()
                .distinct()
                .map(id -> CompletableFuture.supplyAsync(() -> load(id, window), availabilityExecutor))
                .toList();

        List<AvailabilitySnapshot> parts = BoundedCall.awaitAll(futures, config.getExternalTimeout(),
                "availability of " + participantIds);

        // shared interviews come back once per interviewer
        Map<Object, BookedInterval> bookings = new LinkedHashMap<>();
        List<BusyMarker> markers = new ArrayList<>();
        for (AvailabilitySnapshot part : parts) {
            for (BookedInterval booking : part.bookings()) {
                Object key = booking.interviewId() != null ? booking.interviewId() : booking;
                bookings.putIfAbsent(key, booking);
            }
            markers.addAll(part.markers());
        }

        log.debug("Gathered {} bookings and {} markers for {}", bookings.size(), markers.size(), participantIds);
        return new AvailabilitySnapshot(new ArrayList<>(bookings.values()), markers);
    }

    public List<AvailabilitySummary> summarize(List<String> participantIds, SearchWindow window) {
        AvailabilitySnapshot snapshot = gather(participantIds, window);
        SchedulingProperties.WorkingHours hours = properties.getWorkingHours();

        return participantIds.stream()
                .distinct()
                .map(id -> new AvailabilitySummary(
                        id,
                        snapshot.bookingsFor(id).size(),
                        countMarkers(snapshot, id, AvailabilityType.BUSY),
                        countMarkers(snapshot, id, AvailabilityType.AVAILABLE),
                        hours.getStart(),
                        hours.getEnd(),
                        hours.getDays()))
                .toList();
    }

    private AvailabilitySnapshot load(String participantId, SearchWindow window) {
        List<String> one = List.of(participantId);
        return new AvailabilitySnapshot(gateway.getBookings(one, window), gateway.getBusySlots(one, window));
    }

    private int countMarkers(AvailabilitySnapshot snapshot, String participantId, AvailabilityType type) {
        return (int) snapshot.markers().stream()
                .filter(m -> participantId.equals(m.participantId()) && m.type() == type)
                .count();
    }
}
