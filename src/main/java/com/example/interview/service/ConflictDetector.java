package com.example.interview.service;

import com.example.interview.dto.AvailabilitySnapshot;
import com.example.interview.dto.BookedInterval;
import com.example.interview.dto.BusyMarker;
import com.example.interview.dto.ParticipantConflict;
import com.example.interview.dto.SlotWindow;
import com.example.interview.dto.TimeSlot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class ConflictDetector {

    /**
     * Per-participant conflicts for one window. Participants without conflicts are absent from the map.
     */
    public Map<String, List<ParticipantConflict>> detect(SlotWindow window, List<String> participantIds,
                                                         AvailabilitySnapshot snapshot) {
        Map<String, List<ParticipantConflict>> conflicts = new LinkedHashMap<>();

        for (String participant : participantIds) {
            List<ParticipantConflict> found = new ArrayList<>();

            for (BookedInterval booking : snapshot.bookingsFor(participant)) {
                if (window.overlaps(booking.start(), booking.end())) {
                    String title = booking.title() != null ? booking.title() : "interview #" + booking.interviewId();
                    found.add(new ParticipantConflict(participant, "Existing interview: " + title,
                            booking.start(), booking.end()));
                }
            }

            for (BusyMarker marker : snapshot.busyMarkersFor(participant)) {
                if (window.overlaps(marker.start(), marker.end())) {
                    String notes = marker.notes() != null && !marker.notes().isBlank() ? marker.notes() : "Unavailable";
                    found.add(new ParticipantConflict(participant, "Busy: " + notes, marker.start(), marker.end()));
                }
            }

            if (!found.isEmpty()) {
                conflicts.put(participant, found);
            }
        }
        return conflicts;
    }

    /**
     * Builds the unscored slot for a window: conflicts flattened, participants split into available and
     * unavailable. Returns null when nobody is available, such slots are never retained.
     */
    public TimeSlot toCandidate(SlotWindow window, List<String> participantIds, AvailabilitySnapshot snapshot) {
        Map<String, List<ParticipantConflict>> conflicts = detect(window, participantIds, snapshot);

        TimeSlot.TimeSlotBuilder builder = TimeSlot.builder()
                .start(window.start())
                .end(window.end());

        for (String participant : participantIds) {
            List<ParticipantConflict> own = conflicts.get(participant);
            if (own == null) {
                builder.participantAvailable(participant);
            } else {
                builder.participantUnavailable(participant);
                own.forEach(c -> builder.conflict(c.describe()));
            }
        }

        TimeSlot slot = builder.build();
        return slot.getParticipantsAvailable().isEmpty() ? null : slot;
    }
}
