package com.example.interview.service.impl;

import com.example.interview.dto.BookedInterval;
import com.example.interview.dto.BusyMarker;
import com.example.interview.dto.SearchWindow;
import com.example.interview.model.AvailabilitySlot;
import com.example.interview.model.Interview;
import com.example.interview.model.InterviewStatus;
import com.example.interview.repository.AvailabilitySlotRepository;
import com.example.interview.repository.InterviewRepository;
import com.example.interview.service.AvailabilityGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Availability from this service's own tables: committed interviews and manually entered markers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduler.availability.provider", havingValue = "local", matchIfMissing = true)
public class LocalAvailabilityGateway implements AvailabilityGateway {

    private final InterviewRepository interviewRepository;
    private final AvailabilitySlotRepository availabilitySlotRepository;

    @Override
    public List<BookedInterval> getBookings(Collection<String> participantIds, SearchWindow window) {
        if (participantIds.isEmpty() || window.isEmpty()) {
            return List.of();
        }
        List<Interview> interviews = interviewRepository.findOverlapping(
                participantIds, InterviewStatus.ACTIVE, window.start(), window.end());
        log.debug("Loaded {} bookings for {} in {}", interviews.size(), participantIds, window);
        return interviews.stream()
                .map(i -> new BookedInterval(i.getId(), i.getTitle(), i.getInterviewerIds(),
                        i.getScheduledStart(), i.getScheduledEnd()))
                .toList();
    }

    @Override
    public List<BusyMarker> getBusySlots(Collection<String> participantIds, SearchWindow window) {
        if (participantIds.isEmpty() || window.isEmpty()) {
            return List.of();
        }
        List<AvailabilitySlot> slots = availabilitySlotRepository.findOverlapping(
                participantIds, window.start(), window.end());
        return slots.stream()
                .map(s -> new BusyMarker(s.getParticipantId(), s.getStartTime(), s.getEndTime(),
                        s.getAvailabilityType(), s.isRecurring(), s.getNotes()))
                .toList();
    }
}
