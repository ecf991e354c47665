package com.example.interview.service;

import com.example.interview.dto.AvailabilitySummaryResult;
import com.example.interview.dto.ConflictCheckResult;
import com.example.interview.dto.SchedulingRequest;
import com.example.interview.dto.SchedulingResult;
import com.example.interview.dto.SlotSearchResult;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Finds the best slot for a request and books it. Failures come back as results, never as exceptions.
 */
public interface InterviewSchedulingService {

    int DEFAULT_MAX_SLOTS = 10;

    SchedulingResult scheduleInterview(SchedulingRequest request);

    /**
     * Same as {@link #scheduleInterview(SchedulingRequest)} but ignores the bookings of the interview being
     * replaced, so a reschedule can keep the interviewers' other commitments intact.
     */
    SchedulingResult scheduleInterview(SchedulingRequest request, Long replacedInterviewId);

    /** Ranked slots without booking anything */
    SlotSearchResult findOptimalSlots(SchedulingRequest request, int maxSlots);

    default SlotSearchResult findOptimalSlots(SchedulingRequest request) {
        return findOptimalSlots(request, DEFAULT_MAX_SLOTS);
    }

    ConflictCheckResult checkConflicts(LocalDateTime start, LocalDateTime end, List<String> participantIds);

    AvailabilitySummaryResult availabilitySummary(List<String> participantIds, LocalDateTime from, LocalDateTime to);
}
