package com.example.interview.service.impl;

import com.example.interview.client.CandidateDirectory;
import com.example.interview.client.NotificationPublisher;
import com.example.interview.config.SchedulerConfig;
import com.example.interview.dto.AlternativeSlot;
import com.example.interview.dto.AvailabilitySnapshot;
import com.example.interview.dto.AvailabilitySummaryResult;
import com.example.interview.dto.CandidateDTO;
import com.example.interview.dto.ConflictCheckResult;
import com.example.interview.dto.InterviewDTO;
import com.example.interview.dto.InterviewScheduledEvent;
import com.example.interview.dto.JobPositionDTO;
import com.example.interview.dto.SchedulingErrorType;
import com.example.interview.dto.SchedulingMetadata;
import com.example.interview.dto.SchedulingRequest;
import com.example.interview.dto.SchedulingResult;
import com.example.interview.dto.SearchWindow;
import com.example.interview.dto.SlotDetails;
import com.example.interview.dto.SlotSearchResult;
import com.example.interview.dto.SlotWindow;
import com.example.interview.dto.TimeSlot;
import com.example.interview.model.Interview;
import com.example.interview.model.InterviewStatus;
import com.example.interview.model.SchedulingLog.ActionType;
import com.example.interview.repository.InterviewRepository;
import com.example.interview.service.AvailabilityCollector;
import com.example.interview.service.ConflictDetector;
import com.example.interview.service.InterviewSchedulingService;
import com.example.interview.service.SchedulingLogService;
import com.example.interview.service.SlotGenerator;
import com.example.interview.service.SlotScorer;
import com.example.interview.service.SlotSelection;
import com.example.interview.service.SlotSelector;
import com.example.interview.service.exception.SchedulingException;
import com.example.interview.service.util.BoundedCall;
import com.example.interview.service.util.InterviewerLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class InterviewSchedulingServiceImpl implements InterviewSchedulingService {

    static final int MIN_DURATION_MINUTES = 15;
    static final int MAX_DURATION_MINUTES = 480;

    private final CandidateDirectory candidateDirectory;
    private final AvailabilityCollector availabilityCollector;
    private final SlotGenerator slotGenerator;
    private final ConflictDetector conflictDetector;
    private final SlotScorer slotScorer;
    private final SlotSelector slotSelector;
    private final InterviewRepository interviewRepository;
    private final InterviewerLocks interviewerLocks;
    private final SchedulingLogService schedulingLog;
    private final NotificationPublisher notificationPublisher;
    private final ExecutorService availabilityExecutor;
    private final SchedulerConfig config;
    private final Clock clock;

    @Override
    public SchedulingResult scheduleInterview(SchedulingRequest request) {
        return scheduleInterview(request, null);
    }

    @Override
    public SchedulingResult scheduleInterview(SchedulingRequest request, Long replacedInterviewId) {
        long startedAt = clock.millis();
        log.info("Scheduling {} interview for candidate {} with {}",
                request.getInterviewType(), request.getCandidateId(), request.getInterviewerIds());

        try {
            // 1) validation, all violations at once
            Validation validation = validate(request);
            if (!validation.violations().isEmpty()) {
                log.info("Request for candidate {} rejected: {}", request.getCandidateId(), validation.violations());
                return fail(request, SchedulingErrorType.VALIDATION_FAILED, validation.violations(), startedAt);
            }

            // 2-4) gather, generate, filter, score, rank
            Search search = search(request, replacedInterviewId);
            if (search.candidates().isEmpty()) {
                return fail(request, SchedulingErrorType.NO_SLOTS_AVAILABLE,
                        List.of("No suitable time slots found for the given constraints"), startedAt);
            }
            SlotSelection selection = slotSelector.select(search.scored());

            // 5) commit, the only mutating step
            Committed committed = commit(selection, request, validation, replacedInterviewId);
            if (committed == null) {
                return fail(request, SchedulingErrorType.NO_SLOTS_AVAILABLE,
                        List.of("All candidate slots were booked by concurrent requests"), startedAt);
            }

            Interview interview = committed.interview();
            TimeSlot chosen = committed.slot();
            List<TimeSlot> alternates = selection.from(committed.rank() + 1).stream()
                    .limit(SlotSelection.MAX_ALTERNATES)
                    .toList();
            long elapsed = clock.millis() - startedAt;

            // 6) audit
            schedulingLog.recordScheduleSuccess(interview.getId(), request.getStrategy(),
                    search.candidates().size(), elapsed, chosen.getScore(), alternates);

            // 7) best-effort notification, never before the booking is committed
            notifyScheduled(interview, chosen);

            log.info("Scheduled interview {} at {} (score {}, {} slots evaluated)",
                    interview.getId(), interview.getScheduledStart(), chosen.getScore(), search.candidates().size());

            return SchedulingResult.success(
                    InterviewDTO.from(interview),
                    SlotDetails.from(chosen),
                    alternates.stream().map(AlternativeSlot::from).toList(),
                    new SchedulingMetadata(search.candidates().size(), elapsed, request.getStrategy(), clock.instant()));
        } catch (SchedulingException e) {
            log.warn("Scheduling for candidate {} failed with {}: {}",
                    request.getCandidateId(), e.getErrorType().code(), e.getMessage());
            return fail(request, e.getErrorType(), List.of(e.getMessage()), startedAt);
        } catch (RuntimeException e) {
            log.error("Scheduling for candidate {} failed", request.getCandidateId(), e);
            return fail(request, SchedulingErrorType.SCHEDULING_ERROR, List.of(String.valueOf(e.getMessage())), startedAt);
        }
    }

    @Override
    public SlotSearchResult findOptimalSlots(SchedulingRequest request, int maxSlots) {
        try {
            Validation validation = validate(request);
            if (!validation.violations().isEmpty()) {
                return SlotSearchResult.failure(SchedulingErrorType.VALIDATION_FAILED, validation.violations());
            }
            Search search = search(request, null);
            if (search.candidates().isEmpty()) {
                return SlotSearchResult.failure(SchedulingErrorType.NO_SLOTS_AVAILABLE,
                        List.of("No suitable time slots found for the given constraints"));
            }
            List<TimeSlot> ranked = slotSelector.select(search.scored()).ranked();
            return SlotSearchResult.found(ranked.subList(0, Math.min(Math.max(maxSlots, 0), ranked.size())),
                    search.candidates().size());
        } catch (SchedulingException e) {
            log.warn("Slot search failed with {}: {}", e.getErrorType().code(), e.getMessage());
            return SlotSearchResult.failure(e.getErrorType(), List.of(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Slot search failed", e);
            return SlotSearchResult.failure(SchedulingErrorType.SCHEDULING_ERROR, List.of(String.valueOf(e.getMessage())));
        }
    }

    @Override
    public ConflictCheckResult checkConflicts(LocalDateTime start, LocalDateTime end, List<String> participantIds) {
        if (start == null || end == null || !start.isBefore(end)) {
            return ConflictCheckResult.failure(SchedulingErrorType.VALIDATION_FAILED,
                    List.of("Start time must be before end time"));
        }
        try {
            AvailabilitySnapshot snapshot = availabilityCollector.gather(participantIds, new SearchWindow(start, end));
            return ConflictCheckResult.of(conflictDetector.detect(new SlotWindow(start, end), participantIds, snapshot));
        } catch (SchedulingException e) {
            log.warn("Conflict check failed with {}: {}", e.getErrorType().code(), e.getMessage());
            return ConflictCheckResult.failure(e.getErrorType(), List.of(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Conflict check failed", e);
            return ConflictCheckResult.failure(SchedulingErrorType.SCHEDULING_ERROR, List.of(String.valueOf(e.getMessage())));
        }
    }

    @Override
    public AvailabilitySummaryResult availabilitySummary(List<String> participantIds, LocalDateTime from,
                                                         LocalDateTime to) {
        if (from == null || to == null || !from.isBefore(to)) {
            return AvailabilitySummaryResult.failure(SchedulingErrorType.VALIDATION_FAILED,
                    List.of("Start time must be before end time"));
        }
        try {
            return AvailabilitySummaryResult.of(availabilityCollector.summarize(participantIds, new SearchWindow(from, to)));
        } catch (SchedulingException e) {
            log.warn("Availability summary for {} failed with {}: {}", participantIds, e.getErrorType().code(), e.getMessage());
            return AvailabilitySummaryResult.failure(e.getErrorType(), List.of(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Availability summary for {} failed", participantIds, e);
            return AvailabilitySummaryResult.failure(SchedulingErrorType.SCHEDULING_ERROR,
                    List.of(String.valueOf(e.getMessage())));
        }
    }

    // ------------------ pipeline steps ------------------

    Validation validate(SchedulingRequest request) {
        List<String> violations = new ArrayList<>();

        CandidateDTO candidate = null;
        if (isBlank(request.getCandidateId())) {
            violations.add("Candidate id is required");
        } else {
            candidate = BoundedCall.call(availabilityExecutor, config.getExternalTimeout(),
                    "candidate " + request.getCandidateId(),
                    () -> candidateDirectory.findCandidate(request.getCandidateId())).orElse(null);
            if (candidate == null) {
                violations.add("Candidate not found");
            }
        }

        JobPositionDTO job = null;
        if (isBlank(request.getJobPositionId())) {
            violations.add("Job position id is required");
        } else {
            job = BoundedCall.call(availabilityExecutor, config.getExternalTimeout(),
                    "job position " + request.getJobPositionId(),
                    () -> candidateDirectory.findJobPosition(request.getJobPositionId())).orElse(null);
            if (job == null) {
                violations.add("Job position not found");
            }
        }

        if (request.getInterviewType() == null) {
            violations.add("Interview type is required");
        }

        if (request.getPriority() == null) {
            violations.add("Priority is required");
        }

        if (request.getStrategy() == null) {
            violations.add("Strategy is required");
        }

        if (request.getEarliestStart() == null || request.getLatestEnd() == null) {
            violations.add("Earliest start and latest end are required");
        } else if (!request.getEarliestStart().isBefore(request.getLatestEnd())) {
            violations.add("Earliest start time must be before latest end time");
        }

        if (request.getDurationMinutes() < MIN_DURATION_MINUTES || request.getDurationMinutes() > MAX_DURATION_MINUTES) {
            violations.add("Duration must be between " + MIN_DURATION_MINUTES + " and " + MAX_DURATION_MINUTES
                    + " minutes but was " + request.getDurationMinutes());
        }

        if (request.getInterviewerIds().isEmpty()) {
            violations.add("At least one interviewer is required");
        }

        return new Validation(violations, candidate, job);
    }

    private Search search(SchedulingRequest request, Long replacedInterviewId) {
        AvailabilitySnapshot snapshot = availabilityCollector
                .gather(request.getInterviewerIds(), request.window())
                .withoutInterview(replacedInterviewId);

        List<TimeSlot> candidates = slotGenerator
                .generate(request.getEarliestStart(), request.getLatestEnd(), request.getDurationMinutes())
                .stream()
                .map(window -> conflictDetector.toCandidate(window, request.getInterviewerIds(), snapshot))
                .filter(Objects::nonNull)
                .toList();

        if (candidates.isEmpty()) {
            return new Search(candidates, List.of());
        }
        return new Search(candidates, slotScorer.scoreAll(candidates, request, snapshot));
    }

    private Committed commit(SlotSelection selection, SchedulingRequest request, Validation validation,
                             Long replacedInterviewId) {
        List<TimeSlot> ranked = selection.ranked();
        for (int rank = 0; rank < ranked.size(); rank++) {
            TimeSlot slot = ranked.get(rank);
            Optional<Interview> booked = interviewerLocks.withLocks(slot.getParticipantsAvailable(),
                    () -> book(slot, request, validation, replacedInterviewId));
            if (booked.isPresent()) {
                return new Committed(booked.get(), slot, rank);
            }
            log.info("Slot {} was taken while committing, trying next", slot.getStart());
        }
        return null;
    }

    private Optional<Interview> book(TimeSlot slot, SchedulingRequest request, Validation validation,
                                     Long replacedInterviewId) {
        boolean taken = interviewRepository.findOverlapping(slot.getParticipantsAvailable(), InterviewStatus.ACTIVE,
                        slot.getStart(), slot.getEnd())
                .stream()
                .anyMatch(existing -> !Objects.equals(existing.getId(), replacedInterviewId));
        if (taken) {
            return Optional.empty();
        }
        return Optional.of(interviewRepository.save(buildInterview(slot, request, validation)));
    }

    private Interview buildInterview(TimeSlot slot, SchedulingRequest request, Validation validation) {
        List<String> interviewers = request.getInterviewerIds().stream()
                .filter(slot.getParticipantsAvailable()::contains)
                .toList();
        String candidateName = validation.candidate() != null ? validation.candidate().getName() : request.getCandidateId();
        String jobTitle = validation.job() != null ? validation.job().getTitle() : request.getJobPositionId();

        Interview interview = new Interview();
        interview.setCandidateId(request.getCandidateId());
        interview.setJobPositionId(request.getJobPositionId());
        interview.setTitle(request.getInterviewType().displayName() + " Interview - " + candidateName);
        interview.setDescription("Interview for " + jobTitle + " position");
        interview.setInterviewType(request.getInterviewType());
        interview.setStatus(InterviewStatus.SCHEDULED);
        interview.setScheduledStart(slot.getStart());
        interview.setScheduledEnd(slot.getEnd());
        interview.setDurationMinutes(request.getDurationMinutes());
        interview.setTimezone(request.getTimezone());
        interview.setInterviewerIds(new ArrayList<>(interviewers));
        interview.setPrimaryInterviewer(interviewers.isEmpty() ? null : interviewers.get(0));
        interview.setConflictsDetected(new ArrayList<>(slot.getConflicts()));
        interview.setSchedulingPreferences(preferences(request));
        interview.setAutoScheduled(true);
        interview.setSchedulingScore(slot.getScore());
        interview.setCreatedAt(LocalDateTime.now(clock));
        return interview;
    }

    private Map<String, String> preferences(SchedulingRequest request) {
        Map<String, String> prefs = new HashMap<>();
        request.getRequirements().forEach((k, v) -> prefs.put(k, String.valueOf(v)));
        if (!request.getPreferredTimes().isEmpty()) {
            prefs.put("preferred_times", request.getPreferredTimes().stream()
                    .map(Object::toString)
                    .collect(Collectors.joining(", ")));
        }
        return prefs;
    }

    /** Publishes right away, or after commit when the booking joined a caller's transaction. */
    private void notifyScheduled(Interview interview, TimeSlot slot) {
        InterviewScheduledEvent event = InterviewScheduledEvent.of(interview, slot.getConflicts());
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publish(event);
                }
            });
        } else {
            publish(event);
        }
    }

    private void publish(InterviewScheduledEvent event) {
        try {
            notificationPublisher.publishInterviewScheduled(event);
        } catch (Exception e) {
            log.warn("Notification for interview {} failed, booking kept: {}", event.interviewId(), e.getMessage());
        }
    }

    private SchedulingResult fail(SchedulingRequest request, SchedulingErrorType type, List<String> errors,
                                  long startedAt) {
        schedulingLog.recordFailure(ActionType.SCHEDULE, null, request.getStrategy(), type, errors,
                clock.millis() - startedAt);
        return SchedulingResult.failure(type, errors, clock.instant());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    record Validation(List<String> violations, CandidateDTO candidate, JobPositionDTO job) {
    }

    private record Search(List<TimeSlot> candidates, List<TimeSlot> scored) {
    }

    private record Committed(Interview interview, TimeSlot slot, int rank) {
    }
}
