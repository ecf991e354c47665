package com.example.interview.service.impl;

import com.example.interview.dto.InterviewDTO;
import com.example.interview.dto.LifecycleResult;
import com.example.interview.dto.RescheduleOverrides;
import com.example.interview.dto.RescheduleResult;
import com.example.interview.dto.SchedulingErrorType;
import com.example.interview.dto.SchedulingRequest;
import com.example.interview.dto.SchedulingResult;
import com.example.interview.model.Interview;
import com.example.interview.model.InterviewStatus;
import com.example.interview.model.SchedulingLog.ActionType;
import com.example.interview.repository.InterviewRepository;
import com.example.interview.service.InterviewLifecycleService;
import com.example.interview.service.InterviewSchedulingService;
import com.example.interview.service.ReschedulePolicy;
import com.example.interview.service.SchedulingLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class InterviewLifecycleServiceImpl implements InterviewLifecycleService {

    private final InterviewRepository interviewRepository;
    private final InterviewSchedulingService schedulingService;
    private final ReschedulePolicy reschedulePolicy;
    private final SchedulingLogService schedulingLog;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public RescheduleResult reschedule(Long interviewId, String reason) {
        return reschedule(interviewId, reason, RescheduleOverrides.NONE);
    }

    @Override
    public RescheduleResult reschedule(Long interviewId, String reason, RescheduleOverrides overrides) {
        long startedAt = clock.millis();
        log.info("Rescheduling interview {}: {}", interviewId, reason);
        if (tooLong(reason)) {
            return rejected(interviewId, SchedulingErrorType.VALIDATION_FAILED,
                    List.of(reasonTooLong("Reschedule")), startedAt);
        }
        try {
            RescheduleResult result = transactionTemplate.execute(tx -> doReschedule(interviewId, reason, overrides, startedAt));
            if (result == null) {
                throw new IllegalStateException("Reschedule transaction returned no result");
            }
            return result;
        } catch (OptimisticLockingFailureException e) {
            log.warn("Interview {} changed while it was being rescheduled: {}", interviewId, e.getMessage());
            return rejected(interviewId, SchedulingErrorType.SCHEDULING_ERROR,
                    List.of("Interview " + interviewId + " was changed by another operation, retry the reschedule"),
                    startedAt);
        } catch (RuntimeException e) {
            log.error("Rescheduling interview {} failed", interviewId, e);
            return rejected(interviewId, SchedulingErrorType.SCHEDULING_ERROR,
                    List.of(String.valueOf(e.getMessage())), startedAt);
        }
    }

    /**
     * The original is read without a row lock so the slot search does not block other writers. A concurrent
     * change to it fails the versioned update below and rolls back the replacement with it.
     */
    private RescheduleResult doReschedule(Long interviewId, String reason, RescheduleOverrides overrides,
                                          long startedAt) {
        LocalDateTime now = LocalDateTime.now(clock);

        Optional<Interview> found = interviewRepository.findById(interviewId);
        if (found.isEmpty()) {
            return rejected(interviewId, SchedulingErrorType.INTERVIEW_NOT_FOUND,
                    List.of("Interview " + interviewId + " not found"), startedAt);
        }
        Interview original = found.get();

        List<String> violations = reschedulePolicy.violations(original, now);
        if (!violations.isEmpty()) {
            log.info("Interview {} cannot be rescheduled: {}", interviewId, violations);
            return rejected(interviewId, SchedulingErrorType.CANNOT_RESCHEDULE, violations, startedAt);
        }

        SchedulingRequest request = reschedulePolicy.nextRequest(original, overrides, now);
        SchedulingResult scheduled = schedulingService.scheduleInterview(request, original.getId());
        if (!scheduled.success()) {
            // the scheduling run has already audited its own failure
            return RescheduleResult.failure(interviewId, scheduled.errorType(), scheduled.errors());
        }

        Interview replacement = interviewRepository.findById(scheduled.interview().id())
                .orElseThrow(() -> new IllegalStateException(
                        "Replacement interview " + scheduled.interview().id() + " disappeared"));

        reschedulePolicy.applyReschedule(original, replacement, reason, now);
        interviewRepository.saveAndFlush(original);
        interviewRepository.save(replacement);

        schedulingLog.recordRescheduleSuccess(replacement.getId(), original.getId(), reason,
                clock.millis() - startedAt, scheduled.slotDetails().score());

        log.info("Interview {} rescheduled to {} at {} (attempt {})", original.getId(), replacement.getId(),
                replacement.getScheduledStart(), original.getRescheduleCount());

        return RescheduleResult.success(original.getId(), InterviewDTO.from(replacement), reason,
                original.getRescheduleCount());
    }

    private RescheduleResult rejected(Long interviewId, SchedulingErrorType type, List<String> errors, long startedAt) {
        schedulingLog.recordFailure(ActionType.RESCHEDULE, interviewId, null, type, errors,
                clock.millis() - startedAt);
        return RescheduleResult.failure(interviewId, type, errors);
    }

    @Override
    public LifecycleResult confirm(Long interviewId) {
        return transition(interviewId, InterviewStatus.CONFIRMED, null);
    }

    @Override
    public LifecycleResult cancel(Long interviewId, String reason) {
        return transition(interviewId, InterviewStatus.CANCELLED, reason);
    }

    @Override
    public LifecycleResult complete(Long interviewId) {
        return transition(interviewId, InterviewStatus.COMPLETED, null);
    }

    @Override
    public LifecycleResult markNoShow(Long interviewId) {
        return transition(interviewId, InterviewStatus.NO_SHOW, null);
    }

    private LifecycleResult transition(Long interviewId, InterviewStatus next, String reason) {
        if (tooLong(reason)) {
            return LifecycleResult.failure(SchedulingErrorType.VALIDATION_FAILED, reasonTooLong("Cancellation"));
        }
        try {
            LifecycleResult result = transactionTemplate.execute(tx -> {
                Optional<Interview> found = interviewRepository.findByIdForUpdate(interviewId);
                if (found.isEmpty()) {
                    return LifecycleResult.failure(SchedulingErrorType.INTERVIEW_NOT_FOUND,
                            "Interview " + interviewId + " not found");
                }
                Interview interview = found.get();
                InterviewStatus current = interview.getStatus();
                if (!current.canTransitionTo(next)) {
                    return LifecycleResult.failure(SchedulingErrorType.INVALID_TRANSITION,
                            "Interview " + interviewId + " cannot move from " + current + " to " + next);
                }
                interview.setStatus(next);
                if (next == InterviewStatus.CANCELLED) {
                    interview.setCancellationReason(reason);
                }
                interview.setUpdatedAt(LocalDateTime.now(clock));
                Interview saved = interviewRepository.save(interview);
                log.info("Interview {} moved {} -> {}", interviewId, current, next);
                return LifecycleResult.success(InterviewDTO.from(saved));
            });
            if (result == null) {
                throw new IllegalStateException("Transition transaction returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Moving interview {} to {} failed", interviewId, next, e);
            return LifecycleResult.failure(SchedulingErrorType.SCHEDULING_ERROR, String.valueOf(e.getMessage()));
        }
    }

    private static boolean tooLong(String reason) {
        return reason != null && reason.length() > Interview.MAX_REASON_LENGTH;
    }

    private static String reasonTooLong(String kind) {
        return kind + " reason must be at most " + Interview.MAX_REASON_LENGTH + " characters";
    }

    @Override
    public List<InterviewDTO> lineage(Long interviewId) {
        List<InterviewDTO> chain = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        Long cursor = interviewId;
        while (cursor != null && seen.add(cursor)) {
            Optional<Interview> found = interviewRepository.findById(cursor);
            if (found.isEmpty()) {
                break;
            }
            chain.add(InterviewDTO.from(found.get()));
            cursor = found.get().getOriginalInterviewId();
        }
        Collections.reverse(chain);
        return chain;
    }
}
