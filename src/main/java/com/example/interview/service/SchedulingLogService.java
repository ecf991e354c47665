package com.example.interview.service;

import com.example.interview.dto.SchedulingAnalytics;
import com.example.interview.dto.SchedulingErrorType;
import com.example.interview.dto.TimeSlot;
import com.example.interview.model.LoggedAlternative;
import com.example.interview.model.SchedulingLog;
import com.example.interview.model.SchedulingLog.ActionStatus;
import com.example.interview.model.SchedulingLog.ActionType;
import com.example.interview.model.SchedulingStrategy;
import com.example.interview.repository.SchedulingLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Audit sink. A failed write is logged and dropped, it never undoes the operation being audited.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulingLogService {

    private static final int MAX_ALTERNATIVES = 3;

    private final SchedulingLogRepository repository;
    private final Clock clock;

    public void recordScheduleSuccess(Long interviewId, SchedulingStrategy strategy, int slotsEvaluated,
                                      long processingTimeMs, double score, List<TimeSlot> alternates) {
        List<LoggedAlternative> alternatives = alternates.stream()
                .limit(MAX_ALTERNATIVES)
                .map(s -> new LoggedAlternative(s.getStart(), s.getEnd(), s.getScore()))
                .toList();

        save(SchedulingLog.builder()
                .interviewId(interviewId)
                .actionType(ActionType.SCHEDULE)
                .actionStatus(ActionStatus.SUCCESS)
                .strategy(strategy)
                .slotsEvaluated(slotsEvaluated)
                .processingTimeMs(processingTimeMs)
                .successScore(score)
                .alternatives(new ArrayList<>(alternatives))
                .createdAt(LocalDateTime.now(clock))
                .build());
    }

    public void recordRescheduleSuccess(Long newInterviewId, Long originalInterviewId, String reason,
                                        long processingTimeMs, double score) {
        save(SchedulingLog.builder()
                .interviewId(newInterviewId)
                .actionType(ActionType.RESCHEDULE)
                .actionStatus(ActionStatus.SUCCESS)
                .processingTimeMs(processingTimeMs)
                .successScore(score)
                .message("Rescheduled from #" + originalInterviewId + (reason != null ? ": " + reason : ""))
                .createdAt(LocalDateTime.now(clock))
                .build());
    }

    public void recordFailure(ActionType actionType, Long interviewId, SchedulingStrategy strategy,
                              SchedulingErrorType errorType, List<String> errors, long processingTimeMs) {
        save(SchedulingLog.builder()
                .interviewId(interviewId)
                .actionType(actionType)
                .actionStatus(ActionStatus.FAILED)
                .strategy(strategy)
                .errorType(errorType.code())
                .message(String.join("; ", errors))
                .processingTimeMs(processingTimeMs)
                .createdAt(LocalDateTime.now(clock))
                .build());
    }

    public SchedulingAnalytics summarize(LocalDateTime since) {
        List<SchedulingLog> logs = repository.findAllByCreatedAtGreaterThanEqualOrderByCreatedAtAsc(since);

        int successfulSchedules = count(logs, ActionType.SCHEDULE, ActionStatus.SUCCESS);
        int failedSchedules = count(logs, ActionType.SCHEDULE, ActionStatus.FAILED);
        int successfulReschedules = count(logs, ActionType.RESCHEDULE, ActionStatus.SUCCESS);
        int scheduleAttempts = successfulSchedules + failedSchedules;

        double successRate = scheduleAttempts == 0 ? 0.0 : (double) successfulSchedules / scheduleAttempts;
        double avgTime = logs.stream()
                .map(SchedulingLog::getProcessingTimeMs)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .average()
                .orElse(0.0);
        double avgScore = logs.stream()
                .filter(l -> l.getActionType() == ActionType.SCHEDULE && l.getActionStatus() == ActionStatus.SUCCESS)
                .map(SchedulingLog::getSuccessScore)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);

        return new SchedulingAnalytics(since, logs.size(), successfulSchedules, failedSchedules,
                successfulReschedules, successRate, avgTime, avgScore);
    }

    private int count(List<SchedulingLog> logs, ActionType type, ActionStatus status) {
        return (int) logs.stream()
                .filter(l -> l.getActionType() == type && l.getActionStatus() == status)
                .count();
    }

    private void save(SchedulingLog entry) {
        try {
            repository.save(entry);
        } catch (Exception e) {
            log.warn("Failed to write scheduling log {} {} for interview {}: {}",
                    entry.getActionType(), entry.getActionStatus(), entry.getInterviewId(), e.getMessage());
        }
    }
}
