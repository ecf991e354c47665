package com.example.interview.service;

import com.example.interview.config.SchedulerConfig;
import com.example.interview.dto.RescheduleOverrides;
import com.example.interview.dto.SchedulingRequest;
import com.example.interview.model.Interview;
import com.example.interview.model.InterviewStatus;
import com.example.interview.model.SchedulingPriority;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Guard and bookkeeping for moving an interview to a new slot. An interview may be rescheduled while it
 * is scheduled or confirmed, has not started, and has attempts left.
 */
@Component
@RequiredArgsConstructor
public class ReschedulePolicy {

    private final SchedulerConfig config;

    /** Reasons the interview cannot be rescheduled now; empty when it can. */
    public List<String> violations(Interview interview, LocalDateTime now) {
        List<String> violations = new ArrayList<>();
        InterviewStatus status = interview.getStatus();
        boolean movable = switch (status) {
            case SCHEDULED, CONFIRMED -> true;
            case RESCHEDULED, CANCELLED, COMPLETED, NO_SHOW -> false;
        };
        if (!movable) {
            violations.add("Interview is " + status + " and can no longer be rescheduled");
        }
        if (!interview.isUpcoming(now)) {
            violations.add("Interview start " + interview.getScheduledStart() + " is not in the future");
        }
        if (interview.getRescheduleCount() >= config.getMaxRescheduleAttempts()) {
            violations.add("Reschedule limit of " + config.getMaxRescheduleAttempts() + " attempts reached");
        }
        return violations;
    }

    public boolean canReschedule(Interview interview, LocalDateTime now) {
        return violations(interview, now).isEmpty();
    }

    /**
     * Request for the replacement run: the original's parameters, HIGH priority and a fresh search
     * window unless overridden.
     */
    public SchedulingRequest nextRequest(Interview original, RescheduleOverrides overrides, LocalDateTime now) {
        RescheduleOverrides o = overrides != null ? overrides : RescheduleOverrides.NONE;

        List<String> interviewers = o.getInterviewerIds() != null && !o.getInterviewerIds().isEmpty()
                ? o.getInterviewerIds()
                : original.getInterviewerIds();

        SchedulingRequest.SchedulingRequestBuilder builder = SchedulingRequest.builder()
                .candidateId(original.getCandidateId())
                .jobPositionId(original.getJobPositionId())
                .interviewType(original.getInterviewType())
                .interviewerIds(interviewers)
                .durationMinutes(original.getDurationMinutes())
                .timezone(original.getTimezone())
                .priority(o.getPriority() != null ? o.getPriority() : SchedulingPriority.HIGH)
                .earliestStart(o.getEarliestStart() != null
                        ? o.getEarliestStart() : now.plus(config.getDefaultLeadTime()))
                .latestEnd(o.getLatestEnd() != null
                        ? o.getLatestEnd() : now.plus(config.getDefaultSearchHorizon()));

        original.getSchedulingPreferences().forEach(builder::requirement);
        return builder.build();
    }

    /** Retires the original and links the replacement into its lineage. */
    public void applyReschedule(Interview original, Interview replacement, String reason, LocalDateTime now) {
        original.setStatus(InterviewStatus.RESCHEDULED);
        original.setRescheduleCount(original.getRescheduleCount() + 1);
        original.setRescheduleReason(reason);
        original.setUpdatedAt(now);

        replacement.setOriginalInterviewId(original.getId());
        replacement.setRescheduleCount(original.getRescheduleCount());
        replacement.setUpdatedAt(now);
    }
}
