package com.example.interview.service;

import com.example.interview.dto.InterviewDTO;
import com.example.interview.dto.LifecycleResult;
import com.example.interview.dto.RescheduleOverrides;
import com.example.interview.dto.RescheduleResult;

import java.util.List;

/**
 * Status transitions of booked interviews. Transitions on the same interview are serialized.
 */
public interface InterviewLifecycleService {

    RescheduleResult reschedule(Long interviewId, String reason);

    RescheduleResult reschedule(Long interviewId, String reason, RescheduleOverrides overrides);

    LifecycleResult confirm(Long interviewId);

    LifecycleResult cancel(Long interviewId, String reason);

    LifecycleResult complete(Long interviewId);

    LifecycleResult markNoShow(Long interviewId);

    /** The reschedule chain ending at the given interview, oldest first; empty when it does not exist */
    List<InterviewDTO> lineage(Long interviewId);
}
