package com.example.interview.dto;

import com.example.interview.model.Interview;

import java.util.List;

/**
 * Payload of the "interview.scheduled" event. Timestamps are ISO-8601 local date-times in the
 * scheduler zone.
 */
public record InterviewScheduledEvent(String eventType,
                                      Long interviewId,
                                      String candidateId,
                                      String jobPositionId,
                                      String interviewType,
                                      String scheduledStart,
                                      String scheduledEnd,
                                      List<String> interviewerIds,
                                      int durationMinutes,
                                      String timezone,
                                      List<String> conflicts) {

    public static final String EVENT_TYPE = "interview.scheduled";

    public static InterviewScheduledEvent of(Interview interview, List<String> conflicts) {
        return new InterviewScheduledEvent(
                EVENT_TYPE,
                interview.getId(),
                interview.getCandidateId(),
                interview.getJobPositionId(),
                interview.getInterviewType().name(),
                interview.getScheduledStart().toString(),
                interview.getScheduledEnd().toString(),
                List.copyOf(interview.getInterviewerIds()),
                interview.getDurationMinutes(),
                interview.getTimezone(),
                List.copyOf(conflicts)
        );
    }
}
