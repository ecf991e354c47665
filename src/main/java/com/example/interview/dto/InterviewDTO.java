package com.example.interview.dto;

import com.example.interview.model.Interview;
import com.example.interview.model.InterviewStatus;
import com.example.interview.model.InterviewType;

import java.time.LocalDateTime;
import java.util.List;

public record InterviewDTO(Long id,
                           String candidateId,
                           String jobPositionId,
                           String title,
                           InterviewType interviewType,
                           InterviewStatus status,
                           LocalDateTime scheduledStart,
                           LocalDateTime scheduledEnd,
                           int durationMinutes,
                           String timezone,
                           List<String> interviewerIds,
                           List<String> conflictsDetected,
                           int rescheduleCount,
                           Long originalInterviewId) {

    public static InterviewDTO from(Interview interview) {
        return new InterviewDTO(
                interview.getId(),
                interview.getCandidateId(),
                interview.getJobPositionId(),
                interview.getTitle(),
                interview.getInterviewType(),
                interview.getStatus(),
                interview.getScheduledStart(),
                interview.getScheduledEnd(),
                interview.getDurationMinutes(),
                interview.getTimezone(),
                List.copyOf(interview.getInterviewerIds()),
                List.copyOf(interview.getConflictsDetected()),
                interview.getRescheduleCount(),
                interview.getOriginalInterviewId()
        );
    }
}
