package com.example.interview.client;

import com.example.interview.dto.InterviewScheduledEvent;

public interface NotificationPublisher {

    /** Best-effort delivery to the communication service; throws NotificationException on failure */
    void publishInterviewScheduled(InterviewScheduledEvent event);
}
