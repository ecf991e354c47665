package com.example.interview.client.impl;

import com.example.interview.config.SchedulerConfig;
import com.example.interview.dto.InterviewScheduledEvent;
import com.example.interview.model.Interview;
import com.example.interview.model.InterviewType;
import com.example.interview.service.exception.NotificationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookNotificationPublisherTest {

    private SchedulerConfig config;
    private WebhookNotificationPublisher publisher;
    private InterviewScheduledEvent event;

    @BeforeEach
    void setUp() {
        config = new SchedulerConfig();
        config.setExternalTimeout(Duration.ofSeconds(2));
        publisher = new WebhookNotificationPublisher(config);

        Interview interview = new Interview();
        interview.setId(1L);
        interview.setCandidateId("cand-1");
        interview.setInterviewType(InterviewType.VIDEO_CALL);
        interview.setScheduledStart(LocalDateTime.of(2026, 11, 2, 9, 0));
        interview.setScheduledEnd(LocalDateTime.of(2026, 11, 2, 10, 0));
        interview.setInterviewerIds(new ArrayList<>(List.of("alice")));
        event = InterviewScheduledEvent.of(interview, List.of());
    }

    @Test
    void disabledPublisherSendsNothing() {
        config.setNotificationsEnabled(false);
        config.setNotificationsApiUrl("http://localhost:1");

        assertThatCode(() -> publisher.publishInterviewScheduled(event)).doesNotThrowAnyException();
    }

    @Test
    void missingEndpointIsSkipped() {
        config.setNotificationsEnabled(true);
        config.setNotificationsApiUrl("");

        assertThatCode(() -> publisher.publishInterviewScheduled(event)).doesNotThrowAnyException();
    }

    @Test
    void unreachableEndpointRaisesNotificationException() {
        config.setNotificationsEnabled(true);
        config.setNotificationsApiUrl("http://127.0.0.1:1/api");

        assertThatThrownBy(() -> publisher.publishInterviewScheduled(event))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("interview.scheduled");
    }
}
