package com.example.interview.client.impl;

import com.example.interview.client.NotificationPublisher;
import com.example.interview.config.SchedulerConfig;
import com.example.interview.dto.InterviewScheduledEvent;
import com.example.interview.service.exception.NotificationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;


@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookNotificationPublisher implements NotificationPublisher {

    private final SchedulerConfig cfg;

    private WebClient client() {
        return WebClient.builder()
                .baseUrl(cfg.getNotificationsApiUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public void publishInterviewScheduled(InterviewScheduledEvent event) {
        if (!cfg.isNotificationsEnabled() || cfg.getNotificationsApiUrl() == null
                || cfg.getNotificationsApiUrl().isBlank()) {
            log.debug("Notifications disabled, skipping {} for interview {}", event.eventType(), event.interviewId());
            return;
        }
        try {
            client().post()
                    .uri("/events/{type}", event.eventType())
                    .bodyValue(event)
                    .retrieve()
                    .toBodilessEntity()
                    .block(cfg.getExternalTimeout());
            log.info("Published {} for interview {}", event.eventType(), event.interviewId());
        } catch (Exception e) {
            throw new NotificationException("Publish of " + event.eventType() + " failed: " + e.getMessage(), e);
        }
    }
}
