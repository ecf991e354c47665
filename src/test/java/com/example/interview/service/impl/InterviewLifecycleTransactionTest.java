package com.example.interview.service.impl;

import com.example.interview.client.CandidateDirectory;
import com.example.interview.client.NotificationPublisher;
import com.example.interview.dto.CandidateDTO;
import com.example.interview.dto.JobPositionDTO;
import com.example.interview.dto.RescheduleOverrides;
import com.example.interview.dto.RescheduleResult;
import com.example.interview.dto.SchedulingErrorType;
import com.example.interview.dto.SchedulingRequest;
import com.example.interview.dto.SchedulingResult;
import com.example.interview.model.Interview;
import com.example.interview.model.InterviewStatus;
import com.example.interview.model.InterviewType;
import com.example.interview.repository.InterviewRepository;
import com.example.interview.service.InterviewLifecycleService;
import com.example.interview.service.InterviewSchedulingService;
import com.example.interview.service.SchedulingLogService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Reschedule against a real H2 database, where the replacement row and the retired original are
 * committed together.
 */
@SpringBootTest
@AutoConfigureTestDatabase
class InterviewLifecycleTransactionTest {

    // a Tuesday well inside the default horizon
    private static final LocalDate DAY = LocalDate.now(ZoneOffset.UTC).plusDays(7)
            .with(TemporalAdjusters.next(DayOfWeek.TUESDAY));

    @Autowired
    private InterviewLifecycleService lifecycleService;

    @Autowired
    private InterviewSchedulingService schedulingService;

    @Autowired
    private InterviewRepository interviewRepository;

    @MockBean
    private CandidateDirectory candidateDirectory;

    @MockBean
    private NotificationPublisher notificationPublisher;

    @MockBean
    private SchedulingLogService schedulingLog;

    private Interview original;

    @BeforeEach
    void setUp() {
        Mockito.when(candidateDirectory.findCandidate(anyString()))
                .thenAnswer(invocation -> Optional.of(
                        new CandidateDTO(invocation.getArgument(0), "Jane Doe", "jane@example.com")));
        Mockito.when(candidateDirectory.findJobPosition(anyString()))
                .thenReturn(Optional.of(new JobPositionDTO("job-1", "Backend Engineer")));

        Interview interview = new Interview();
        interview.setCandidateId("cand-1");
        interview.setJobPositionId("job-1");
        interview.setTitle("Technical Interview - Jane Doe");
        interview.setInterviewType(InterviewType.TECHNICAL);
        interview.setStatus(InterviewStatus.SCHEDULED);
        interview.setScheduledStart(DAY.atTime(14, 0));
        interview.setScheduledEnd(DAY.atTime(15, 0));
        interview.setDurationMinutes(60);
        interview.setTimezone("UTC");
        interview.setInterviewerIds(new ArrayList<>(List.of("alice")));
        interview.setCreatedAt(LocalDateTime.now(ZoneOffset.UTC));
        original = interviewRepository.save(interview);
    }

    @AfterEach
    void tearDown() {
        interviewRepository.deleteAll();
    }

    private static RescheduleOverrides morning() {
        return RescheduleOverrides.builder()
                .earliestStart(DAY.atTime(9, 0))
                .latestEnd(DAY.atTime(10, 0))
                .build();
    }

    private List<Interview> aliceMorning() {
        return interviewRepository.findOverlapping(List.of("alice"), InterviewStatus.ACTIVE,
                DAY.atTime(9, 0), DAY.atTime(10, 0));
    }

    @Test
    void concurrentBookingWaitsForRescheduleCommit() throws Exception {
        CountDownLatch booked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Mockito.doAnswer(invocation -> {
            booked.countDown();
            release.await(10, TimeUnit.SECONDS);
            return null;
        }).when(schedulingLog).recordRescheduleSuccess(any(), any(), any(), anyLong(), anyDouble());

        SchedulingRequest competing = SchedulingRequest.builder()
                .candidateId("cand-2")
                .jobPositionId("job-1")
                .interviewType(InterviewType.TECHNICAL)
                .interviewerId("alice")
                .durationMinutes(60)
                .earliestStart(DAY.atTime(9, 0))
                .latestEnd(DAY.atTime(10, 0))
                .build();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<RescheduleResult> reschedule =
                    executor.submit(() -> lifecycleService.reschedule(original.getId(), "Room change", morning()));
            assertThat(booked.await(10, TimeUnit.SECONDS)).isTrue();

            Future<SchedulingResult> other = executor.submit(() -> schedulingService.scheduleInterview(competing));
            Thread.sleep(500);
            assertThat(other.isDone()).isFalse();

            release.countDown();
            RescheduleResult rescheduled = reschedule.get(10, TimeUnit.SECONDS);
            SchedulingResult competed = other.get(10, TimeUnit.SECONDS);

            assertThat(rescheduled.success()).isTrue();
            assertThat(competed.success()).isFalse();
            assertThat(competed.errorType()).isEqualTo(SchedulingErrorType.NO_SLOTS_AVAILABLE);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        assertThat(aliceMorning()).singleElement()
                .satisfies(i -> assertThat(i.getOriginalInterviewId()).isEqualTo(original.getId()));
    }

    @Test
    void rolledBackRescheduleSendsNoNotification() {
        Mockito.doThrow(new IllegalStateException("audit store down"))
                .when(schedulingLog).recordRescheduleSuccess(any(), any(), any(), anyLong(), anyDouble());

        RescheduleResult result = lifecycleService.reschedule(original.getId(), "Room change", morning());

        assertThat(result.success()).isFalse();
        assertThat(result.errorType()).isEqualTo(SchedulingErrorType.SCHEDULING_ERROR);
        verify(notificationPublisher, never()).publishInterviewScheduled(any());
        assertThat(interviewRepository.count()).isEqualTo(1);
        assertThat(interviewRepository.findById(original.getId()))
                .hasValueSatisfying(i -> assertThat(i.getStatus()).isEqualTo(InterviewStatus.SCHEDULED));
        assertThat(aliceMorning()).isEmpty();
    }

    @Test
    void longReasonIsStoredAndAnnouncedAfterCommit() {
        String reason = "Candidate asked to move the interview. ".repeat(8);

        RescheduleResult result = lifecycleService.reschedule(original.getId(), reason, morning());

        assertThat(result.success()).isTrue();
        assertThat(interviewRepository.findById(original.getId())).hasValueSatisfying(i -> {
            assertThat(i.getStatus()).isEqualTo(InterviewStatus.RESCHEDULED);
            assertThat(i.getRescheduleReason()).isEqualTo(reason);
        });
        verify(notificationPublisher).publishInterviewScheduled(any());
    }
}
