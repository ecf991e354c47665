package com.example.interview.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "interviews")
@Getter @Setter
public class Interview {

    /** Longest reschedule or cancellation reason that can be stored */
    public static final int MAX_REASON_LENGTH = 2000;

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String candidateId;

    @Column(nullable = false)
    private String jobPositionId;

    private String title;

    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private InterviewType interviewType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private InterviewStatus status = InterviewStatus.SCHEDULED;

    @Column(nullable = false)
    private LocalDateTime scheduledStart;

    @Column(nullable = false)
    private LocalDateTime scheduledEnd;

    private int durationMinutes;

    private String timezone;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "interview_interviewers", joinColumns = @JoinColumn(name = "interview_id"))
    @OrderColumn(name = "idx")
    @Column(name = "interviewer_id", nullable = false)
    private List<String> interviewerIds = new ArrayList<>();

    private String primaryInterviewer;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "interview_conflicts", joinColumns = @JoinColumn(name = "interview_id"))
    @OrderColumn(name = "idx")
    @Column(name = "conflict", length = 1000)
    private List<String> conflictsDetected = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "interview_preferences", joinColumns = @JoinColumn(name = "interview_id"))
    @MapKeyColumn(name = "pref_key")
    @Column(name = "pref_value", length = 1000)
    private Map<String, String> schedulingPreferences = new HashMap<>();

    private boolean autoScheduled;

    private double schedulingScore;

    private int rescheduleCount;

    @Column(length = MAX_REASON_LENGTH)
    private String rescheduleReason;

    @Column(length = MAX_REASON_LENGTH)
    private String cancellationReason;

    /** id of the interview this one replaced, null for the first in a lineage */
    private Long originalInterviewId;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @Version
    private Long version;

    public boolean isUpcoming(LocalDateTime now) {
        return now.isBefore(scheduledStart);
    }
}
