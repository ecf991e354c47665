package com.example.interview.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only audit record, one per schedule or reschedule attempt.
 */
@Entity
@Table(name = "scheduling_log")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SchedulingLog {

    public enum ActionType { SCHEDULE, RESCHEDULE }

    public enum ActionStatus { SUCCESS, FAILED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long interviewId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ActionType actionType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ActionStatus actionStatus;

    @Enumerated(EnumType.STRING)
    private SchedulingStrategy strategy;

    private String errorType;

    /** error text for failures, lineage note for reschedules */
    @Column(length = 2000)
    private String message;

    private Integer slotsEvaluated;

    private Long processingTimeMs;

    private Double successScore;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "scheduling_log_alternatives", joinColumns = @JoinColumn(name = "log_id"))
    @OrderColumn(name = "idx")
    @Builder.Default
    private List<LoggedAlternative> alternatives = new ArrayList<>();

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
