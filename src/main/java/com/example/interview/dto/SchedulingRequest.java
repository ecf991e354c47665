package com.example.interview.dto;

import com.example.interview.model.InterviewType;
import com.example.interview.model.SchedulingPriority;
import com.example.interview.model.SchedulingStrategy;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * One scheduling call. Immutable; validation happens in the scheduling service so that every
 * violation can be reported at once.
 */
@Value
@Builder(toBuilder = true)
public class SchedulingRequest {

    String candidateId;
    String jobPositionId;
    InterviewType interviewType;

    @Singular
    List<String> interviewerIds;

    @Builder.Default
    int durationMinutes = 60;

    LocalDateTime earliestStart;
    LocalDateTime latestEnd;

    @Builder.Default
    String timezone = "UTC";

    @Builder.Default
    SchedulingPriority priority = SchedulingPriority.MEDIUM;

    @Builder.Default
    SchedulingStrategy strategy = SchedulingStrategy.BALANCED;

    @Singular
    List<PreferredTime> preferredTimes;

    @Singular
    Map<String, Object> requirements;

    public SearchWindow window() {
        return new SearchWindow(earliestStart, latestEnd);
    }
}
