package com.example.interview.dto;

import com.example.interview.model.SchedulingPriority;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Optional replacements for the request rebuilt from the original interview. Null fields keep the
 * defaults.
 */
@Value
@Builder
public class RescheduleOverrides {

    public static final RescheduleOverrides NONE = RescheduleOverrides.builder().build();

    LocalDateTime earliestStart;
    LocalDateTime latestEnd;
    List<String> interviewerIds;
    SchedulingPriority priority;
}
