package com.example.interview.service;

import com.example.interview.config.SchedulingProperties;
import com.example.interview.dto.SlotWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates fixed-length windows across a search range, stepping by the configured granularity
 * and keeping only windows that lie inside working hours.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotGenerator {

    private final SchedulingProperties properties;

    /**
     * Ordered candidate windows. An empty range or a duration longer than the range gives an empty list.
     */
    public List<SlotWindow> generate(LocalDateTime earliestStart, LocalDateTime latestEnd, int durationMinutes) {
        List<SlotWindow> windows = new ArrayList<>();
        if (earliestStart == null || latestEnd == null || durationMinutes <= 0
                || !earliestStart.isBefore(latestEnd)) {
            return windows;
        }

        SchedulingProperties.WorkingHours hours = properties.getWorkingHours();
        int step = hours.getStepMinutes();
        if (step <= 0) {
            throw new IllegalStateException("scheduler.working-hours.step-minutes must be positive");
        }

        LocalDateTime current = earliestStart;
        while (current.isBefore(latestEnd)) {
            LocalDateTime end = current.plusMinutes(durationMinutes);
            if (end.isAfter(latestEnd)) {
                break;
            }
            if (isWorkingTime(current, end, hours)) {
                windows.add(new SlotWindow(current, end));
            }
            current = current.plusMinutes(step);
        }

        log.debug("Generated {} windows for {}..{} ({} min)", windows.size(), earliestStart, latestEnd, durationMinutes);
        return windows;
    }

    boolean isWorkingTime(LocalDateTime start, LocalDateTime end, SchedulingProperties.WorkingHours hours) {
        if (!hours.getDays().contains(start.getDayOfWeek())) {
            return false;
        }
        if (!start.toLocalDate().equals(end.toLocalDate())) {
            return false;
        }
        LocalTime from = start.toLocalTime();
        LocalTime to = end.toLocalTime();
        return !from.isBefore(hours.getStart()) && !to.isAfter(hours.getEnd());
    }
}
