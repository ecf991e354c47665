package com.example.interview.model;

import java.util.EnumSet;
import java.util.Set;

public enum InterviewStatus {
    SCHEDULED,
    CONFIRMED,
    RESCHEDULED,
    CANCELLED,
    COMPLETED,
    NO_SHOW;

    /** Statuses that occupy the interviewers' calendars. */
    public static final Set<InterviewStatus> ACTIVE = EnumSet.of(SCHEDULED, CONFIRMED);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return !isActive();
    }

    /**
     * Transitions driven by lifecycle operations. RESCHEDULED is set only by the reschedule flow,
     * which runs its own guard.
     */
    public boolean canTransitionTo(InterviewStatus next) {
        return switch (this) {
            case SCHEDULED -> next == CONFIRMED || next == CANCELLED || next == COMPLETED || next == NO_SHOW;
            case CONFIRMED -> next == CANCELLED || next == COMPLETED || next == NO_SHOW;
            case RESCHEDULED, CANCELLED, COMPLETED, NO_SHOW -> false;
        };
    }
}
