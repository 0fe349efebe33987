package com.markettracker.schedule.recurrence;

import com.markettracker.domain.JobSchedule;

import java.util.Optional;

/**
 * Outcome of evaluating a missed daily-window row: run it late, or skip it and roll forward to {@link #successor()}.
 */
public final class MissedWindowDecision {

    public enum Action {
        RESTART,
        SKIP
    }

    private final Action action;
    private final JobSchedule successor;

    private MissedWindowDecision(Action action, JobSchedule successor) {
        this.action = action;
        this.successor = successor;
    }

    public static MissedWindowDecision restart() {
        return new MissedWindowDecision(Action.RESTART, null);
    }

    public static MissedWindowDecision skip(JobSchedule successor) {
        return new MissedWindowDecision(Action.SKIP, successor);
    }

    public Action action() {
        return action;
    }

    public boolean isSkip() {
        return action == Action.SKIP;
    }

    /** Next slot strictly after now; present only for SKIP. */
    public Optional<JobSchedule> successor() {
        return Optional.ofNullable(successor);
    }
}
