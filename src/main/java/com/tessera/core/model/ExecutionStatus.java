package com.tessera.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one execution.
 * <pre>
 * QUEUED -> RUNNING -> AWAITING_DECISION -> COMMITTING -> COMPLETED
 *                   \-> COMPLETED (no changes)   \-> AWAITING_DECISION (apply refused)
 * any non-terminal -> CANCELLED | FAILED
 * </pre>
 */
public enum ExecutionStatus {
    QUEUED,
    RUNNING,
    AWAITING_DECISION,
    COMMITTING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }

    /** True while the execution holds its session's single running slot. */
    public boolean occupiesSlot() {
        return this == QUEUED || this == RUNNING;
    }

    public boolean canTransitionTo(ExecutionStatus next) {
        return allowedNext().contains(next);
    }

    private Set<ExecutionStatus> allowedNext() {
        return switch (this) {
            case QUEUED -> EnumSet.of(RUNNING, CANCELLED, FAILED);
            case RUNNING -> EnumSet.of(AWAITING_DECISION, COMPLETED, CANCELLED, FAILED);
            case AWAITING_DECISION -> EnumSet.of(COMMITTING, CANCELLED, FAILED);
            case COMMITTING -> EnumSet.of(COMPLETED, AWAITING_DECISION, CANCELLED, FAILED);
            case COMPLETED, CANCELLED, FAILED -> EnumSet.noneOf(ExecutionStatus.class);
        };
    }
}
