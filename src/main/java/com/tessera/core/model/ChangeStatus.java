package com.tessera.core.model;

/**
 * Decision state of a proposed change. APPLIED is reachable only from ACCEPTED or
 * MODIFIED, REVERTED only from APPLIED. Decisions may be revised until the change
 * is applied.
 */
public enum ChangeStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    MODIFIED,
    APPLIED,
    REVERTED;

    public boolean canTransitionTo(ChangeStatus next) {
        return switch (this) {
            case PENDING, ACCEPTED, REJECTED, MODIFIED -> switch (next) {
                case ACCEPTED, REJECTED, MODIFIED -> true;
                case APPLIED -> this == ACCEPTED || this == MODIFIED;
                default -> false;
            };
            case APPLIED -> next == REVERTED;
            case REVERTED -> false;
        };
    }

    public boolean isApplicable() {
        return this == ACCEPTED || this == MODIFIED;
    }
}
