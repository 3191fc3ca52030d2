package com.webresearch.core.entity;

/**
 * Status of a research session.
 * IDLE -> PLANNING -> EXECUTING <-> PAUSED -> STOPPING -> COMPLETED, FAILED from PLANNING/EXECUTING.
 */
public enum ExecutionStatus {
    IDLE,
    PLANNING,
    EXECUTING,
    PAUSED,
    STOPPING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(ExecutionStatus next) {
        switch (this) {
            case IDLE:
                return next == PLANNING;
            case PLANNING:
                return next == EXECUTING || next == STOPPING || next == FAILED;
            case EXECUTING:
                return next == PAUSED || next == STOPPING || next == FAILED;
            case PAUSED:
                return next == EXECUTING || next == STOPPING;
            case STOPPING:
                return next == COMPLETED;
            default:
                return false;
        }
    }
}
