package com.di.qualitygate.model;

/**
 * Per-table lifecycle. Transitions only move forward; {@link #FAILED} is reachable from any
 * non-terminal state, and {@link #LOADED} and {@link #FAILED} are terminal.
 */
public enum TableStatus {
    PENDING,
    EXTRACTED,
    TRANSFORMED,
    VALIDATED,
    LOADED,
    FAILED;

    public boolean isTerminal() {
        return this == LOADED || this == FAILED;
    }

    public boolean canTransitionTo(TableStatus next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
