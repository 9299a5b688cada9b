package org.rentalrepairs.engine.domain.model;

/**
 * Completion state of a booking.
 */
public enum CompletionState {
    NOT_COMPLETED,
    COMPLETED_SUCCESSFUL,
    COMPLETED_UNSUCCESSFUL;

    public boolean isCompleted() {
        return this != NOT_COMPLETED;
    }
}
