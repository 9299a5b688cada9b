package org.rentalrepairs.engine.domain.model;

/**
 * Reason tag attached to a failed (or warned) validation outcome.
 */
public enum ConflictType {
    NONE,
    SPECIALIZATION_MISMATCH,
    UNIT_CONFLICT,
    WORKER_INACTIVE,
    PAST_DATE,
    WORKER_FULLY_BOOKED,
    REQUEST_NOT_ASSIGNABLE
}
