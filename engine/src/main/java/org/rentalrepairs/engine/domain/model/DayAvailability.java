package org.rentalrepairs.engine.domain.model;

/**
 * How much of a worker's daily slot capacity is used on a given date.
 */
public enum DayAvailability {
    FULLY_AVAILABLE,
    PARTIALLY_BOOKED,
    FULLY_BOOKED
}
