package org.rentalrepairs.engine.domain.model;

/**
 * Category of a scheduling time slot.
 */
public enum SlotType {
    STANDARD,
    MORNING,
    AFTERNOON,
    EVENING,
    TENANT_PREFERRED,
    EMERGENCY,
    FLEXIBLE
}
