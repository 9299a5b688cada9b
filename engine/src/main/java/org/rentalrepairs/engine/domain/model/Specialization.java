package org.rentalrepairs.engine.domain.model;

import java.util.Locale;

/**
 * Trade a maintenance worker is qualified for.
 * GENERAL_MAINTENANCE is the universal, lower-priority fallback.
 */
public enum Specialization {

    GENERAL_MAINTENANCE("General Maintenance", "Can handle any type of maintenance work", true),
    PLUMBING("Plumbing", "Leaks, pipes, drains, toilets", true),
    ELECTRICAL("Electrical", "Outlets, wiring, lights, circuits", true),
    HVAC("HVAC", "Heating, cooling, ventilation", true),
    CARPENTRY("Carpentry", "Wood, cabinets, doors, frames", false),
    PAINTING("Painting", "Walls, ceilings, trim", false),
    LOCKSMITH("Locksmith", "Locks, keys, security", true),
    APPLIANCE_REPAIR("Appliance Repair", "Refrigerators, washers, dryers, ovens", false);

    private final String displayName;
    private final String description;
    private final boolean emergencyCapable;

    Specialization(String displayName, String description, boolean emergencyCapable) {
        this.displayName = displayName;
        this.description = description;
        this.emergencyCapable = emergencyCapable;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Whether workers of this trade are dispatched on emergency call-outs.
     */
    public boolean isEmergencyCapable() {
        return emergencyCapable;
    }

    /**
     * Whether a worker of this trade may service work requiring {@code required}.
     * Exact match, or this is GENERAL_MAINTENANCE.
     */
    public boolean canHandle(Specialization required) {
        return this == required || this == GENERAL_MAINTENANCE;
    }

    /**
     * Whether {@code required} is matched exactly (no general-maintenance fallback).
     */
    public boolean isExactMatchFor(Specialization required) {
        return this == required;
    }

    /**
     * Parses free-text trade names ("plumber", "HVAC technician", "Appliance Repair", ...).
     * Unknown or blank input yields GENERAL_MAINTENANCE.
     */
    public static Specialization parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            return GENERAL_MAINTENANCE;
        }

        String normalized = text.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "plumbing":
            case "plumber":
                return PLUMBING;
            case "electrical":
            case "electrician":
                return ELECTRICAL;
            case "hvac":
            case "hvac technician":
            case "heating":
            case "cooling":
                return HVAC;
            case "carpentry":
            case "carpenter":
                return CARPENTRY;
            case "painting":
            case "painter":
                return PAINTING;
            case "locksmith":
                return LOCKSMITH;
            case "appliance repair":
            case "appliance technician":
            case "appliancerepair":
                return APPLIANCE_REPAIR;
            case "general maintenance":
            case "generalmaintenance":
            case "maintenance":
            case "general":
                return GENERAL_MAINTENANCE;
            default:
                break;
        }

        String constantName = normalized.replace(' ', '_').toUpperCase(Locale.ROOT);
        for (Specialization candidate : values()) {
            if (candidate.name().equals(constantName)) {
                return candidate;
            }
        }
        return GENERAL_MAINTENANCE;
    }
}
