package org.rentalrepairs.engine.domain.model;

import java.util.Locale;

/**
 * Urgency level of a repair request.
 */
public enum Urgency {
    LOW(168),
    NORMAL(72),
    HIGH(24),
    CRITICAL(4),
    EMERGENCY(2);

    private final int expectedResolutionHours;

    Urgency(int expectedResolutionHours) {
        this.expectedResolutionHours = expectedResolutionHours;
    }

    public int getExpectedResolutionHours() {
        return expectedResolutionHours;
    }

    /**
     * Critical and Emergency requests are handled as emergencies.
     */
    public boolean isEmergency() {
        return this == CRITICAL || this == EMERGENCY;
    }

    public static Urgency fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Urgency level must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid urgency level: " + value, e);
        }
    }
}
