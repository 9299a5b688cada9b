package org.rentalrepairs.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of another request's booking as reported in a snapshot.
 * Wire names are the persistence layer's PascalCase tokens.
 */
public enum BookingStatus {

    DRAFT("Draft"),
    SUBMITTED("Submitted"),
    SCHEDULED("Scheduled"),
    IN_PROGRESS("InProgress"),
    DONE("Done"),
    FAILED("Failed"),
    DECLINED("Declined"),
    CLOSED("Closed"),
    CANCELLED("Cancelled");

    private final String wireName;

    BookingStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Only scheduled or in-progress bookings still hold the unit on their date.
     */
    public boolean occupiesUnit() {
        return this == SCHEDULED || this == IN_PROGRESS;
    }

    @JsonCreator
    public static BookingStatus fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (BookingStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(trimmed) || status.name().equalsIgnoreCase(trimmed)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown booking status: " + value);
    }
}
