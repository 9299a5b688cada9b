package org.rentalrepairs.engine.domain.model;

import org.rentalrepairs.engine.api.dto.ExistingBookingSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Typed result of an assignment check. Business failures are reported here instead of being thrown.
 */
public final class ValidationOutcome {

    private final boolean valid;
    private final String errorMessage;
    private final ConflictType conflictType;
    private final List<String> warnings;
    private final List<ExistingBookingSnapshot> conflictingBookings;
    private final List<ExistingBookingSnapshot> assignmentsToCancelForEmergency;
    private final List<ExistingBookingSnapshot> emergencyConflicts;

    private ValidationOutcome(Builder builder) {
        this.valid = builder.errorMessage == null;
        this.errorMessage = builder.errorMessage;
        this.conflictType = builder.conflictType;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(builder.warnings));
        this.conflictingBookings = Collections.unmodifiableList(new ArrayList<>(builder.conflictingBookings));
        this.assignmentsToCancelForEmergency =
                Collections.unmodifiableList(new ArrayList<>(builder.assignmentsToCancelForEmergency));
        this.emergencyConflicts = Collections.unmodifiableList(new ArrayList<>(builder.emergencyConflicts));
    }

    public static ValidationOutcome success() {
        return builder().build();
    }

    public static ValidationOutcome failure(String errorMessage, ConflictType conflictType) {
        return builder().fail(errorMessage, conflictType).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return the failure message, or {@code null} when valid
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    public ConflictType getConflictType() {
        return conflictType;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<ExistingBookingSnapshot> getConflictingBookings() {
        return conflictingBookings;
    }

    public List<ExistingBookingSnapshot> getAssignmentsToCancelForEmergency() {
        return assignmentsToCancelForEmergency;
    }

    public boolean requiresEmergencyOverride() {
        return !assignmentsToCancelForEmergency.isEmpty();
    }

    public boolean hasEmergencyConflicts() {
        return !emergencyConflicts.isEmpty();
    }

    public List<ExistingBookingSnapshot> getEmergencyConflicts() {
        return emergencyConflicts;
    }

    @Override
    public String toString() {
        if (!valid) {
            return String.format("ValidationOutcome{invalid, type=%s, message='%s'}", conflictType, errorMessage);
        }
        return String.format("ValidationOutcome{valid, warnings=%d, toCancel=%d, emergencyConflicts=%d}",
                warnings.size(), assignmentsToCancelForEmergency.size(), emergencyConflicts.size());
    }

    /**
     * Accumulates warnings and conflict lists while a check runs.
     */
    public static final class Builder {
        private String errorMessage;
        private ConflictType conflictType = ConflictType.NONE;
        private final List<String> warnings = new ArrayList<>();
        private final List<ExistingBookingSnapshot> conflictingBookings = new ArrayList<>();
        private final List<ExistingBookingSnapshot> assignmentsToCancelForEmergency = new ArrayList<>();
        private final List<ExistingBookingSnapshot> emergencyConflicts = new ArrayList<>();

        private Builder() {
        }

        public Builder fail(String errorMessage, ConflictType conflictType) {
            this.errorMessage = Objects.requireNonNull(errorMessage, "errorMessage must not be null");
            this.conflictType = Objects.requireNonNull(conflictType, "conflictType must not be null");
            return this;
        }

        public Builder warning(String warning) {
            warnings.add(Objects.requireNonNull(warning, "warning must not be null"));
            return this;
        }

        public Builder conflictingBooking(ExistingBookingSnapshot snapshot) {
            conflictingBookings.add(Objects.requireNonNull(snapshot, "snapshot must not be null"));
            return this;
        }

        public Builder cancelForEmergency(ExistingBookingSnapshot snapshot) {
            assignmentsToCancelForEmergency.add(Objects.requireNonNull(snapshot, "snapshot must not be null"));
            return this;
        }

        public Builder emergencyConflict(ExistingBookingSnapshot snapshot) {
            emergencyConflicts.add(Objects.requireNonNull(snapshot, "snapshot must not be null"));
            return this;
        }

        public ValidationOutcome build() {
            return new ValidationOutcome(this);
        }
    }
}
