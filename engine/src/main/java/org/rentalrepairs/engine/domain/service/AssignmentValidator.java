package org.rentalrepairs.engine.domain.service;

import org.rentalrepairs.engine.api.dto.ExistingBookingSnapshot;
import org.rentalrepairs.engine.domain.model.AssignmentProposal;
import org.rentalrepairs.engine.domain.model.EmergencyOverride;
import org.rentalrepairs.engine.domain.model.ValidationOutcome;
import org.rentalrepairs.engine.index.BookingSnapshotIndex;

import java.util.List;

/**
 * Checks a proposed booking against the bookings other requests already hold on the same unit.
 */
public interface AssignmentValidator {

    /**
     * Validate a proposal against a snapshot of existing bookings.
     *
     * @param proposal the booking to check
     * @param existingBookings other requests' bookings, as loaded by the caller
     * @return the outcome; emergency proposals may carry bookings to cancel
     */
    ValidationOutcome validate(AssignmentProposal proposal, List<ExistingBookingSnapshot> existingBookings);

    ValidationOutcome validate(AssignmentProposal proposal, BookingSnapshotIndex existingBookings);

    /**
     * Project the cancellation list of a valid emergency outcome into the requests the caller must fail.
     * Nothing is mutated.
     */
    EmergencyOverride processEmergencyOverride(List<ExistingBookingSnapshot> assignmentsToCancel);
}
