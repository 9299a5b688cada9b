package org.rentalrepairs.engine.domain.service;

import org.rentalrepairs.engine.api.dto.ExistingBookingSnapshot;
import org.rentalrepairs.engine.domain.model.AssignmentProposal;
import org.rentalrepairs.engine.domain.model.ConflictType;
import org.rentalrepairs.engine.domain.model.EmergencyOverride;
import org.rentalrepairs.engine.domain.model.ValidationOutcome;
import org.rentalrepairs.engine.index.BookingSnapshotIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Implementation of AssignmentValidator.
 *
 * A conflict is an active booking of a different request on the same property, unit and date.
 * Normal proposals fail on any conflict. Emergency proposals displace normal bookings and only
 * warn about other emergencies: two emergencies on one unit and date never cancel each other.
 */
public final class AssignmentValidatorImpl implements AssignmentValidator {

    private static final Logger LOG = Logger.getLogger(AssignmentValidatorImpl.class.getName());

    @Override
    public ValidationOutcome validate(AssignmentProposal proposal, List<ExistingBookingSnapshot> existingBookings) {
        Objects.requireNonNull(existingBookings, "existingBookings must not be null");
        return validate(proposal, BookingSnapshotIndex.of(existingBookings));
    }

    @Override
    public ValidationOutcome validate(AssignmentProposal proposal, BookingSnapshotIndex existingBookings) {
        Objects.requireNonNull(proposal, "proposal must not be null");
        Objects.requireNonNull(existingBookings, "existingBookings must not be null");

        if (!proposal.getWorkerSpecialization().canHandle(proposal.getRequiredSpecialization())) {
            String message = String.format("Worker specialized in %s cannot handle %s work",
                    proposal.getWorkerSpecialization().getDisplayName(),
                    proposal.getRequiredSpecialization().getDisplayName());
            LOG.warning(() -> "Rejected " + proposal + ": " + message);
            return ValidationOutcome.failure(message, ConflictType.SPECIALIZATION_MISMATCH);
        }

        List<ExistingBookingSnapshot> conflicts = existingBookings.conflictsFor(proposal.getRequestId(),
                proposal.getPropertyCode(), proposal.getUnitNumber(), proposal.getScheduledDate());
        LOG.fine(() -> String.format("Conflict scan for %s: %d of %d snapshot entries conflict",
                proposal, conflicts.size(), existingBookings.size()));

        if (conflicts.isEmpty()) {
            return ValidationOutcome.success();
        }
        if (!proposal.isEmergency()) {
            return rejectConflict(proposal, conflicts);
        }
        return resolveEmergency(proposal, conflicts);
    }

    @Override
    public EmergencyOverride processEmergencyOverride(List<ExistingBookingSnapshot> assignmentsToCancel) {
        Objects.requireNonNull(assignmentsToCancel, "assignmentsToCancel must not be null");
        if (assignmentsToCancel.isEmpty()) {
            return EmergencyOverride.none();
        }

        List<EmergencyOverride.CancelledBooking> cancelled = new ArrayList<>();
        for (ExistingBookingSnapshot snapshot : assignmentsToCancel) {
            cancelled.add(new EmergencyOverride.CancelledBooking(
                    snapshot.getRequestId(),
                    snapshot.getWorkerEmail(),
                    snapshot.getWorkOrderNumber(),
                    snapshot.getScheduledDate(),
                    EmergencyOverride.CANCELLATION_REASON));
        }
        EmergencyOverride override = new EmergencyOverride(cancelled);
        LOG.info(() -> "Emergency override cancels requests " + override.getCancelledRequestIds());
        return override;
    }

    private ValidationOutcome rejectConflict(AssignmentProposal proposal, List<ExistingBookingSnapshot> conflicts) {
        ExistingBookingSnapshot first = conflicts.get(0);
        String message = String.format("Unit %s/%s already has a booking on %s (work order %s)",
                proposal.getPropertyCode(), proposal.getUnitNumber(), proposal.getScheduledDate(),
                first.getWorkOrderNumber());
        LOG.warning(() -> "Rejected " + proposal + ": " + message);

        ValidationOutcome.Builder outcome = ValidationOutcome.builder().fail(message, ConflictType.UNIT_CONFLICT);
        conflicts.forEach(outcome::conflictingBooking);
        return outcome.build();
    }

    private ValidationOutcome resolveEmergency(AssignmentProposal proposal, List<ExistingBookingSnapshot> conflicts) {
        ValidationOutcome.Builder outcome = ValidationOutcome.builder();
        int displaced = 0;
        for (ExistingBookingSnapshot conflict : conflicts) {
            outcome.conflictingBooking(conflict);
            if (conflict.isEmergency()) {
                outcome.emergencyConflict(conflict);
            } else {
                outcome.cancelForEmergency(conflict);
                displaced++;
            }
        }

        if (displaced > 0) {
            outcome.warning(String.format("Emergency assignment will cancel %d existing booking%s on unit %s/%s",
                    displaced, displaced == 1 ? "" : "s", proposal.getPropertyCode(), proposal.getUnitNumber()));
        }
        int emergencies = conflicts.size() - displaced;
        if (emergencies > 0) {
            outcome.warning(String.format("%d other emergency booking%s already scheduled on unit %s/%s for %s",
                    emergencies, emergencies == 1 ? " is" : "s are", proposal.getPropertyCode(),
                    proposal.getUnitNumber(), proposal.getScheduledDate()));
        }

        ValidationOutcome result = outcome.build();
        LOG.info(() -> String.format("Emergency %s: %d to cancel, %d emergency conflicts",
                proposal.getRequestId(), result.getAssignmentsToCancelForEmergency().size(),
                result.getEmergencyConflicts().size()));
        return result;
    }
}
