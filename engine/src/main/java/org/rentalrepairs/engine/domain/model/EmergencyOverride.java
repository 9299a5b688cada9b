package org.rentalrepairs.engine.domain.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * The requests a caller must fail, and the bookings it must release, before an emergency booking
 * can take the unit. Building one changes nothing.
 */
public final class EmergencyOverride {

    public static final String CANCELLATION_REASON = "Cancelled due to emergency request override";

    private final Set<UUID> cancelledRequestIds;
    private final List<CancelledBooking> cancelledBookings;

    public EmergencyOverride(List<CancelledBooking> cancelledBookings) {
        Objects.requireNonNull(cancelledBookings, "cancelledBookings must not be null");
        Set<UUID> ids = new LinkedHashSet<>();
        for (CancelledBooking booking : cancelledBookings) {
            ids.add(booking.getRequestId());
        }
        this.cancelledRequestIds = Collections.unmodifiableSet(ids);
        this.cancelledBookings = Collections.unmodifiableList(new ArrayList<>(cancelledBookings));
    }

    public static EmergencyOverride none() {
        return new EmergencyOverride(Collections.emptyList());
    }

    /**
     * @return request ids in first-seen order, without duplicates
     */
    public Set<UUID> getCancelledRequestIds() {
        return cancelledRequestIds;
    }

    public List<CancelledBooking> getCancelledBookings() {
        return cancelledBookings;
    }

    public boolean isEmpty() {
        return cancelledRequestIds.isEmpty();
    }

    @Override
    public String toString() {
        return "EmergencyOverride{cancelled=" + cancelledRequestIds + "}";
    }

    /**
     * One booking released by an emergency override.
     */
    public static final class CancelledBooking {
        private final UUID requestId;
        private final String workerEmail;
        private final String workOrderNumber;
        private final LocalDate originalDate;
        private final String reason;

        public CancelledBooking(UUID requestId, String workerEmail, String workOrderNumber,
                                LocalDate originalDate, String reason) {
            this.requestId = Objects.requireNonNull(requestId, "requestId must not be null");
            this.workerEmail = workerEmail;
            this.workOrderNumber = workOrderNumber;
            this.originalDate = Objects.requireNonNull(originalDate, "originalDate must not be null");
            this.reason = Objects.requireNonNull(reason, "reason must not be null");
        }

        public UUID getRequestId() {
            return requestId;
        }

        public String getWorkerEmail() {
            return workerEmail;
        }

        public String getWorkOrderNumber() {
            return workOrderNumber;
        }

        public LocalDate getOriginalDate() {
            return originalDate;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public String toString() {
            return String.format("CancelledBooking{request=%s, workOrder=%s, date=%s}",
                    requestId, workOrderNumber, originalDate);
        }
    }
}
