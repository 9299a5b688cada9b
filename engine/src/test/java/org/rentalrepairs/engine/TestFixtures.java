package org.rentalrepairs.engine;

import org.rentalrepairs.engine.api.dto.BookingStatus;
import org.rentalrepairs.engine.api.dto.ExistingBookingSnapshot;
import org.rentalrepairs.engine.domain.model.RepairRequest;
import org.rentalrepairs.engine.domain.model.RequestStatus;
import org.rentalrepairs.engine.domain.model.Specialization;
import org.rentalrepairs.engine.domain.model.Urgency;
import org.rentalrepairs.engine.domain.model.Worker;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Shared builders for tests. Every test runs at 2030-03-04 09:00 UTC.
 */
public final class TestFixtures {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2030-03-04T09:00:00Z"), ZoneOffset.UTC);
    public static final LocalDate TODAY = LocalDate.of(2030, 3, 4);

    public static final String PROPERTY = "SUNSET";
    public static final String UNIT = "101";

    private TestFixtures() {
    }

    public static Worker worker(String email, Specialization specialization) {
        return new Worker.Builder()
                .email(email)
                .fullName(email.substring(0, email.indexOf('@')))
                .specialization(specialization)
                .build();
    }

    public static Worker inactiveWorker(String email, Specialization specialization) {
        return new Worker.Builder()
                .email(email)
                .specialization(specialization)
                .active(false)
                .build();
    }

    public static RepairRequest plumbingRequest(Urgency urgency) {
        return new RepairRequest.Builder()
                .propertyCode(PROPERTY)
                .unitNumber(UNIT)
                .title("Leaking faucet")
                .description("Water dripping under sink")
                .urgency(urgency)
                .status(RequestStatus.SUBMITTED)
                .build();
    }

    public static ExistingBookingSnapshot snapshot(UUID requestId, LocalDate date, boolean emergency) {
        return new ExistingBookingSnapshot(requestId, PROPERTY, UNIT, "pat@repairs.test",
                Specialization.PLUMBING, "WO-" + requestId.toString().substring(0, 8).toUpperCase(),
                date, BookingStatus.SCHEDULED, emergency);
    }
}
