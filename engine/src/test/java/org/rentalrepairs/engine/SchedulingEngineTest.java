package org.rentalrepairs.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.rentalrepairs.engine.api.dto.BookingStatus;
import org.rentalrepairs.engine.api.dto.ExistingBookingSnapshot;
import org.rentalrepairs.engine.config.EngineConfig;
import org.rentalrepairs.engine.domain.model.ConflictType;
import org.rentalrepairs.engine.domain.model.EmergencyOverride;
import org.rentalrepairs.engine.domain.model.RepairRequest;
import org.rentalrepairs.engine.domain.model.RequestStatus;
import org.rentalrepairs.engine.domain.model.Specialization;
import org.rentalrepairs.engine.domain.model.Urgency;
import org.rentalrepairs.engine.domain.model.ValidationOutcome;
import org.rentalrepairs.engine.domain.model.Worker;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.rentalrepairs.engine.TestFixtures.CLOCK;
import static org.rentalrepairs.engine.TestFixtures.TODAY;
import static org.rentalrepairs.engine.TestFixtures.plumbingRequest;
import static org.rentalrepairs.engine.TestFixtures.worker;

@Tag("unit")
public class SchedulingEngineTest {

    private static final LocalDate DATE = TODAY.plusDays(2);

    private SchedulingEngine engine;
    private Worker plumber;
    private RepairRequest original;
    private List<ExistingBookingSnapshot> snapshot;

    @BeforeEach
    void setUp() {
        engine = new SchedulingEngine(EngineConfig.defaults(), CLOCK);
        plumber = worker("pat@repairs.test", Specialization.PLUMBING);

        // Normal booking already held by the plumber on unit 101.
        original = plumbingRequest(Urgency.NORMAL);
        plumber.assignToWork("WO-1001", DATE, CLOCK);
        original.schedule(DATE.atTime(10, 0), plumber.getEmail(), "WO-1001", CLOCK);
        snapshot = Collections.singletonList(new ExistingBookingSnapshot(original.getId(),
                original.getPropertyCode(), original.getUnitNumber(), plumber.getEmail(),
                plumber.getSpecialization(), original.getWorkOrderNumber(), DATE,
                BookingStatus.SCHEDULED, false));
    }

    @Test
    void test_emergency_override_end_to_end() {
        RepairRequest emergency = plumbingRequest(Urgency.EMERGENCY);

        ValidationOutcome outcome = engine.validateAssignment(plumber, emergency, DATE, snapshot);

        assertTrue(outcome.isValid());
        assertEquals(1, outcome.getAssignmentsToCancelForEmergency().size());
        // partial-booking warning from the fitness check plus the cancellation warning
        assertEquals(2, outcome.getWarnings().size());

        EmergencyOverride override = engine.getAssignmentValidator()
                .processEmergencyOverride(outcome.getAssignmentsToCancelForEmergency());
        assertEquals(Collections.singleton(original.getId()), override.getCancelledRequestIds());

        original.failDueToEmergencyOverride(override.getCancelledBookings().get(0).getReason());
        plumber.completeWork("WO-1001", false, "Cancelled for emergency", CLOCK);
        plumber.assignToWork("WO-2001", DATE, CLOCK);
        emergency.schedule(DATE.atTime(8, 0), plumber.getEmail(), "WO-2001", CLOCK);

        assertEquals(RequestStatus.FAILED, original.getStatus());
        assertEquals(RequestStatus.SCHEDULED, emergency.getStatus());
        assertEquals(1, plumber.bookingCountOn(DATE));
    }

    @Test
    void test_normal_request_conflict_rejected() {
        ValidationOutcome outcome = engine.validateAssignment(plumber, plumbingRequest(Urgency.NORMAL), DATE, snapshot);

        assertFalse(outcome.isValid());
        assertEquals(ConflictType.UNIT_CONFLICT, outcome.getConflictType());
    }

    @Test
    void test_fitness_failure_short_circuits_conflict_scan() {
        ValidationOutcome outcome = engine.validateAssignment(plumber, plumbingRequest(Urgency.EMERGENCY),
                TODAY.minusDays(1), snapshot);

        assertFalse(outcome.isValid());
        assertEquals(ConflictType.PAST_DATE, outcome.getConflictType());
    }

    @Test
    void test_validates_serialized_snapshot() {
        String json = engine.getSnapshotCodec().writeList(snapshot);

        ValidationOutcome outcome = engine.validateAssignment(plumber, plumbingRequest(Urgency.EMERGENCY), DATE, json);

        assertTrue(outcome.isValid());
        assertEquals(original.getId(), outcome.getAssignmentsToCancelForEmergency().get(0).getRequestId());
    }

    @Test
    void test_services_are_wired() {
        assertSame(CLOCK, engine.getClock());
        assertEquals(Specialization.PLUMBING,
                engine.getClassifier().classify("Pipe burst", "Water pipe broken in kitchen"));
        assertTrue(engine.getRosterService().bestMatch(Collections.singletonList(plumber),
                plumbingRequest(Urgency.NORMAL)).isPresent());
        // 100 base + 200 exact + 50 free today + (50 - 10) for the one upcoming booking
        assertEquals(390, engine.getFitnessService().score(plumber, plumbingRequest(Urgency.NORMAL)));
    }
}
