package org.rentalrepairs.engine.domain.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.rentalrepairs.engine.TestFixtures.CLOCK;
import static org.rentalrepairs.engine.TestFixtures.TODAY;
import static org.rentalrepairs.engine.TestFixtures.plumbingRequest;

@Tag("unit")
public class RepairRequestTest {

    private static final LocalDateTime TOMORROW_10AM = TODAY.plusDays(1).atTime(10, 0);

    private RepairRequest draft() {
        return new RepairRequest.Builder()
                .propertyCode("SUNSET")
                .unitNumber("101")
                .title("Leaking faucet")
                .description("Water dripping under sink")
                .build();
    }

    @Test
    void test_full_lifecycle() {
        RepairRequest request = draft();
        assertEquals(RequestStatus.DRAFT, request.getStatus());

        request.submit();
        request.schedule(TOMORROW_10AM, "pat@repairs.test", "WO-1", CLOCK);
        assertEquals(RequestStatus.SCHEDULED, request.getStatus());
        assertEquals("pat@repairs.test", request.getAssignedWorkerEmail());

        request.reportWorkCompleted(true, "Replaced washer");
        request.close("Tenant confirmed");
        assertEquals(RequestStatus.CLOSED, request.getStatus());
        assertTrue(request.getStatus().isTerminal());
    }

    @Test
    void test_only_submitted_or_failed_requests_can_be_scheduled() {
        RepairRequest request = draft();

        RequestStateException e = assertThrows(RequestStateException.class,
                () -> request.schedule(TOMORROW_10AM, "pat@repairs.test", "WO-1", CLOCK));
        assertEquals(RequestStatus.DRAFT, e.getCurrentStatus());
    }

    @Test
    void test_schedule_in_past_rejected() {
        RepairRequest request = plumbingRequest(Urgency.NORMAL);

        assertThrows(IllegalArgumentException.class,
                () -> request.schedule(TODAY.minusDays(1).atTime(10, 0), "pat@repairs.test", "WO-1", CLOCK));
        assertEquals(RequestStatus.SUBMITTED, request.getStatus());
    }

    @Test
    void test_submit_requires_title_and_description() {
        RepairRequest request = new RepairRequest.Builder().propertyCode("SUNSET").unitNumber("101").build();

        assertThrows(RequestStateException.class, request::submit);
    }

    @Test
    void test_decline_only_from_submitted() {
        RepairRequest request = plumbingRequest(Urgency.NORMAL);
        request.decline("Tenant responsibility");

        assertEquals(RequestStatus.DECLINED, request.getStatus());
        assertFalse(request.getStatus().isAssignable());
        assertThrows(RequestStateException.class, () -> request.decline("again"));
    }

    @Test
    void test_emergency_override_failure_clears_assignment_and_allows_reschedule() {
        RepairRequest request = plumbingRequest(Urgency.NORMAL);
        request.schedule(TOMORROW_10AM, "pat@repairs.test", "WO-1", CLOCK);

        request.failDueToEmergencyOverride("Emergency on unit 101");

        assertEquals(RequestStatus.FAILED, request.getStatus());
        assertNull(request.getAssignedWorkerEmail());
        assertNull(request.getWorkOrderNumber());
        assertNull(request.getScheduledAt());
        assertTrue(request.getCompletionNotes().contains("Emergency on unit 101"));
        assertTrue(request.getClosureNotes().contains("WO-1"));

        request.schedule(TOMORROW_10AM.plusDays(1), "sam@repairs.test", "WO-2", CLOCK);
        assertEquals(RequestStatus.SCHEDULED, request.getStatus());
    }

    @Test
    void test_emergency_override_requires_scheduled_request() {
        RepairRequest request = plumbingRequest(Urgency.NORMAL);

        assertThrows(RequestStateException.class, () -> request.failDueToEmergencyOverride("x"));
    }

    @Test
    void test_urgency_drives_emergency_flag() {
        assertTrue(plumbingRequest(Urgency.EMERGENCY).isEmergency());
        assertTrue(plumbingRequest(Urgency.CRITICAL).isEmergency());
        assertFalse(plumbingRequest(Urgency.HIGH).isEmergency());
        assertEquals(Urgency.EMERGENCY, Urgency.fromString(" emergency "));
        assertThrows(IllegalArgumentException.class, () -> Urgency.fromString("urgent-ish"));
    }

    @Test
    void test_transition_table() {
        assertTrue(RequestStatus.SUBMITTED.canTransitionTo(RequestStatus.SCHEDULED));
        assertTrue(RequestStatus.SCHEDULED.canTransitionTo(RequestStatus.FAILED));
        assertTrue(RequestStatus.FAILED.canTransitionTo(RequestStatus.SCHEDULED));
        assertFalse(RequestStatus.DRAFT.canTransitionTo(RequestStatus.SCHEDULED));
        assertFalse(RequestStatus.CLOSED.canTransitionTo(RequestStatus.SUBMITTED));
        assertTrue(RequestStatus.CLOSED.allowedTransitions().isEmpty());
    }
}
