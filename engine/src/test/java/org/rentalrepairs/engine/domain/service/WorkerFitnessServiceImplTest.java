package org.rentalrepairs.engine.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.rentalrepairs.engine.domain.model.ConflictType;
import org.rentalrepairs.engine.domain.model.Recommendation;
import org.rentalrepairs.engine.domain.model.RepairRequest;
import org.rentalrepairs.engine.domain.model.RequestStatus;
import org.rentalrepairs.engine.domain.model.ScoringConfig;
import org.rentalrepairs.engine.domain.model.Specialization;
import org.rentalrepairs.engine.domain.model.Urgency;
import org.rentalrepairs.engine.domain.model.ValidationOutcome;
import org.rentalrepairs.engine.domain.model.Worker;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.rentalrepairs.engine.TestFixtures.CLOCK;
import static org.rentalrepairs.engine.TestFixtures.TODAY;
import static org.rentalrepairs.engine.TestFixtures.inactiveWorker;
import static org.rentalrepairs.engine.TestFixtures.plumbingRequest;
import static org.rentalrepairs.engine.TestFixtures.worker;

@Tag("unit")
public class WorkerFitnessServiceImplTest {

    private static final double EPSILON = 1e-9;

    private SpecializationClassifier classifier;
    private WorkerFitnessService service;

    private Worker plumber;
    private Worker generalist;
    private Worker electrician;
    private RepairRequest normal;
    private RepairRequest emergency;

    @BeforeEach
    void setUp() {
        classifier = mock(SpecializationClassifier.class);
        when(classifier.classify(anyString(), anyString())).thenReturn(Specialization.PLUMBING);
        service = new WorkerFitnessServiceImpl(ScoringConfig.defaults(), classifier, CLOCK);

        plumber = worker("pat@repairs.test", Specialization.PLUMBING);
        generalist = worker("gus@repairs.test", Specialization.GENERAL_MAINTENANCE);
        electrician = worker("eli@repairs.test", Specialization.ELECTRICAL);
        normal = plumbingRequest(Urgency.NORMAL);
        emergency = plumbingRequest(Urgency.EMERGENCY);
    }

    @Test
    void test_inactive_worker_gets_ineligible_values() {
        Worker inactive = inactiveWorker("ina@repairs.test", Specialization.PLUMBING);

        assertEquals(0, service.score(inactive, normal));
        assertFalse(service.isEligible(inactive, normal));
        assertEquals(0.0, service.recommendationConfidence(inactive, normal), EPSILON);
        assertEquals(Duration.ZERO, service.estimatedCompletionTime(inactive, normal));
        assertEquals("Worker is inactive", service.recommendationReasoning(inactive, emergency));
    }

    @Test
    void test_exact_match_scores_above_300() {
        assertEquals(400, service.score(plumber, normal));
        assertTrue(service.score(plumber, normal) > 300);
    }

    @Test
    void test_general_fallback_between_200_and_400_and_below_exact() {
        int fallback = service.score(generalist, normal);

        assertEquals(300, fallback);
        assertTrue(fallback > 200 && fallback < 400);
        assertTrue(fallback < service.score(plumber, normal));
        assertTrue(service.score(generalist, emergency) < service.score(plumber, emergency));
    }

    @Test
    void test_emergency_bonus() {
        assertEquals(450, service.score(plumber, emergency));
        assertTrue(service.score(plumber, emergency) > 330);
    }

    @Test
    void test_workload_and_full_booking_reduce_score() {
        plumber.assignToWork("WO-1", TODAY, CLOCK);
        plumber.assignToWork("WO-2", TODAY, CLOCK);

        // 100 base + 200 exact + 0 (fully booked today) + (50 - 2 * 10) workload
        assertEquals(330, service.score(plumber, normal));
    }

    @Test
    void test_heavy_load_keeps_score_bands() {
        for (int day = 0; day < 3; day++) {
            plumber.assignToWork("WO-P" + day + "A", TODAY.plusDays(day), CLOCK);
            plumber.assignToWork("WO-P" + day + "B", TODAY.plusDays(day), CLOCK);
            generalist.assignToWork("WO-G" + day + "A", TODAY.plusDays(day), CLOCK);
            generalist.assignToWork("WO-G" + day + "B", TODAY.plusDays(day), CLOCK);
        }

        int exact = service.score(plumber, normal);
        int fallback = service.score(generalist, normal);

        // workload bonus bottoms out at the floor of 10
        assertEquals(310, exact);
        assertEquals(210, fallback);
        assertTrue(exact > 300);
        assertTrue(fallback > 200 && fallback < 400);
        assertTrue(fallback < exact);
        assertTrue(service.score(plumber, emergency) > 330);
    }

    @Test
    void test_exact_match_confidence_ignores_booking_state() {
        plumber.assignToWork("WO-1", TODAY, CLOCK);
        plumber.assignToWork("WO-2", TODAY, CLOCK);
        generalist.assignToWork("WO-3", TODAY, CLOCK);
        generalist.assignToWork("WO-4", TODAY, CLOCK);

        assertEquals(0.90, service.recommendationConfidence(plumber, normal), EPSILON);
        assertEquals(0.95, service.recommendationConfidence(plumber, emergency), EPSILON);
        assertEquals(0.50, service.recommendationConfidence(generalist, normal), EPSILON);
    }

    @Test
    void test_exact_match_on_emergency_for_trade_outside_emergency_dispatch() {
        Worker painter = worker("pia@repairs.test", Specialization.PAINTING);
        RepairRequest paintEmergency = new RepairRequest.Builder()
                .propertyCode("SUNSET")
                .unitNumber("101")
                .title("Paint peeling")
                .description("Repaint bedroom wall")
                .urgency(Urgency.EMERGENCY)
                .status(RequestStatus.SUBMITTED)
                .build();
        when(classifier.classify("Paint peeling", "Repaint bedroom wall")).thenReturn(Specialization.PAINTING);

        assertFalse(painter.isEmergencyResponseCapable());
        assertEquals(0.95, service.recommendationConfidence(painter, paintEmergency), EPSILON);
        assertEquals(450, service.score(painter, paintEmergency));
        assertTrue(service.recommendationReasoning(painter, paintEmergency)
                .contains("Qualified for emergency requests"));
        assertTrue(service.validateAssignment(painter, paintEmergency, TODAY).getWarnings().isEmpty());
    }

    @Test
    void test_incompatible_trade_on_emergency() {
        assertEquals(0.0, service.recommendationConfidence(electrician, emergency), EPSILON);
        // base + free today + empty workload; no trade or emergency bonus
        assertEquals(200, service.score(electrician, emergency));
        assertTrue(service.recommendationReasoning(electrician, emergency)
                .contains("Not qualified for Plumbing emergency requests"));
    }

    @Test
    void test_preferred_date_is_the_target_date() {
        plumber.assignToWork("WO-1", TODAY, CLOCK);
        plumber.assignToWork("WO-2", TODAY, CLOCK);
        RepairRequest later = new RepairRequest.Builder()
                .propertyCode("SUNSET")
                .unitNumber("101")
                .title("Leaking faucet")
                .description("Water dripping under sink")
                .status(RequestStatus.SUBMITTED)
                .preferredDate(TODAY.plusDays(3))
                .build();

        assertEquals(380, service.score(plumber, later));
    }

    @Test
    void test_eligibility() {
        assertTrue(service.isEligible(plumber, normal));
        assertTrue(service.isEligible(generalist, normal));
        assertFalse(service.isEligible(electrician, normal));

        normal.decline("Not our problem");
        assertFalse(service.isEligible(plumber, normal));
    }

    @Test
    void test_confidence_anchors() {
        assertEquals(0.90, service.recommendationConfidence(plumber, normal), EPSILON);
        assertEquals(0.95, service.recommendationConfidence(plumber, emergency), EPSILON);
        assertEquals(0.70, service.recommendationConfidence(generalist, normal), EPSILON);
        assertEquals(0.0, service.recommendationConfidence(electrician, normal), EPSILON);
    }

    @Test
    void test_estimated_completion_time() {
        assertEquals(Duration.ofHours(2), service.estimatedCompletionTime(plumber, normal));
        assertEquals(Duration.ofHours(2), service.estimatedCompletionTime(plumber, emergency));
        assertEquals(Duration.ofHours(3), service.estimatedCompletionTime(electrician, normal));
        assertEquals(Duration.ofHours(3), service.estimatedCompletionTime(generalist, normal));
    }

    @Test
    void test_reasoning_mentions_match_availability_and_emergency() {
        String reasoning = service.recommendationReasoning(plumber, emergency);

        assertTrue(reasoning.contains("exact Plumbing specialization"), reasoning);
        assertTrue(reasoning.contains("Available for immediate assignment"), reasoning);
        assertTrue(reasoning.contains("emergency requests"), reasoning);
        assertFalse(service.recommendationReasoning(plumber, normal).contains("emergency"));
    }

    @Test
    void test_validate_assignment_rejects_past_date() {
        ValidationOutcome outcome = service.validateAssignment(plumber, normal, TODAY.minusDays(1));

        assertFalse(outcome.isValid());
        assertTrue(outcome.getErrorMessage().contains("future"));
        assertEquals(ConflictType.PAST_DATE, outcome.getConflictType());
    }

    @Test
    void test_validate_assignment_rejects_inactive_worker() {
        Worker inactive = inactiveWorker("ina@repairs.test", Specialization.PLUMBING);

        ValidationOutcome outcome = service.validateAssignment(inactive, normal, TODAY.plusDays(1));

        assertFalse(outcome.isValid());
        assertTrue(outcome.getErrorMessage().contains("not active"));
        assertEquals(ConflictType.WORKER_INACTIVE, outcome.getConflictType());
    }

    @Test
    void test_validate_assignment_other_failures() {
        assertEquals(ConflictType.SPECIALIZATION_MISMATCH,
                service.validateAssignment(electrician, normal, TODAY).getConflictType());

        plumber.assignToWork("WO-1", TODAY.plusDays(1), CLOCK);
        plumber.assignToWork("WO-2", TODAY.plusDays(1), CLOCK);
        assertEquals(ConflictType.WORKER_FULLY_BOOKED,
                service.validateAssignment(plumber, normal, TODAY.plusDays(1)).getConflictType());

        normal.decline("Duplicate");
        assertEquals(ConflictType.REQUEST_NOT_ASSIGNABLE,
                service.validateAssignment(plumber, normal, TODAY.plusDays(2)).getConflictType());
    }

    @Test
    void test_validate_assignment_success_with_warnings() {
        generalist.assignToWork("WO-1", TODAY.plusDays(1), CLOCK);

        ValidationOutcome outcome = service.validateAssignment(generalist, normal, TODAY.plusDays(1));

        assertTrue(outcome.isValid());
        assertNull(outcome.getErrorMessage());
        assertEquals(2, outcome.getWarnings().size());
        assertTrue(service.validateAssignment(plumber, normal, TODAY).getWarnings().isEmpty());
    }

    @Test
    void test_recommend_bundles_everything() {
        Recommendation recommendation = service.recommend(plumber, emergency);

        assertSame(plumber, recommendation.getWorker());
        assertEquals(450, recommendation.getScore());
        assertEquals(0.95, recommendation.getConfidence(), EPSILON);
        assertEquals(Duration.ofHours(2), recommendation.getEstimatedCompletionTime());
    }

    @Test
    void test_weights_are_configurable() {
        WorkerFitnessService boosted = new WorkerFitnessServiceImpl(
                ScoringConfig.defaults().with(ScoringConfig.WEIGHT_EMERGENCY, 100), classifier, CLOCK);

        assertEquals(500, boosted.score(plumber, emergency));
    }
}
