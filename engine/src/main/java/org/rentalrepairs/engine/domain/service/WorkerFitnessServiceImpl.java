package org.rentalrepairs.engine.domain.service;

import org.rentalrepairs.engine.domain.model.ConflictType;
import org.rentalrepairs.engine.domain.model.DayAvailability;
import org.rentalrepairs.engine.domain.model.Recommendation;
import org.rentalrepairs.engine.domain.model.RepairRequest;
import org.rentalrepairs.engine.domain.model.ScoringConfig;
import org.rentalrepairs.engine.domain.model.Specialization;
import org.rentalrepairs.engine.domain.model.ValidationOutcome;
import org.rentalrepairs.engine.domain.model.Worker;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Implementation of WorkerFitnessService using additive weighted scoring.
 *
 * Score formula (higher = better):
 *   score = base_eligibility
 *         + exact_specialization | general_fallback
 *         + date_available            (not fully booked on the target date)
 *         + max(workload_floor, workload_cap - workload_per_booking * upcoming_workload)
 *         + emergency                 (emergency request, exact match or emergency-capable worker)
 *
 * The target date is the request's preferred date, or today when it has none.
 * Confidence for an exact match is fixed by the request alone; only fallback matches are
 * graded down by availability.
 */
public final class WorkerFitnessServiceImpl implements WorkerFitnessService {

    private static final Logger LOG = Logger.getLogger(WorkerFitnessServiceImpl.class.getName());

    static final String INACTIVE_REASONING = "Worker is inactive";

    private static final Duration EXACT_MATCH_ESTIMATE = Duration.ofHours(2);
    private static final Duration FALLBACK_ESTIMATE = Duration.ofHours(3);

    private final ScoringConfig config;
    private final SpecializationClassifier classifier;
    private final Clock clock;
    private final int workloadHorizonDays;

    public WorkerFitnessServiceImpl(ScoringConfig config, SpecializationClassifier classifier, Clock clock,
                                    int workloadHorizonDays) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (workloadHorizonDays <= 0) {
            throw new IllegalArgumentException("workloadHorizonDays must be positive: " + workloadHorizonDays);
        }
        this.workloadHorizonDays = workloadHorizonDays;
    }

    public WorkerFitnessServiceImpl(ScoringConfig config, SpecializationClassifier classifier, Clock clock) {
        this(config, classifier, clock, Worker.DEFAULT_WORKLOAD_HORIZON_DAYS);
    }

    @Override
    public int score(Worker worker, RepairRequest request) {
        requireArguments(worker, request);
        if (!worker.isActive()) {
            return 0;
        }

        Specialization required = requiredSpecialization(request);
        LocalDate targetDate = targetDate(request);

        int specializationScore = calculateSpecializationScore(worker, required);
        int availabilityScore = calculateDateAvailabilityScore(worker, targetDate);
        int workloadScore = calculateWorkloadScore(worker);
        int emergencyScore = calculateEmergencyScore(worker, request, required);
        int total = config.getBaseEligibilityWeight() + specializationScore + availabilityScore
                + workloadScore + emergencyScore;

        LOG.fine(() -> String.format(
                "Scored %s for %s: specialization=%d, available=%d, workload=%d, emergency=%d, total=%d",
                worker.getEmail(), request.getId(), specializationScore, availabilityScore,
                workloadScore, emergencyScore, total));
        return total;
    }

    @Override
    public boolean isEligible(Worker worker, RepairRequest request) {
        requireArguments(worker, request);
        return worker.isActive()
                && worker.getSpecialization().canHandle(requiredSpecialization(request))
                && request.getStatus().isAssignable();
    }

    @Override
    public double recommendationConfidence(Worker worker, RepairRequest request) {
        requireArguments(worker, request);
        if (!worker.isActive()) {
            return 0.0;
        }

        Specialization required = requiredSpecialization(request);
        Specialization actual = worker.getSpecialization();
        if (!actual.canHandle(required)) {
            return 0.0;
        }

        boolean exact = actual.isExactMatchFor(required);
        double confidence = exact ? config.getExactConfidence() : config.getGeneralFallbackConfidence();
        if (coversEmergency(worker, request, required)) {
            confidence += config.getEmergencyConfidenceBonus();
        }
        if (!exact && !worker.isAvailableOn(targetDate(request))) {
            confidence -= config.getUnavailableConfidencePenalty();
        }
        return clamp(confidence);
    }

    @Override
    public String recommendationReasoning(Worker worker, RepairRequest request) {
        requireArguments(worker, request);
        if (!worker.isActive()) {
            return INACTIVE_REASONING;
        }

        Specialization required = requiredSpecialization(request);
        Specialization actual = worker.getSpecialization();
        List<String> reasons = new ArrayList<>();

        if (actual.isExactMatchFor(required)) {
            reasons.add("Worker has exact " + required.getDisplayName() + " specialization");
        } else if (actual.canHandle(required)) {
            reasons.add("General Maintenance worker can handle " + required.getDisplayName() + " work");
        } else {
            reasons.add(actual.getDisplayName() + " specialization does not cover "
                    + required.getDisplayName() + " work");
        }

        LocalDate targetDate = targetDate(request);
        DayAvailability availability = worker.availabilityOn(targetDate);
        switch (availability) {
            case FULLY_AVAILABLE:
                reasons.add("Available for immediate assignment");
                break;
            case PARTIALLY_BOOKED:
                reasons.add("Limited availability on " + targetDate + " (1/" + Worker.SLOT_CAPACITY + " slots used)");
                break;
            default:
                reasons.add("Fully booked on " + targetDate);
                break;
        }

        int workload = worker.upcomingWorkloadCount(LocalDate.now(clock), workloadHorizonDays);
        reasons.add(workload == 0
                ? "No upcoming assignments"
                : "Current workload: " + workload + " upcoming assignment" + (workload == 1 ? "" : "s"));

        if (request.isEmergency()) {
            reasons.add(coversEmergency(worker, request, required)
                    ? "Qualified for emergency requests"
                    : "Not qualified for " + required.getDisplayName() + " emergency requests");
        }
        return String.join("; ", reasons);
    }

    @Override
    public Duration estimatedCompletionTime(Worker worker, RepairRequest request) {
        requireArguments(worker, request);
        if (!worker.isActive()) {
            return Duration.ZERO;
        }
        return worker.getSpecialization().isExactMatchFor(requiredSpecialization(request))
                ? EXACT_MATCH_ESTIMATE
                : FALLBACK_ESTIMATE;
    }

    @Override
    public ValidationOutcome validateAssignment(Worker worker, RepairRequest request, LocalDate scheduledDate) {
        requireArguments(worker, request);
        Objects.requireNonNull(scheduledDate, "scheduledDate must not be null");

        if (!worker.isActive()) {
            return reject(worker, request, "Worker " + worker.getEmail() + " is not active",
                    ConflictType.WORKER_INACTIVE);
        }
        if (scheduledDate.isBefore(LocalDate.now(clock))) {
            return reject(worker, request, "Scheduled date must be today or in the future",
                    ConflictType.PAST_DATE);
        }
        if (!request.getStatus().isAssignable()) {
            return reject(worker, request, "Request in status " + request.getStatus() + " cannot be assigned",
                    ConflictType.REQUEST_NOT_ASSIGNABLE);
        }

        Specialization required = requiredSpecialization(request);
        Specialization actual = worker.getSpecialization();
        if (!actual.canHandle(required)) {
            return reject(worker, request, String.format("Worker specialized in %s cannot handle %s work",
                    actual.getDisplayName(), required.getDisplayName()), ConflictType.SPECIALIZATION_MISMATCH);
        }

        DayAvailability availability = worker.availabilityOn(scheduledDate);
        if (availability == DayAvailability.FULLY_BOOKED) {
            return reject(worker, request, String.format("Worker is fully booked on %s (%d/%d slots)",
                    scheduledDate, Worker.SLOT_CAPACITY, Worker.SLOT_CAPACITY), ConflictType.WORKER_FULLY_BOOKED);
        }

        ValidationOutcome.Builder outcome = ValidationOutcome.builder();
        if (availability == DayAvailability.PARTIALLY_BOOKED) {
            outcome.warning(String.format("Worker already has 1 of %d slots booked on %s",
                    Worker.SLOT_CAPACITY, scheduledDate));
        }
        if (!actual.isExactMatchFor(required)) {
            outcome.warning("General Maintenance worker assigned to " + required.getDisplayName() + " work");
        }
        return outcome.build();
    }

    @Override
    public Specialization requiredSpecialization(RepairRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return classifier.classify(request.getTitle(), request.getDescription());
    }

    @Override
    public Recommendation recommend(Worker worker, RepairRequest request) {
        return new Recommendation.Builder()
                .worker(worker)
                .score(score(worker, request))
                .confidence(recommendationConfidence(worker, request))
                .reasoning(recommendationReasoning(worker, request))
                .estimatedCompletionTime(estimatedCompletionTime(worker, request))
                .build();
    }

    private int calculateSpecializationScore(Worker worker, Specialization required) {
        Specialization actual = worker.getSpecialization();
        if (actual.isExactMatchFor(required)) {
            return config.getExactSpecializationWeight();
        }
        if (actual.canHandle(required)) {
            return config.getGeneralFallbackWeight();
        }
        return 0;
    }

    private int calculateDateAvailabilityScore(Worker worker, LocalDate targetDate) {
        return worker.isAvailableOn(targetDate) ? config.getDateAvailableWeight() : 0;
    }

    /**
     * Fewer upcoming bookings earn more, down to the workload floor.
     */
    private int calculateWorkloadScore(Worker worker) {
        int workload = worker.upcomingWorkloadCount(LocalDate.now(clock), workloadHorizonDays);
        return Math.max(config.getWorkloadFloor(),
                config.getWorkloadCap() - config.getWorkloadPerBooking() * workload);
    }

    private int calculateEmergencyScore(Worker worker, RepairRequest request, Specialization required) {
        return coversEmergency(worker, request, required) ? config.getEmergencyWeight() : 0;
    }

    /**
     * An emergency is covered by an exact trade match, or by a compatible emergency-capable worker.
     */
    private static boolean coversEmergency(Worker worker, RepairRequest request, Specialization required) {
        if (!request.isEmergency()) {
            return false;
        }
        Specialization actual = worker.getSpecialization();
        return actual.isExactMatchFor(required)
                || (actual.canHandle(required) && worker.isEmergencyResponseCapable());
    }

    private LocalDate targetDate(RepairRequest request) {
        LocalDate preferred = request.getPreferredDate();
        return preferred != null ? preferred : LocalDate.now(clock);
    }

    private ValidationOutcome reject(Worker worker, RepairRequest request, String message, ConflictType type) {
        LOG.warning(() -> String.format("Assignment of %s to %s rejected: %s",
                worker.getEmail(), request.getId(), message));
        return ValidationOutcome.failure(message, type);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static void requireArguments(Worker worker, RepairRequest request) {
        Objects.requireNonNull(worker, "worker must not be null");
        Objects.requireNonNull(request, "request must not be null");
    }
}
