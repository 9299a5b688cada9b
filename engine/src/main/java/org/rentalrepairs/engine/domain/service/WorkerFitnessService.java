package org.rentalrepairs.engine.domain.service;

import org.rentalrepairs.engine.domain.model.Recommendation;
import org.rentalrepairs.engine.domain.model.RepairRequest;
import org.rentalrepairs.engine.domain.model.Specialization;
import org.rentalrepairs.engine.domain.model.ValidationOutcome;
import org.rentalrepairs.engine.domain.model.Worker;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Scores and checks a single worker against a single repair request.
 * Every operation returns its ineligible value for an inactive worker.
 */
public interface WorkerFitnessService {

    /**
     * Calculate the fitness score of a worker for a request.
     * Higher score = better candidate.
     *
     * @param worker the worker to score
     * @param request the request to be serviced
     * @return the score, 0 for an inactive worker
     */
    int score(Worker worker, RepairRequest request);

    /**
     * Active, able to handle the required trade, and the request can still be scheduled.
     */
    boolean isEligible(Worker worker, RepairRequest request);

    /**
     * Confidence in [0, 1] that the worker is the right choice.
     */
    double recommendationConfidence(Worker worker, RepairRequest request);

    /**
     * Human-readable explanation of the score.
     */
    String recommendationReasoning(Worker worker, RepairRequest request);

    Duration estimatedCompletionTime(Worker worker, RepairRequest request);

    /**
     * Check whether the worker may be booked for the request on {@code scheduledDate}.
     * Failures are returned, never thrown.
     */
    ValidationOutcome validateAssignment(Worker worker, RepairRequest request, LocalDate scheduledDate);

    /**
     * The trade the request needs, derived from its title and description.
     */
    Specialization requiredSpecialization(RepairRequest request);

    /**
     * Score, confidence, reasoning and estimate bundled together.
     */
    Recommendation recommend(Worker worker, RepairRequest request);
}
