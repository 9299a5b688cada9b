package org.rentalrepairs.engine.domain.service;

import org.rentalrepairs.engine.domain.model.AvailabilitySummary;
import org.rentalrepairs.engine.domain.model.Recommendation;
import org.rentalrepairs.engine.domain.model.RepairRequest;
import org.rentalrepairs.engine.domain.model.Specialization;
import org.rentalrepairs.engine.domain.model.Worker;
import org.rentalrepairs.engine.domain.model.WorkloadDistribution;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Queries and rankings over a collection of workers. Inactive workers never appear in a result.
 */
public interface RosterService {

    List<Worker> availableForEmergency(Collection<Worker> workers);

    /**
     * Highest-scoring eligible worker, if any.
     */
    Optional<Worker> bestMatch(Collection<Worker> workers, RepairRequest request);

    /**
     * Eligible workers, best score first.
     */
    List<Worker> eligibleWorkers(Collection<Worker> workers, RepairRequest request);

    /**
     * Active workers able to handle {@code specialization}, general maintenance included.
     */
    List<Worker> withSpecialization(Collection<Worker> workers, Specialization specialization);

    /**
     * Active workers with at least one free slot on {@code date}.
     */
    List<Worker> availableOnDate(Collection<Worker> workers, LocalDate date);

    List<Worker> withLightWorkload(Collection<Worker> workers, int maxCount);

    List<Worker> withLightWorkload(Collection<Worker> workers);

    /**
     * One recommendation per eligible worker, best score first, at most {@code topN}.
     */
    List<Recommendation> recommendations(Collection<Worker> workers, RepairRequest request, int topN);

    List<Recommendation> recommendations(Collection<Worker> workers, RepairRequest request);

    Map<Specialization, List<Worker>> groupBySpecialization(Collection<Worker> workers);

    WorkloadDistribution workloadDistribution(Collection<Worker> workers);

    /**
     * Availability over [from, to], most available worker first.
     */
    List<AvailabilitySummary> availabilitySummaries(Collection<Worker> workers, LocalDate from, LocalDate to);

    /**
     * Availability from today over the configured booking range.
     */
    List<AvailabilitySummary> availabilitySummaries(Collection<Worker> workers);
}
