package org.rentalrepairs.engine.domain.service;

import org.rentalrepairs.engine.config.EngineConfig;
import org.rentalrepairs.engine.domain.model.AvailabilitySummary;
import org.rentalrepairs.engine.domain.model.Recommendation;
import org.rentalrepairs.engine.domain.model.RepairRequest;
import org.rentalrepairs.engine.domain.model.Specialization;
import org.rentalrepairs.engine.domain.model.Worker;
import org.rentalrepairs.engine.domain.model.WorkloadDistribution;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.IntSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Implementation of RosterService on top of the per-worker fitness rules.
 */
public final class RosterServiceImpl implements RosterService {

    private static final Logger LOG = Logger.getLogger(RosterServiceImpl.class.getName());

    private final WorkerFitnessService fitnessService;
    private final EngineConfig config;
    private final Clock clock;

    public RosterServiceImpl(WorkerFitnessService fitnessService, EngineConfig config, Clock clock) {
        this.fitnessService = Objects.requireNonNull(fitnessService, "fitnessService must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<Worker> availableForEmergency(Collection<Worker> workers) {
        return active(workers).stream()
                .filter(Worker::isEmergencyResponseCapable)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Worker> bestMatch(Collection<Worker> workers, RepairRequest request) {
        List<Worker> ranked = eligibleWorkers(workers, request);
        if (ranked.isEmpty()) {
            LOG.fine(() -> "No eligible worker for request " + request.getId());
            return Optional.empty();
        }
        return Optional.of(ranked.get(0));
    }

    @Override
    public List<Worker> eligibleWorkers(Collection<Worker> workers, RepairRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Map<Worker, Integer> scores = new LinkedHashMap<>();
        for (Worker worker : active(workers)) {
            if (fitnessService.isEligible(worker, request)) {
                scores.put(worker, fitnessService.score(worker, request));
            }
        }
        // Stable sort keeps roster order among equal scores.
        List<Worker> ranked = new ArrayList<>(scores.keySet());
        ranked.sort(Comparator.comparing((Worker w) -> scores.get(w)).reversed());
        return ranked;
    }

    @Override
    public List<Worker> withSpecialization(Collection<Worker> workers, Specialization specialization) {
        Objects.requireNonNull(specialization, "specialization must not be null");
        return active(workers).stream()
                .filter(w -> w.getSpecialization().canHandle(specialization))
                .collect(Collectors.toList());
    }

    @Override
    public List<Worker> availableOnDate(Collection<Worker> workers, LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        return active(workers).stream()
                .filter(w -> w.isAvailableOn(date))
                .collect(Collectors.toList());
    }

    @Override
    public List<Worker> withLightWorkload(Collection<Worker> workers, int maxCount) {
        LocalDate today = LocalDate.now(clock);
        return active(workers).stream()
                .filter(w -> w.upcomingWorkloadCount(today, config.getWorkloadHorizonDays()) <= maxCount)
                .collect(Collectors.toList());
    }

    @Override
    public List<Worker> withLightWorkload(Collection<Worker> workers) {
        return withLightWorkload(workers, config.getLightWorkloadThreshold());
    }

    @Override
    public List<Recommendation> recommendations(Collection<Worker> workers, RepairRequest request, int topN) {
        Objects.requireNonNull(request, "request must not be null");
        if (topN < 0) {
            throw new IllegalArgumentException("topN must not be negative: " + topN);
        }

        List<Recommendation> recommendations = active(workers).stream()
                .filter(w -> fitnessService.isEligible(w, request))
                .map(w -> fitnessService.recommend(w, request))
                .sorted()
                .limit(topN)
                .collect(Collectors.toList());

        LOG.info(() -> String.format("Recommended %d worker(s) for request %s",
                recommendations.size(), request.getId()));
        return recommendations;
    }

    @Override
    public List<Recommendation> recommendations(Collection<Worker> workers, RepairRequest request) {
        return recommendations(workers, request, config.getMaxRecommendations());
    }

    @Override
    public Map<Specialization, List<Worker>> groupBySpecialization(Collection<Worker> workers) {
        Map<Specialization, List<Worker>> groups = new EnumMap<>(Specialization.class);
        for (Worker worker : active(workers)) {
            groups.computeIfAbsent(worker.getSpecialization(), s -> new ArrayList<>()).add(worker);
        }
        return groups;
    }

    @Override
    public WorkloadDistribution workloadDistribution(Collection<Worker> workers) {
        List<Worker> active = active(workers);
        if (active.isEmpty()) {
            return WorkloadDistribution.empty();
        }

        LocalDate today = LocalDate.now(clock);
        List<Integer> workloads = active.stream()
                .map(w -> w.upcomingWorkloadCount(today, config.getWorkloadHorizonDays()))
                .collect(Collectors.toList());
        IntSummaryStatistics stats = workloads.stream().mapToInt(Integer::intValue).summaryStatistics();
        int overloaded = (int) workloads.stream()
                .filter(count -> count > config.getOverloadedThreshold())
                .count();

        return new WorkloadDistribution(active.size(), stats.getAverage(), stats.getMin(), stats.getMax(), overloaded);
    }

    @Override
    public List<AvailabilitySummary> availabilitySummaries(Collection<Worker> workers, LocalDate from, LocalDate to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("to must not be before from: " + from + " > " + to);
        }

        LocalDate today = LocalDate.now(clock);
        return active(workers).stream()
                .map(w -> AvailabilitySummary.of(w, from, to, today,
                        config.getLookaheadDays(), config.getWorkloadHorizonDays(), clock))
                .sorted(Comparator.comparingInt(AvailabilitySummary::getAvailabilityScore))
                .collect(Collectors.toList());
    }

    @Override
    public List<AvailabilitySummary> availabilitySummaries(Collection<Worker> workers) {
        LocalDate today = LocalDate.now(clock);
        return availabilitySummaries(workers, today, today.plusDays(config.getBookingRangeDays()));
    }

    private static List<Worker> active(Collection<Worker> workers) {
        Objects.requireNonNull(workers, "workers must not be null");
        return workers.stream()
                .filter(Objects::nonNull)
                .filter(Worker::isActive)
                .collect(Collectors.toList());
    }
}
