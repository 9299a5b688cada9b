package org.rentalrepairs.engine.domain.model;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable per-worker availability snapshot for dashboards and the assignment screen.
 */
public final class AvailabilitySummary {

    private final UUID workerId;
    private final String workerEmail;
    private final String workerName;
    private final Specialization specialization;
    private final LocalDate nextFullyAvailableDate;
    private final int currentWorkload;
    private final List<LocalDate> bookedDates;
    private final List<LocalDate> partiallyBookedDates;
    private final int availabilityScore;
    private final int activeAssignmentCount;
    private final boolean active;

    private AvailabilitySummary(Builder builder) {
        this.workerId = Objects.requireNonNull(builder.workerId, "workerId must not be null");
        this.workerEmail = Objects.requireNonNull(builder.workerEmail, "workerEmail must not be null");
        this.workerName = builder.workerName != null ? builder.workerName : "";
        this.specialization = Objects.requireNonNull(builder.specialization, "specialization must not be null");
        this.nextFullyAvailableDate = builder.nextFullyAvailableDate;
        this.currentWorkload = builder.currentWorkload;
        this.bookedDates = Collections.unmodifiableList(new ArrayList<>(builder.bookedDates));
        this.partiallyBookedDates = Collections.unmodifiableList(new ArrayList<>(builder.partiallyBookedDates));
        this.availabilityScore = builder.availabilityScore;
        this.activeAssignmentCount = builder.activeAssignmentCount;
        this.active = builder.active;
    }

    /**
     * Summarises {@code worker} over [from, to], scoring availability relative to {@code referenceDate}.
     */
    public static AvailabilitySummary of(Worker worker, LocalDate from, LocalDate to, LocalDate referenceDate,
                                         int lookaheadDays, int horizonDays, Clock clock) {
        Objects.requireNonNull(worker, "worker must not be null");
        return new Builder()
                .workerId(worker.getId())
                .workerEmail(worker.getEmail())
                .workerName(worker.getFullName())
                .specialization(worker.getSpecialization())
                .nextFullyAvailableDate(worker.nextFullyAvailableDate(referenceDate, lookaheadDays, clock).orElse(null))
                .currentWorkload(worker.upcomingWorkloadCount(referenceDate, horizonDays))
                .bookedDates(worker.bookedDates(from, to))
                .partiallyBookedDates(worker.partiallyBookedDates(from, to))
                .availabilityScore(worker.availabilityScore(referenceDate, lookaheadDays, horizonDays, clock))
                .activeAssignmentCount(worker.activeBookingCount())
                .active(worker.isActive())
                .build();
    }

    public UUID getWorkerId() {
        return workerId;
    }

    public String getWorkerEmail() {
        return workerEmail;
    }

    public String getWorkerName() {
        return workerName;
    }

    public Specialization getSpecialization() {
        return specialization;
    }

    public Optional<LocalDate> getNextFullyAvailableDate() {
        return Optional.ofNullable(nextFullyAvailableDate);
    }

    public int getCurrentWorkload() {
        return currentWorkload;
    }

    public List<LocalDate> getBookedDates() {
        return bookedDates;
    }

    public List<LocalDate> getPartiallyBookedDates() {
        return partiallyBookedDates;
    }

    public int getAvailabilityScore() {
        return availabilityScore;
    }

    public int getActiveAssignmentCount() {
        return activeAssignmentCount;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Fully booked dates are never available; partially booked ones only when {@code allowPartial}.
     */
    public boolean isAvailableOn(LocalDate date, boolean allowPartial) {
        if (bookedDates.contains(date)) {
            return false;
        }
        if (partiallyBookedDates.contains(date)) {
            return allowPartial;
        }
        return true;
    }

    public String statusFor(LocalDate date) {
        if (bookedDates.contains(date)) {
            return "Fully Booked (2/2 slots)";
        }
        if (partiallyBookedDates.contains(date)) {
            return "Limited Availability (1/2 slots)";
        }
        return "Fully Available (0/2 slots)";
    }

    @Override
    public String toString() {
        String availability = nextFullyAvailableDate != null
                ? "Next available: " + nextFullyAvailableDate
                : "No availability in look-ahead window";
        return String.format("%s (%s) - %s - Workload: %d",
                workerName.isEmpty() ? workerEmail : workerName,
                specialization.getDisplayName(), availability, currentWorkload);
    }

    /**
     * Builder for AvailabilitySummary.
     */
    public static final class Builder {
        private UUID workerId;
        private String workerEmail;
        private String workerName;
        private Specialization specialization;
        private LocalDate nextFullyAvailableDate;
        private int currentWorkload;
        private List<LocalDate> bookedDates = Collections.emptyList();
        private List<LocalDate> partiallyBookedDates = Collections.emptyList();
        private int availabilityScore;
        private int activeAssignmentCount;
        private boolean active;

        public Builder workerId(UUID workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder workerEmail(String workerEmail) {
            this.workerEmail = workerEmail;
            return this;
        }

        public Builder workerName(String workerName) {
            this.workerName = workerName;
            return this;
        }

        public Builder specialization(Specialization specialization) {
            this.specialization = specialization;
            return this;
        }

        public Builder nextFullyAvailableDate(LocalDate nextFullyAvailableDate) {
            this.nextFullyAvailableDate = nextFullyAvailableDate;
            return this;
        }

        public Builder currentWorkload(int currentWorkload) {
            this.currentWorkload = currentWorkload;
            return this;
        }

        public Builder bookedDates(List<LocalDate> bookedDates) {
            this.bookedDates = Objects.requireNonNull(bookedDates, "bookedDates must not be null");
            return this;
        }

        public Builder partiallyBookedDates(List<LocalDate> partiallyBookedDates) {
            this.partiallyBookedDates = Objects.requireNonNull(partiallyBookedDates,
                    "partiallyBookedDates must not be null");
            return this;
        }

        public Builder availabilityScore(int availabilityScore) {
            this.availabilityScore = availabilityScore;
            return this;
        }

        public Builder activeAssignmentCount(int activeAssignmentCount) {
            this.activeAssignmentCount = activeAssignmentCount;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public AvailabilitySummary build() {
            return new AvailabilitySummary(this);
        }
    }
}
