package org.rentalrepairs.engine.domain.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * A proposed booking of one worker against one request on one date, as checked by the
 * assignment validator.
 */
public final class AssignmentProposal {

    private final UUID requestId;
    private final String propertyCode;
    private final String unitNumber;
    private final LocalDate scheduledDate;
    private final String workerEmail;
    private final Specialization workerSpecialization;
    private final Specialization requiredSpecialization;
    private final boolean emergency;

    private AssignmentProposal(Builder builder) {
        this.requestId = Objects.requireNonNull(builder.requestId, "requestId must not be null");
        this.propertyCode = Objects.requireNonNull(builder.propertyCode, "propertyCode must not be null");
        this.unitNumber = Objects.requireNonNull(builder.unitNumber, "unitNumber must not be null");
        this.scheduledDate = Objects.requireNonNull(builder.scheduledDate, "scheduledDate must not be null");
        this.workerEmail = Objects.requireNonNull(builder.workerEmail, "workerEmail must not be null");
        this.workerSpecialization = Objects.requireNonNull(builder.workerSpecialization,
                "workerSpecialization must not be null");
        this.requiredSpecialization = Objects.requireNonNull(builder.requiredSpecialization,
                "requiredSpecialization must not be null");
        this.emergency = builder.emergency;
    }

    /**
     * Builds a proposal for booking {@code worker} on {@code request}.
     */
    public static AssignmentProposal of(RepairRequest request, Worker worker, LocalDate scheduledDate,
                                        Specialization requiredSpecialization) {
        return new Builder()
                .requestId(request.getId())
                .propertyCode(request.getPropertyCode())
                .unitNumber(request.getUnitNumber())
                .scheduledDate(scheduledDate)
                .workerEmail(worker.getEmail())
                .workerSpecialization(worker.getSpecialization())
                .requiredSpecialization(requiredSpecialization)
                .emergency(request.isEmergency())
                .build();
    }

    public UUID getRequestId() {
        return requestId;
    }

    public String getPropertyCode() {
        return propertyCode;
    }

    public String getUnitNumber() {
        return unitNumber;
    }

    public LocalDate getScheduledDate() {
        return scheduledDate;
    }

    public String getWorkerEmail() {
        return workerEmail;
    }

    public Specialization getWorkerSpecialization() {
        return workerSpecialization;
    }

    public Specialization getRequiredSpecialization() {
        return requiredSpecialization;
    }

    public boolean isEmergency() {
        return emergency;
    }

    @Override
    public String toString() {
        return String.format("AssignmentProposal{request=%s, unit=%s/%s, date=%s, worker=%s, emergency=%s}",
                requestId, propertyCode, unitNumber, scheduledDate, workerEmail, emergency);
    }

    /**
     * Builder for AssignmentProposal.
     */
    public static final class Builder {
        private UUID requestId;
        private String propertyCode;
        private String unitNumber;
        private LocalDate scheduledDate;
        private String workerEmail;
        private Specialization workerSpecialization;
        private Specialization requiredSpecialization;
        private boolean emergency;

        public Builder requestId(UUID requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder propertyCode(String propertyCode) {
            this.propertyCode = propertyCode;
            return this;
        }

        public Builder unitNumber(String unitNumber) {
            this.unitNumber = unitNumber;
            return this;
        }

        public Builder scheduledDate(LocalDate scheduledDate) {
            this.scheduledDate = scheduledDate;
            return this;
        }

        public Builder workerEmail(String workerEmail) {
            this.workerEmail = workerEmail;
            return this;
        }

        public Builder workerSpecialization(Specialization workerSpecialization) {
            this.workerSpecialization = workerSpecialization;
            return this;
        }

        public Builder requiredSpecialization(Specialization requiredSpecialization) {
            this.requiredSpecialization = requiredSpecialization;
            return this;
        }

        public Builder emergency(boolean emergency) {
            this.emergency = emergency;
            return this;
        }

        public AssignmentProposal build() {
            return new AssignmentProposal(this);
        }
    }
}
