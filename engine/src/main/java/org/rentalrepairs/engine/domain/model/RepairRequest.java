package org.rentalrepairs.engine.domain.model;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Tenant repair request as consumed by the scheduling engine.
 * Owned and persisted by the caller; the engine only reads it, except for the
 * lifecycle transitions the caller applies after a successful decision.
 */
public final class RepairRequest {

    private final UUID id;
    private final String propertyCode;
    private final String unitNumber;
    private final String title;
    private final String description;
    private final Urgency urgency;
    private final LocalDate preferredDate;
    private final String preferredContactTime;

    private RequestStatus status;
    private LocalDateTime scheduledAt;
    private String assignedWorkerEmail;
    private String workOrderNumber;
    private String completionNotes;
    private String closureNotes;

    private RepairRequest(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID();
        this.propertyCode = Objects.requireNonNull(builder.propertyCode, "propertyCode must not be null");
        this.unitNumber = Objects.requireNonNull(builder.unitNumber, "unitNumber must not be null");
        this.title = builder.title != null ? builder.title : "";
        this.description = builder.description != null ? builder.description : "";
        this.urgency = Objects.requireNonNull(builder.urgency, "urgency must not be null");
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.preferredDate = builder.preferredDate;
        this.preferredContactTime = builder.preferredContactTime;
        this.scheduledAt = builder.scheduledAt;
        this.assignedWorkerEmail = builder.assignedWorkerEmail;
        this.workOrderNumber = builder.workOrderNumber;
    }

    public UUID getId() {
        return id;
    }

    public String getPropertyCode() {
        return propertyCode;
    }

    public String getUnitNumber() {
        return unitNumber;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public Urgency getUrgency() {
        return urgency;
    }

    public boolean isEmergency() {
        return urgency.isEmergency();
    }

    public RequestStatus getStatus() {
        return status;
    }

    /**
     * Date the tenant asked for; {@code null} means "as soon as possible".
     */
    public LocalDate getPreferredDate() {
        return preferredDate;
    }

    public String getPreferredContactTime() {
        return preferredContactTime;
    }

    public LocalDateTime getScheduledAt() {
        return scheduledAt;
    }

    public String getAssignedWorkerEmail() {
        return assignedWorkerEmail;
    }

    public String getWorkOrderNumber() {
        return workOrderNumber;
    }

    public String getCompletionNotes() {
        return completionNotes;
    }

    public String getClosureNotes() {
        return closureNotes;
    }

    public boolean isActive() {
        return status == RequestStatus.SUBMITTED || status == RequestStatus.SCHEDULED;
    }

    // ---- Lifecycle ----

    public void submit() {
        requireStatus(RequestStatus.SUBMITTED, "submitted");
        if (title.trim().isEmpty() || description.trim().isEmpty()) {
            throw new RequestStateException("Request title and description are required for submission", status);
        }
        status = RequestStatus.SUBMITTED;
    }

    /**
     * Schedules the work. Allowed from Submitted, or from Failed for rescheduling.
     */
    public void schedule(LocalDateTime when, String workerEmail, String workOrder, Clock clock) {
        requireStatus(RequestStatus.SCHEDULED, "scheduled");
        Objects.requireNonNull(when, "when must not be null");
        if (!when.isAfter(LocalDateTime.now(clock))) {
            throw new IllegalArgumentException("Scheduled date must be in the future");
        }
        if (workerEmail == null || workerEmail.trim().isEmpty()) {
            throw new IllegalArgumentException("Worker email is required for scheduling");
        }
        if (workOrder == null || workOrder.trim().isEmpty()) {
            throw new IllegalArgumentException("Work order number is required for scheduling");
        }
        scheduledAt = when;
        assignedWorkerEmail = workerEmail.trim();
        workOrderNumber = workOrder.trim();
        status = RequestStatus.SCHEDULED;
    }

    public void reportWorkCompleted(boolean successful, String notes) {
        RequestStatus target = successful ? RequestStatus.DONE : RequestStatus.FAILED;
        requireStatus(target, "completed");
        completionNotes = notes;
        status = target;
    }

    public void decline(String reason) {
        requireStatus(RequestStatus.DECLINED, "declined");
        closureNotes = reason;
        status = RequestStatus.DECLINED;
    }

    /**
     * Fails a scheduled request that was displaced by an emergency booking on the same unit and date.
     * The assignment is cleared so the request can be rescheduled.
     */
    public void failDueToEmergencyOverride(String reason) {
        requireStatus(RequestStatus.FAILED, "failed by emergency override");
        completionNotes = "Work cancelled due to emergency override: " + reason;
        closureNotes = String.format("Emergency override cancelled assignment: %s (%s) on %s",
                assignedWorkerEmail, workOrderNumber, scheduledAt == null ? "" : scheduledAt.toLocalDate());
        assignedWorkerEmail = null;
        workOrderNumber = null;
        scheduledAt = null;
        status = RequestStatus.FAILED;
    }

    public void close(String notes) {
        requireStatus(RequestStatus.CLOSED, "closed");
        closureNotes = notes;
        status = RequestStatus.CLOSED;
    }

    private void requireStatus(RequestStatus target, String verb) {
        if (!status.canTransitionTo(target)) {
            throw new RequestStateException(
                    String.format("Request %s cannot be %s from status %s", id, verb, status), status);
        }
    }

    @Override
    public String toString() {
        return String.format("RepairRequest{id=%s, unit=%s/%s, urgency=%s, status=%s}",
                id, propertyCode, unitNumber, urgency, status);
    }

    /**
     * Builder for RepairRequest.
     */
    public static final class Builder {
        private UUID id;
        private String propertyCode;
        private String unitNumber;
        private String title;
        private String description;
        private Urgency urgency = Urgency.NORMAL;
        private RequestStatus status = RequestStatus.DRAFT;
        private LocalDate preferredDate;
        private String preferredContactTime;
        private LocalDateTime scheduledAt;
        private String assignedWorkerEmail;
        private String workOrderNumber;

        public Builder id(UUID id) {
            this.id = id;
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

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder urgency(Urgency urgency) {
            this.urgency = urgency;
            return this;
        }

        public Builder status(RequestStatus status) {
            this.status = status;
            return this;
        }

        public Builder preferredDate(LocalDate preferredDate) {
            this.preferredDate = preferredDate;
            return this;
        }

        public Builder preferredContactTime(String preferredContactTime) {
            this.preferredContactTime = preferredContactTime;
            return this;
        }

        public Builder scheduledAt(LocalDateTime scheduledAt) {
            this.scheduledAt = scheduledAt;
            return this;
        }

        public Builder assignedWorkerEmail(String assignedWorkerEmail) {
            this.assignedWorkerEmail = assignedWorkerEmail;
            return this;
        }

        public Builder workOrderNumber(String workOrderNumber) {
            this.workOrderNumber = workOrderNumber;
            return this;
        }

        public RepairRequest build() {
            return new RepairRequest(this);
        }
    }
}
