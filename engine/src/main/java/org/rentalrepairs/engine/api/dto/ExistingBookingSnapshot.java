package org.rentalrepairs.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.rentalrepairs.engine.domain.model.Specialization;

import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * DTO for one other request's current booking, supplied by the persistence layer for conflict checks.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ExistingBookingSnapshot {

    @JsonProperty("request_id")
    private final UUID requestId;

    @JsonProperty("property_code")
    private final String propertyCode;

    @JsonProperty("unit_number")
    private final String unitNumber;

    @JsonProperty("worker_email")
    private final String workerEmail;

    @JsonProperty("worker_specialization")
    private final Specialization workerSpecialization;

    @JsonProperty("work_order_number")
    private final String workOrderNumber;

    @JsonProperty("scheduled_date")
    private final LocalDate scheduledDate;

    @JsonProperty("status")
    private final BookingStatus status;

    @JsonProperty("is_emergency")
    private final boolean emergency;

    @JsonCreator
    public ExistingBookingSnapshot(@JsonProperty("request_id") UUID requestId,
                                   @JsonProperty("property_code") String propertyCode,
                                   @JsonProperty("unit_number") String unitNumber,
                                   @JsonProperty("worker_email") String workerEmail,
                                   @JsonProperty("worker_specialization") Specialization workerSpecialization,
                                   @JsonProperty("work_order_number") String workOrderNumber,
                                   @JsonProperty("scheduled_date") LocalDate scheduledDate,
                                   @JsonProperty("status") BookingStatus status,
                                   @JsonProperty("is_emergency") boolean emergency) {
        this.requestId = Objects.requireNonNull(requestId, "requestId must not be null");
        this.propertyCode = Objects.requireNonNull(propertyCode, "propertyCode must not be null");
        this.unitNumber = Objects.requireNonNull(unitNumber, "unitNumber must not be null");
        this.workerEmail = workerEmail;
        this.workerSpecialization = workerSpecialization != null
                ? workerSpecialization
                : Specialization.GENERAL_MAINTENANCE;
        this.workOrderNumber = workOrderNumber;
        this.scheduledDate = Objects.requireNonNull(scheduledDate, "scheduledDate must not be null");
        this.status = status != null ? status : BookingStatus.SCHEDULED;
        this.emergency = emergency;
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

    public String getWorkerEmail() {
        return workerEmail;
    }

    public Specialization getWorkerSpecialization() {
        return workerSpecialization;
    }

    public String getWorkOrderNumber() {
        return workOrderNumber;
    }

    public LocalDate getScheduledDate() {
        return scheduledDate;
    }

    public BookingStatus getStatus() {
        return status;
    }

    @JsonProperty("is_emergency")
    public boolean isEmergency() {
        return emergency;
    }

    @JsonIgnore
    public boolean isActive() {
        return status.occupiesUnit();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExistingBookingSnapshot)) {
            return false;
        }
        ExistingBookingSnapshot that = (ExistingBookingSnapshot) o;
        return emergency == that.emergency
                && requestId.equals(that.requestId)
                && propertyCode.equals(that.propertyCode)
                && unitNumber.equals(that.unitNumber)
                && Objects.equals(workerEmail, that.workerEmail)
                && workerSpecialization == that.workerSpecialization
                && Objects.equals(workOrderNumber, that.workOrderNumber)
                && scheduledDate.equals(that.scheduledDate)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestId, propertyCode, unitNumber, scheduledDate, workOrderNumber);
    }

    @Override
    public String toString() {
        return String.format("ExistingBookingSnapshot{request=%s, unit=%s/%s, date=%s, worker=%s, status=%s, emergency=%s}",
                requestId, propertyCode, unitNumber, scheduledDate, workerEmail, status, emergency);
    }
}
