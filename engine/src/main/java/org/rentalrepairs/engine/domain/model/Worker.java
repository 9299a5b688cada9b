package org.rentalrepairs.engine.domain.model;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Maintenance worker aggregate: identity, trade, active flag and the bookings it owns.
 * Availability queries on an inactive worker return their empty value.
 *
 * Not thread-safe. Callers serialize fetch, validate, {@link #assignToWork} and persist
 * under their own transaction or lock.
 */
public final class Worker {

    private static final Logger LOG = Logger.getLogger(Worker.class.getName());

    /** Maximum concurrent bookings per calendar date. */
    public static final int SLOT_CAPACITY = 2;

    public static final int DEFAULT_WORKLOAD_HORIZON_DAYS = 30;
    public static final int DEFAULT_LOOKAHEAD_DAYS = 60;

    /** Days-until-available used when no free date exists in the look-ahead window. */
    static final int NO_AVAILABILITY_DAYS = 999;

    private final UUID id;
    private final String email;
    private final String fullName;
    private final List<Booking> bookings;
    private Specialization specialization;
    private boolean active;
    private String notes;

    private Worker(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID();
        this.email = requireText(builder.email, "email");
        this.fullName = builder.fullName != null ? builder.fullName.trim() : "";
        this.specialization = Objects.requireNonNull(builder.specialization, "specialization must not be null");
        this.active = builder.active;
        this.notes = builder.notes;
        this.bookings = new ArrayList<>(builder.bookings);
    }

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public String getFullName() {
        return fullName;
    }

    public Specialization getSpecialization() {
        return specialization;
    }

    public boolean isActive() {
        return active;
    }

    public String getNotes() {
        return notes;
    }

    public List<Booking> getBookings() {
        return Collections.unmodifiableList(bookings);
    }

    public void setSpecialization(Specialization specialization) {
        this.specialization = Objects.requireNonNull(specialization, "specialization must not be null");
    }

    public void deactivate(String reason, Clock clock) {
        active = false;
        addNotes("Worker deactivated. Reason: " + (reason == null ? "" : reason), clock);
    }

    public void activate(Clock clock) {
        active = true;
        addNotes("Worker reactivated", clock);
    }

    public void addNotes(String text, Clock clock) {
        if (text == null || text.trim().isEmpty()) {
            return;
        }
        notes = notes == null || notes.isEmpty()
                ? text
                : notes + "\n" + LocalDate.now(clock) + ": " + text;
    }

    /**
     * Whether the worker can serve emergencies at all; independent of current bookings.
     */
    public boolean isEmergencyResponseCapable() {
        return specialization.isEmergencyCapable();
    }

    // ---- Mutation ----

    /**
     * Appends a new booking. Call only after the assignment has been validated.
     *
     * @throws IllegalStateException if the worker is inactive or the date is fully booked
     * @throws IllegalArgumentException if the date is in the past or the work order is malformed
     */
    public Booking assignToWork(String workOrderNumber, LocalDateTime scheduledAt, String bookingNotes, Clock clock) {
        Objects.requireNonNull(scheduledAt, "scheduledAt must not be null");
        if (!active) {
            throw new IllegalStateException("Cannot assign work to inactive worker " + email);
        }
        if (scheduledAt.toLocalDate().isBefore(LocalDate.now(clock))) {
            throw new IllegalArgumentException("Scheduled date must be today or in the future");
        }
        int count = bookingCountOn(scheduledAt.toLocalDate());
        if (count >= SLOT_CAPACITY) {
            throw new IllegalStateException(String.format(
                    "Worker already has %d bookings on %s. Maximum is %d per day.",
                    count, scheduledAt.toLocalDate(), SLOT_CAPACITY));
        }

        Booking booking = Booking.create(workOrderNumber, scheduledAt, bookingNotes, clock);
        bookings.add(booking);
        LOG.fine(() -> String.format("Assigned %s to %s on %s", booking.getWorkOrderNumber(), email, scheduledAt));
        return booking;
    }

    public Booking assignToWork(String workOrderNumber, LocalDate scheduledDate, Clock clock) {
        return assignToWork(workOrderNumber, scheduledDate.atStartOfDay(), null, clock);
    }

    public Booking assignToWork(String workOrderNumber, TimeSlot slot, Clock clock) {
        return assignToWork(workOrderNumber, slot.midpointTimestamp(), null, clock);
    }

    /**
     * Replaces the booking for {@code workOrderNumber} with its completed copy.
     */
    public Booking completeWork(String workOrderNumber, boolean successful, String completionNotes, Clock clock) {
        String key = workOrderNumber == null ? "" : workOrderNumber.trim().toUpperCase(Locale.ROOT);
        for (int i = 0; i < bookings.size(); i++) {
            Booking booking = bookings.get(i);
            if (booking.getWorkOrderNumber().equals(key)) {
                Booking completed = booking.complete(successful, completionNotes, clock);
                bookings.set(i, completed);
                return completed;
            }
        }
        throw new IllegalStateException("Work order '" + workOrderNumber + "' not found for worker " + email);
    }

    // ---- Availability queries ----

    /**
     * Number of not-completed bookings on {@code date}.
     */
    public int bookingCountOn(LocalDate date) {
        int count = 0;
        for (Booking booking : bookings) {
            if (!booking.isCompleted() && booking.isOn(date)) {
                count++;
            }
        }
        return count;
    }

    public DayAvailability availabilityOn(LocalDate date) {
        int count = bookingCountOn(date);
        if (count >= SLOT_CAPACITY) {
            return DayAvailability.FULLY_BOOKED;
        }
        return count == 0 ? DayAvailability.FULLY_AVAILABLE : DayAvailability.PARTIALLY_BOOKED;
    }

    /**
     * Active and not fully booked on {@code date}.
     */
    public boolean isAvailableOn(LocalDate date) {
        return active && availabilityOn(date) != DayAvailability.FULLY_BOOKED;
    }

    /**
     * Not-completed bookings dated within [referenceDate, referenceDate + horizonDays].
     */
    public int upcomingWorkloadCount(LocalDate referenceDate, int horizonDays) {
        if (!active) {
            return 0;
        }
        LocalDate end = referenceDate.plusDays(horizonDays);
        int count = 0;
        for (Booking booking : bookings) {
            LocalDate date = booking.getScheduledDate();
            if (!booking.isCompleted() && !date.isBefore(referenceDate) && !date.isAfter(end)) {
                count++;
            }
        }
        return count;
    }

    public int upcomingWorkloadCount(LocalDate referenceDate) {
        return upcomingWorkloadCount(referenceDate, DEFAULT_WORKLOAD_HORIZON_DAYS);
    }

    public int activeBookingCount() {
        int count = 0;
        for (Booking booking : bookings) {
            if (!booking.isCompleted()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Dates in [from, to] holding two or more bookings.
     */
    public List<LocalDate> bookedDates(LocalDate from, LocalDate to) {
        return datesWith(from, to, DayAvailability.FULLY_BOOKED);
    }

    /**
     * Dates in [from, to] holding exactly one booking.
     */
    public List<LocalDate> partiallyBookedDates(LocalDate from, LocalDate to) {
        return datesWith(from, to, DayAvailability.PARTIALLY_BOOKED);
    }

    /**
     * Earliest date with no bookings, searching {@code lookaheadDays} past the later of
     * {@code referenceDate} and today.
     */
    public Optional<LocalDate> nextFullyAvailableDate(LocalDate referenceDate, int lookaheadDays, Clock clock) {
        if (!active) {
            return Optional.empty();
        }
        LocalDate start = searchStart(referenceDate, clock);
        LocalDate end = start.plusDays(lookaheadDays);
        for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
            if (bookingCountOn(date) == 0) {
                return Optional.of(date);
            }
        }
        return Optional.empty();
    }

    public Optional<LocalDate> nextFullyAvailableDate(LocalDate referenceDate, Clock clock) {
        return nextFullyAvailableDate(referenceDate, DEFAULT_LOOKAHEAD_DAYS, clock);
    }

    /**
     * {@code daysUntilNextAvailable * 100 + currentWorkload}; lower is better.
     * Inactive workers get {@link Integer#MAX_VALUE}.
     */
    public int availabilityScore(LocalDate referenceDate, int lookaheadDays, int horizonDays, Clock clock) {
        if (!active) {
            return Integer.MAX_VALUE;
        }
        LocalDate start = searchStart(referenceDate, clock);
        long daysUntilAvailable = nextFullyAvailableDate(referenceDate, lookaheadDays, clock)
                .map(date -> ChronoUnit.DAYS.between(start, date))
                .orElse((long) NO_AVAILABILITY_DAYS);
        return (int) daysUntilAvailable * 100 + upcomingWorkloadCount(start, horizonDays);
    }

    public int availabilityScore(LocalDate referenceDate, Clock clock) {
        return availabilityScore(referenceDate, DEFAULT_LOOKAHEAD_DAYS, DEFAULT_WORKLOAD_HORIZON_DAYS, clock);
    }

    private static LocalDate searchStart(LocalDate referenceDate, Clock clock) {
        Objects.requireNonNull(referenceDate, "referenceDate must not be null");
        LocalDate today = LocalDate.now(clock);
        return referenceDate.isBefore(today) ? today : referenceDate;
    }

    private List<LocalDate> datesWith(LocalDate from, LocalDate to, DayAvailability wanted) {
        List<LocalDate> dates = new ArrayList<>();
        if (!active) {
            return dates;
        }
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            if (availabilityOn(date) == wanted) {
                dates.add(date);
            }
        }
        return dates;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        return value.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Worker)) {
            return false;
        }
        return id.equals(((Worker) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Worker{email='%s', specialization=%s, active=%s, bookings=%d}",
                email, specialization, active, bookings.size());
    }

    /**
     * Builder for Worker.
     */
    public static final class Builder {
        private UUID id;
        private String email;
        private String fullName;
        private Specialization specialization = Specialization.GENERAL_MAINTENANCE;
        private boolean active = true;
        private String notes;
        private final List<Booking> bookings = new ArrayList<>();

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder fullName(String fullName) {
            this.fullName = fullName;
            return this;
        }

        public Builder specialization(Specialization specialization) {
            this.specialization = specialization;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder booking(Booking booking) {
            this.bookings.add(Objects.requireNonNull(booking, "booking must not be null"));
            return this;
        }

        public Builder bookings(List<Booking> bookings) {
            for (Booking booking : bookings) {
                booking(booking);
            }
            return this;
        }

        public Worker build() {
            return new Worker(this);
        }
    }
}
