package org.rentalrepairs.engine.domain.model;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable record of one worker / date / work-order commitment.
 * Completion is a one-shot transition that yields a new instance.
 */
public final class Booking {

    private static final Pattern WORK_ORDER_PATTERN = Pattern.compile("^[A-Z0-9\\-]{3,20}$");
    private static final int MAX_NOTES_LENGTH = 500;
    private static final int MAX_COMPLETION_NOTES_LENGTH = 1000;

    private final String workOrderNumber;
    private final LocalDateTime scheduledAt;
    private final LocalDateTime assignedAt;
    private final String notes;
    private final CompletionState completionState;
    private final LocalDateTime completedAt;
    private final String completionNotes;

    private Booking(Builder builder) {
        this.assignedAt = Objects.requireNonNull(builder.assignedAt, "assignedAt must not be null");
        this.workOrderNumber = normalizeWorkOrderNumber(builder.workOrderNumber);
        this.scheduledAt = validateScheduledAt(builder.scheduledAt, assignedAt);
        this.notes = normalizeText(builder.notes, MAX_NOTES_LENGTH, "Notes");
        this.completionState = Objects.requireNonNull(builder.completionState, "completionState must not be null");
        this.completionNotes = normalizeText(builder.completionNotes, MAX_COMPLETION_NOTES_LENGTH, "Completion notes");
        if (completionState.isCompleted() && builder.completedAt == null) {
            throw new IllegalArgumentException("Completed booking requires a completion timestamp");
        }
        this.completedAt = completionState.isCompleted() ? builder.completedAt : null;
    }

    /**
     * Creates a new, not-completed booking assigned now.
     */
    public static Booking create(String workOrderNumber, LocalDateTime scheduledAt, String notes, Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        return new Builder()
                .workOrderNumber(workOrderNumber)
                .scheduledAt(scheduledAt)
                .notes(notes)
                .assignedAt(LocalDateTime.now(clock))
                .build();
    }

    public String getWorkOrderNumber() {
        return workOrderNumber;
    }

    public LocalDateTime getScheduledAt() {
        return scheduledAt;
    }

    public LocalDate getScheduledDate() {
        return scheduledAt.toLocalDate();
    }

    public LocalDateTime getAssignedAt() {
        return assignedAt;
    }

    public String getNotes() {
        return notes;
    }

    public CompletionState getCompletionState() {
        return completionState;
    }

    public boolean isCompleted() {
        return completionState.isCompleted();
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public String getCompletionNotes() {
        return completionNotes;
    }

    /**
     * Returns the completed copy of this booking.
     *
     * @throws IllegalStateException if this booking is already completed
     */
    public Booking complete(boolean successful, String completionNotes, Clock clock) {
        if (isCompleted()) {
            throw new IllegalStateException("Booking " + workOrderNumber + " is already completed");
        }
        return toBuilder()
                .completionState(successful ? CompletionState.COMPLETED_SUCCESSFUL : CompletionState.COMPLETED_UNSUCCESSFUL)
                .completedAt(LocalDateTime.now(clock))
                .completionNotes(completionNotes)
                .build();
    }

    public Booking withScheduledAt(LocalDateTime newScheduledAt) {
        return toBuilder().scheduledAt(newScheduledAt).build();
    }

    public Booking withNotes(String newNotes) {
        return toBuilder().notes(newNotes).build();
    }

    /**
     * Day-granular overlap: the booking occupies its whole scheduled day.
     */
    public boolean overlapsWith(LocalDateTime start, Duration duration) {
        LocalDateTime bookingStart = getScheduledDate().atStartOfDay();
        LocalDateTime bookingEnd = bookingStart.plusDays(1);
        LocalDateTime requestEnd = start.plus(duration);
        return start.isBefore(bookingEnd) && requestEnd.isAfter(bookingStart);
    }

    public boolean isOn(LocalDate date) {
        return getScheduledDate().equals(date);
    }

    /**
     * Days until the scheduled date; negative once it has passed.
     */
    public long daysUntilScheduled(Clock clock) {
        return ChronoUnit.DAYS.between(LocalDate.now(clock), getScheduledDate());
    }

    public boolean isScheduledForToday(Clock clock) {
        return getScheduledDate().equals(LocalDate.now(clock));
    }

    public boolean isOverdue(Clock clock) {
        return !isCompleted() && scheduledAt.isBefore(LocalDateTime.now(clock));
    }

    /**
     * Time since assignment, or until completion once completed.
     */
    public Duration elapsed(Clock clock) {
        LocalDateTime end = completedAt != null ? completedAt : LocalDateTime.now(clock);
        return Duration.between(assignedAt, end);
    }

    public Builder toBuilder() {
        return new Builder()
                .workOrderNumber(workOrderNumber)
                .scheduledAt(scheduledAt)
                .assignedAt(assignedAt)
                .notes(notes)
                .completionState(completionState)
                .completedAt(completedAt)
                .completionNotes(completionNotes);
    }

    private static String normalizeWorkOrderNumber(String workOrderNumber) {
        if (workOrderNumber == null || workOrderNumber.trim().isEmpty()) {
            throw new IllegalArgumentException("Work order number cannot be empty");
        }
        String normalized = workOrderNumber.trim().toUpperCase(Locale.ROOT);
        if (normalized.length() < 3) {
            throw new IllegalArgumentException("Work order number must be at least 3 characters long");
        }
        if (normalized.length() > 20) {
            throw new IllegalArgumentException("Work order number cannot exceed 20 characters");
        }
        if (!WORK_ORDER_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Work order number format is invalid (alphanumeric with hyphens only)");
        }
        return normalized;
    }

    // No lower bound: historical bookings must be reconstructable.
    private static LocalDateTime validateScheduledAt(LocalDateTime scheduledAt, LocalDateTime assignedAt) {
        Objects.requireNonNull(scheduledAt, "scheduledAt must not be null");
        if (scheduledAt.isAfter(assignedAt.plusYears(1))) {
            throw new IllegalArgumentException("Scheduled date cannot be more than 1 year in the future");
        }
        return scheduledAt;
    }

    private static String normalizeText(String text, int maxLength, String label) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.length() > maxLength) {
            throw new IllegalArgumentException(label + " cannot exceed " + maxLength + " characters");
        }
        return trimmed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Booking)) {
            return false;
        }
        Booking other = (Booking) o;
        return workOrderNumber.equals(other.workOrderNumber)
                && scheduledAt.equals(other.scheduledAt)
                && assignedAt.equals(other.assignedAt)
                && completionState == other.completionState;
    }

    @Override
    public int hashCode() {
        return Objects.hash(workOrderNumber, scheduledAt, assignedAt, completionState);
    }

    @Override
    public String toString() {
        return String.format("Booking{workOrder='%s', scheduledAt=%s, state=%s}",
                workOrderNumber, scheduledAt, completionState);
    }

    /**
     * Builder for Booking. Used directly when reconstructing persisted bookings.
     */
    public static final class Builder {
        private String workOrderNumber;
        private LocalDateTime scheduledAt;
        private LocalDateTime assignedAt;
        private String notes;
        private CompletionState completionState = CompletionState.NOT_COMPLETED;
        private LocalDateTime completedAt;
        private String completionNotes;

        public Builder workOrderNumber(String workOrderNumber) {
            this.workOrderNumber = workOrderNumber;
            return this;
        }

        public Builder scheduledAt(LocalDateTime scheduledAt) {
            this.scheduledAt = scheduledAt;
            return this;
        }

        public Builder assignedAt(LocalDateTime assignedAt) {
            this.assignedAt = assignedAt;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder completionState(CompletionState completionState) {
            this.completionState = completionState;
            return this;
        }

        public Builder completedAt(LocalDateTime completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder completionNotes(String completionNotes) {
            this.completionNotes = completionNotes;
            return this;
        }

        public Booking build() {
            return new Booking(this);
        }
    }
}
