package org.rentalrepairs.engine.domain.model;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable date + time-of-day window used when booking maintenance work.
 *
 * Invariants: start before end, duration between 30 minutes and 8 hours,
 * date not in the past at construction time.
 */
public final class TimeSlot {

    public static final Duration MIN_DURATION = Duration.ofMinutes(30);
    public static final Duration MAX_DURATION = Duration.ofHours(8);

    private static final LocalTime BUSINESS_START = LocalTime.of(7, 0);
    private static final LocalTime BUSINESS_END = LocalTime.of(21, 0);

    private static final LocalTime MORNING_START = LocalTime.of(8, 0);
    private static final LocalTime NOON = LocalTime.of(12, 0);
    private static final LocalTime AFTERNOON_END = LocalTime.of(17, 0);
    private static final LocalTime EVENING_END = LocalTime.of(20, 0);

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("h:mm a", Locale.US);

    private final LocalDate date;
    private final LocalTime startTime;
    private final LocalTime endTime;
    private final SlotType type;

    private TimeSlot(LocalDate date, LocalTime startTime, LocalTime endTime, SlotType type) {
        this.date = date;
        this.startTime = startTime;
        this.endTime = endTime;
        this.type = type;
    }

    public static TimeSlot of(LocalDate date, LocalTime startTime, LocalTime endTime, SlotType type, Clock clock) {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(startTime, "startTime must not be null");
        Objects.requireNonNull(endTime, "endTime must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        if (date.isBefore(LocalDate.now(clock))) {
            throw new IllegalArgumentException("Cannot schedule slots in the past: " + date);
        }
        if (!startTime.isBefore(endTime)) {
            throw new IllegalArgumentException("Start time must be before end time");
        }
        Duration duration = Duration.between(startTime, endTime);
        if (duration.compareTo(MIN_DURATION) < 0) {
            throw new IllegalArgumentException("Slot must be at least 30 minutes long");
        }
        if (duration.compareTo(MAX_DURATION) > 0) {
            throw new IllegalArgumentException("Slot cannot be longer than 8 hours");
        }
        return new TimeSlot(date, startTime, endTime, type);
    }

    public static TimeSlot of(LocalDate date, LocalTime startTime, LocalTime endTime, Clock clock) {
        return of(date, startTime, endTime, SlotType.STANDARD, clock);
    }

    /**
     * Maps a tenant's preferred contact time ("Morning (8 AM - 12 PM)", "evening", "anytime", ...)
     * to a window. Unrecognised or blank text falls back to 08:00-17:00.
     */
    public static TimeSlot fromPreference(LocalDate date, String preference, Clock clock) {
        LocalTime start = MORNING_START;
        LocalTime end = AFTERNOON_END;

        if (preference != null && !preference.trim().isEmpty()) {
            String normalized = preference.trim().toLowerCase(Locale.ROOT);
            if (normalized.startsWith("morning")) {
                end = NOON;
            } else if (normalized.startsWith("afternoon")) {
                start = NOON;
            } else if (normalized.startsWith("evening")) {
                start = AFTERNOON_END;
                end = EVENING_END;
            }
        }
        return of(date, start, end, SlotType.TENANT_PREFERRED, clock);
    }

    /**
     * The three canonical windows: morning 08-12, afternoon 12-17, evening 17-20.
     */
    public static List<TimeSlot> standardSlotsFor(LocalDate date, Clock clock) {
        return Collections.unmodifiableList(Arrays.asList(
                of(date, MORNING_START, NOON, SlotType.MORNING, clock),
                of(date, NOON, AFTERNOON_END, SlotType.AFTERNOON, clock),
                of(date, AFTERNOON_END, EVENING_END, SlotType.EVENING, clock)));
    }

    public LocalDate getDate() {
        return date;
    }

    public LocalTime getStartTime() {
        return startTime;
    }

    public LocalTime getEndTime() {
        return endTime;
    }

    public SlotType getType() {
        return type;
    }

    public Duration duration() {
        return Duration.between(startTime, endTime);
    }

    /**
     * True only when both slots share a date and their [start, end) windows intersect.
     */
    public boolean overlapsWith(TimeSlot other) {
        if (other == null || !date.equals(other.date)) {
            return false;
        }
        return startTime.isBefore(other.endTime) && endTime.isAfter(other.startTime);
    }

    public boolean isWithinBusinessHours() {
        return !startTime.isBefore(BUSINESS_START) && !endTime.isAfter(BUSINESS_END);
    }

    public boolean isSuitableForEmergency() {
        return type == SlotType.EMERGENCY || isWithinBusinessHours();
    }

    /**
     * Canonical timestamp for a booking made against this slot: the middle of the window.
     */
    public LocalDateTime midpointTimestamp() {
        return date.atTime(startTime).plus(duration().dividedBy(2));
    }

    public String displayName() {
        String window = TIME_FORMAT.format(startTime) + " - " + TIME_FORMAT.format(endTime);
        switch (type) {
            case MORNING:
                return "Morning (" + window + ")";
            case AFTERNOON:
                return "Afternoon (" + window + ")";
            case EVENING:
                return "Evening (" + window + ")";
            case TENANT_PREFERRED:
                return "Tenant Preferred (" + window + ")";
            case EMERGENCY:
                return "Emergency Slot (" + window + ")";
            default:
                return window;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeSlot)) {
            return false;
        }
        TimeSlot other = (TimeSlot) o;
        return date.equals(other.date)
                && startTime.equals(other.startTime)
                && endTime.equals(other.endTime)
                && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, startTime, endTime, type);
    }

    @Override
    public String toString() {
        return date + " " + displayName() + " (" + type + ")";
    }
}
