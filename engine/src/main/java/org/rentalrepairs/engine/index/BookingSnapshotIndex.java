package org.rentalrepairs.engine.index;

import org.rentalrepairs.engine.api.dto.ExistingBookingSnapshot;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Snapshot entries grouped by (property, unit, date). Entries keep their snapshot order within a key.
 */
public final class BookingSnapshotIndex {

    private final Map<Key, List<ExistingBookingSnapshot>> byUnitAndDate;
    private final int size;

    private BookingSnapshotIndex(Map<Key, List<ExistingBookingSnapshot>> byUnitAndDate, int size) {
        this.byUnitAndDate = byUnitAndDate;
        this.size = size;
    }

    public static BookingSnapshotIndex of(Collection<ExistingBookingSnapshot> snapshots) {
        Objects.requireNonNull(snapshots, "snapshots must not be null");
        Map<Key, List<ExistingBookingSnapshot>> map = new HashMap<>();
        for (ExistingBookingSnapshot snapshot : snapshots) {
            Key key = new Key(snapshot.getPropertyCode(), snapshot.getUnitNumber(), snapshot.getScheduledDate());
            map.computeIfAbsent(key, k -> new ArrayList<>()).add(snapshot);
        }
        return new BookingSnapshotIndex(map, snapshots.size());
    }

    public static BookingSnapshotIndex empty() {
        return new BookingSnapshotIndex(Collections.emptyMap(), 0);
    }

    /**
     * All entries for the unit on the date, active or not.
     */
    public List<ExistingBookingSnapshot> at(String propertyCode, String unitNumber, LocalDate date) {
        List<ExistingBookingSnapshot> found = byUnitAndDate.get(new Key(propertyCode, unitNumber, date));
        return found != null ? Collections.unmodifiableList(found) : Collections.emptyList();
    }

    /**
     * Active entries for the unit on the date that belong to a request other than {@code requestId}.
     */
    public List<ExistingBookingSnapshot> conflictsFor(UUID requestId, String propertyCode, String unitNumber,
                                                      LocalDate date) {
        List<ExistingBookingSnapshot> conflicts = new ArrayList<>();
        for (ExistingBookingSnapshot snapshot : at(propertyCode, unitNumber, date)) {
            if (!snapshot.getRequestId().equals(requestId) && snapshot.isActive()) {
                conflicts.add(snapshot);
            }
        }
        return conflicts;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    private static final class Key {
        private final String propertyCode;
        private final String unitNumber;
        private final LocalDate date;

        Key(String propertyCode, String unitNumber, LocalDate date) {
            this.propertyCode = propertyCode;
            this.unitNumber = unitNumber;
            this.date = date;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Key)) {
                return false;
            }
            Key key = (Key) o;
            return Objects.equals(propertyCode, key.propertyCode)
                    && Objects.equals(unitNumber, key.unitNumber)
                    && Objects.equals(date, key.date);
        }

        @Override
        public int hashCode() {
            return Objects.hash(propertyCode, unitNumber, date);
        }
    }
}
