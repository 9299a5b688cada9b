package org.rentalrepairs.engine.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.rentalrepairs.engine.api.dto.ExistingBookingSnapshot;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON codec for the booking snapshot handed over by the persistence layer.
 * Dates are ISO-8601 strings ({@code "2030-03-05"}).
 */
public final class SnapshotCodec {

    private static final Logger LOG = Logger.getLogger(SnapshotCodec.class.getName());

    private static final TypeReference<List<ExistingBookingSnapshot>> SNAPSHOT_LIST =
            new TypeReference<List<ExistingBookingSnapshot>>() { };

    private final ObjectMapper mapper;

    public SnapshotCodec() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public SnapshotCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public List<ExistingBookingSnapshot> readList(String json) {
        Objects.requireNonNull(json, "json must not be null");
        if (json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            List<ExistingBookingSnapshot> decoded = mapper.readValue(json, SNAPSHOT_LIST);
            List<ExistingBookingSnapshot> snapshots = decoded != null ? decoded : Collections.emptyList();
            LOG.fine(() -> "Decoded " + snapshots.size() + " booking snapshots");
            return snapshots;
        } catch (JsonProcessingException e) {
            LOG.log(Level.WARNING, "Malformed booking snapshot JSON", e);
            throw new SnapshotFormatException("Malformed booking snapshot: " + e.getOriginalMessage(), e);
        }
    }

    public List<ExistingBookingSnapshot> readList(InputStream in) {
        Objects.requireNonNull(in, "in must not be null");
        try {
            List<ExistingBookingSnapshot> snapshots = mapper.readValue(in, SNAPSHOT_LIST);
            return snapshots != null ? snapshots : Collections.emptyList();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to read booking snapshot stream", e);
            throw new SnapshotFormatException("Failed to read booking snapshot: " + e.getMessage(), e);
        }
    }

    public String writeList(List<ExistingBookingSnapshot> snapshots) {
        Objects.requireNonNull(snapshots, "snapshots must not be null");
        try {
            return mapper.writeValueAsString(snapshots);
        } catch (JsonProcessingException e) {
            throw new SnapshotFormatException("Failed to write booking snapshot: " + e.getOriginalMessage(), e);
        }
    }
}
