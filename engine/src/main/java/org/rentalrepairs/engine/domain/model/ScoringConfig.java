package org.rentalrepairs.engine.domain.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable weights for worker fitness scoring and recommendation confidence.
 *
 * Score formula (higher = better):
 *   score = base_eligibility
 *         + exact_specialization | general_fallback
 *         + date_available (if not fully booked on the target date)
 *         + max(workload_floor, workload_cap - workload_per_booking * upcoming_bookings)
 *         + emergency (emergency request covered by the worker)
 *
 * With the defaults an exact match never drops to 300 and a fallback stays within (200, 400).
 */
public final class ScoringConfig {

    private final Map<String, Double> values;

    // Score weight keys
    public static final String WEIGHT_BASE_ELIGIBILITY = "weight_base_eligibility";
    public static final String WEIGHT_EXACT_SPECIALIZATION = "weight_exact_specialization";
    public static final String WEIGHT_GENERAL_FALLBACK = "weight_general_fallback";
    public static final String WEIGHT_DATE_AVAILABLE = "weight_date_available";
    public static final String WEIGHT_WORKLOAD_CAP = "weight_workload_cap";
    public static final String WEIGHT_WORKLOAD_PER_BOOKING = "weight_workload_per_booking";
    public static final String WEIGHT_WORKLOAD_FLOOR = "weight_workload_floor";
    public static final String WEIGHT_EMERGENCY = "weight_emergency";

    // Confidence keys
    public static final String CONFIDENCE_EXACT = "confidence_exact";
    public static final String CONFIDENCE_GENERAL_FALLBACK = "confidence_general_fallback";
    public static final String CONFIDENCE_EMERGENCY_BONUS = "confidence_emergency_bonus";
    public static final String CONFIDENCE_UNAVAILABLE_PENALTY = "confidence_unavailable_penalty";

    public static final List<String> KEYS = Collections.unmodifiableList(Arrays.asList(
            WEIGHT_BASE_ELIGIBILITY, WEIGHT_EXACT_SPECIALIZATION, WEIGHT_GENERAL_FALLBACK,
            WEIGHT_DATE_AVAILABLE, WEIGHT_WORKLOAD_CAP, WEIGHT_WORKLOAD_PER_BOOKING, WEIGHT_WORKLOAD_FLOOR,
            WEIGHT_EMERGENCY,
            CONFIDENCE_EXACT, CONFIDENCE_GENERAL_FALLBACK, CONFIDENCE_EMERGENCY_BONUS,
            CONFIDENCE_UNAVAILABLE_PENALTY));

    private static final Map<String, Double> DEFAULTS;

    static {
        Map<String, Double> defaults = new HashMap<>();
        defaults.put(WEIGHT_BASE_ELIGIBILITY, 100.0);
        defaults.put(WEIGHT_EXACT_SPECIALIZATION, 200.0);
        defaults.put(WEIGHT_GENERAL_FALLBACK, 100.0);
        defaults.put(WEIGHT_DATE_AVAILABLE, 50.0);
        defaults.put(WEIGHT_WORKLOAD_CAP, 50.0);
        defaults.put(WEIGHT_WORKLOAD_PER_BOOKING, 10.0);
        defaults.put(WEIGHT_WORKLOAD_FLOOR, 10.0);
        defaults.put(WEIGHT_EMERGENCY, 50.0);
        defaults.put(CONFIDENCE_EXACT, 0.90);
        defaults.put(CONFIDENCE_GENERAL_FALLBACK, 0.70);
        defaults.put(CONFIDENCE_EMERGENCY_BONUS, 0.05);
        defaults.put(CONFIDENCE_UNAVAILABLE_PENALTY, 0.20);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private ScoringConfig(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    /**
     * Creates a configuration from explicit values; missing keys fall back to defaults.
     */
    public static ScoringConfig fromMap(Map<String, Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        for (String key : values.keySet()) {
            if (!DEFAULTS.containsKey(key)) {
                throw new IllegalArgumentException("Unknown scoring key: " + key);
            }
        }
        return new ScoringConfig(values);
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig(DEFAULTS);
    }

    /**
     * Returns a copy with {@code key} overridden.
     */
    public ScoringConfig with(String key, double value) {
        Map<String, Double> copy = new HashMap<>(values);
        copy.put(key, value);
        return fromMap(copy);
    }

    public double get(String key) {
        Double value = values.get(key);
        if (value != null) {
            return value;
        }
        Double fallback = DEFAULTS.get(key);
        if (fallback == null) {
            throw new IllegalArgumentException("Unknown scoring key: " + key);
        }
        return fallback;
    }

    public static double defaultValue(String key) {
        Double value = DEFAULTS.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Unknown scoring key: " + key);
        }
        return value;
    }

    public int getBaseEligibilityWeight() {
        return (int) get(WEIGHT_BASE_ELIGIBILITY);
    }

    public int getExactSpecializationWeight() {
        return (int) get(WEIGHT_EXACT_SPECIALIZATION);
    }

    public int getGeneralFallbackWeight() {
        return (int) get(WEIGHT_GENERAL_FALLBACK);
    }

    public int getDateAvailableWeight() {
        return (int) get(WEIGHT_DATE_AVAILABLE);
    }

    public int getWorkloadCap() {
        return (int) get(WEIGHT_WORKLOAD_CAP);
    }

    public int getWorkloadPerBooking() {
        return (int) get(WEIGHT_WORKLOAD_PER_BOOKING);
    }

    public int getWorkloadFloor() {
        return (int) get(WEIGHT_WORKLOAD_FLOOR);
    }

    public int getEmergencyWeight() {
        return (int) get(WEIGHT_EMERGENCY);
    }

    public double getExactConfidence() {
        return get(CONFIDENCE_EXACT);
    }

    public double getGeneralFallbackConfidence() {
        return get(CONFIDENCE_GENERAL_FALLBACK);
    }

    public double getEmergencyConfidenceBonus() {
        return get(CONFIDENCE_EMERGENCY_BONUS);
    }

    public double getUnavailableConfidencePenalty() {
        return get(CONFIDENCE_UNAVAILABLE_PENALTY);
    }

    @Override
    public String toString() {
        return "ScoringConfig" + values;
    }
}
