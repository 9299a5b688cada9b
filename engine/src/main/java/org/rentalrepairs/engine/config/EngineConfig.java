package org.rentalrepairs.engine.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.rentalrepairs.engine.domain.model.ScoringConfig;
import org.rentalrepairs.engine.domain.model.Worker;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Immutable configuration for the scheduling engine.
 * Values come from the process environment, then a {@code .env} file, then the defaults below.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final String ZONE_ID_KEY = "SCHEDULING_ZONE_ID";
    public static final String WORKLOAD_HORIZON_DAYS_KEY = "WORKLOAD_HORIZON_DAYS";
    public static final String LOOKAHEAD_DAYS_KEY = "AVAILABILITY_LOOKAHEAD_DAYS";
    public static final String BOOKING_RANGE_DAYS_KEY = "BOOKING_RANGE_DAYS";
    public static final String OVERLOADED_THRESHOLD_KEY = "OVERLOADED_THRESHOLD";
    public static final String LIGHT_WORKLOAD_THRESHOLD_KEY = "LIGHT_WORKLOAD_THRESHOLD";
    public static final String MAX_RECOMMENDATIONS_KEY = "MAX_RECOMMENDATIONS";
    public static final String FILE_LOGGING_ENABLED_KEY = "ENGINE_FILE_LOGGING_ENABLED";
    public static final String LOG_FILE_KEY = "ENGINE_LOG_FILE";

    public static final String DEFAULT_ZONE_ID = "UTC";
    public static final int DEFAULT_BOOKING_RANGE_DAYS = 30;
    public static final int DEFAULT_OVERLOADED_THRESHOLD = 5;
    public static final int DEFAULT_LIGHT_WORKLOAD_THRESHOLD = 2;
    public static final int DEFAULT_MAX_RECOMMENDATIONS = 3;
    public static final String DEFAULT_LOG_FILE = "logs/scheduling-engine.log";

    private final ZoneId zoneId;
    private final int workloadHorizonDays;
    private final int lookaheadDays;
    private final int bookingRangeDays;
    private final int overloadedThreshold;
    private final int lightWorkloadThreshold;
    private final int maxRecommendations;
    private final boolean fileLoggingEnabled;
    private final String logFilePath;
    private final ScoringConfig scoringConfig;

    private EngineConfig(Builder builder) {
        this.zoneId = builder.zoneId;
        this.workloadHorizonDays = builder.workloadHorizonDays;
        this.lookaheadDays = builder.lookaheadDays;
        this.bookingRangeDays = builder.bookingRangeDays;
        this.overloadedThreshold = builder.overloadedThreshold;
        this.lightWorkloadThreshold = builder.lightWorkloadThreshold;
        this.maxRecommendations = builder.maxRecommendations;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
        this.logFilePath = builder.logFilePath;
        this.scoringConfig = builder.scoringConfig;
    }

    public static EngineConfig defaults() {
        return new Builder().build();
    }

    /**
     * Creates configuration from environment variables, falling back to {@code .env} in the
     * working directory and then in its parent.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv local = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        Dotenv parent = Dotenv.configure()
                .directory("../")
                .ignoreIfMissing()
                .load();
        return fromLookup(key -> {
            String value = local.get(key);
            if (value == null || value.trim().isEmpty()) {
                value = parent.get(key);
            }
            return value;
        });
    }

    /**
     * Creates configuration from a single loaded {@code .env} (which also sees the process environment).
     */
    public static EngineConfig fromDotenv(Dotenv dotenv) {
        Objects.requireNonNull(dotenv, "dotenv must not be null");
        return fromLookup(dotenv::get);
    }

    /**
     * Creates configuration from an arbitrary key lookup. Missing or blank keys take their default.
     */
    public static EngineConfig fromLookup(Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");

        ScoringConfig scoring = ScoringConfig.defaults();
        for (String key : ScoringConfig.KEYS) {
            String envKey = key.toUpperCase(Locale.ROOT);
            double value = getDouble(lookup, envKey, ScoringConfig.defaultValue(key));
            if (value != ScoringConfig.defaultValue(key)) {
                scoring = scoring.with(key, value);
            }
        }

        return new Builder()
                .zoneId(getZoneId(lookup, ZONE_ID_KEY, DEFAULT_ZONE_ID))
                .workloadHorizonDays(getPositiveInt(lookup, WORKLOAD_HORIZON_DAYS_KEY,
                        Worker.DEFAULT_WORKLOAD_HORIZON_DAYS))
                .lookaheadDays(getPositiveInt(lookup, LOOKAHEAD_DAYS_KEY, Worker.DEFAULT_LOOKAHEAD_DAYS))
                .bookingRangeDays(getPositiveInt(lookup, BOOKING_RANGE_DAYS_KEY, DEFAULT_BOOKING_RANGE_DAYS))
                .overloadedThreshold(getPositiveInt(lookup, OVERLOADED_THRESHOLD_KEY, DEFAULT_OVERLOADED_THRESHOLD))
                .lightWorkloadThreshold(getPositiveInt(lookup, LIGHT_WORKLOAD_THRESHOLD_KEY,
                        DEFAULT_LIGHT_WORKLOAD_THRESHOLD))
                .maxRecommendations(getPositiveInt(lookup, MAX_RECOMMENDATIONS_KEY, DEFAULT_MAX_RECOMMENDATIONS))
                .fileLoggingEnabled(getBoolean(lookup, FILE_LOGGING_ENABLED_KEY, false))
                .logFilePath(getString(lookup, LOG_FILE_KEY, DEFAULT_LOG_FILE))
                .scoringConfig(scoring)
                .build();
    }

    // Getters
    public ZoneId getZoneId() {
        return zoneId;
    }

    public int getWorkloadHorizonDays() {
        return workloadHorizonDays;
    }

    public int getLookaheadDays() {
        return lookaheadDays;
    }

    public int getBookingRangeDays() {
        return bookingRangeDays;
    }

    public int getOverloadedThreshold() {
        return overloadedThreshold;
    }

    public int getLightWorkloadThreshold() {
        return lightWorkloadThreshold;
    }

    public int getMaxRecommendations() {
        return maxRecommendations;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public ScoringConfig getScoringConfig() {
        return scoringConfig;
    }

    // Lookup helpers
    private static String getString(Function<String, String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
            return defaultValue;
        }
        return value.trim();
    }

    private static int getPositiveInt(Function<String, String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) {
                LOG.warning(() -> String.format("Non-positive value for %s: %s, using default: %d",
                        key, value, defaultValue));
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid integer for %s: %s, using default: %d", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static double getDouble(Function<String, String> lookup, String key, double defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid number for %s: %s, using default: %s", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static boolean getBoolean(Function<String, String> lookup, String key, boolean defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static ZoneId getZoneId(Function<String, String> lookup, String key, String defaultValue) {
        String value = getString(lookup, key, defaultValue);
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            LOG.warning(() -> String.format("Invalid zone id for %s: %s, using default: %s", key, value, defaultValue));
            return ZoneId.of(defaultValue);
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "zoneId=" + zoneId +
                ", workloadHorizonDays=" + workloadHorizonDays +
                ", lookaheadDays=" + lookaheadDays +
                ", bookingRangeDays=" + bookingRangeDays +
                ", overloadedThreshold=" + overloadedThreshold +
                ", lightWorkloadThreshold=" + lightWorkloadThreshold +
                ", maxRecommendations=" + maxRecommendations +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                ", scoring=" + scoringConfig +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private ZoneId zoneId = ZoneId.of(DEFAULT_ZONE_ID);
        private int workloadHorizonDays = Worker.DEFAULT_WORKLOAD_HORIZON_DAYS;
        private int lookaheadDays = Worker.DEFAULT_LOOKAHEAD_DAYS;
        private int bookingRangeDays = DEFAULT_BOOKING_RANGE_DAYS;
        private int overloadedThreshold = DEFAULT_OVERLOADED_THRESHOLD;
        private int lightWorkloadThreshold = DEFAULT_LIGHT_WORKLOAD_THRESHOLD;
        private int maxRecommendations = DEFAULT_MAX_RECOMMENDATIONS;
        private boolean fileLoggingEnabled = false;
        private String logFilePath = DEFAULT_LOG_FILE;
        private ScoringConfig scoringConfig = ScoringConfig.defaults();

        public Builder zoneId(ZoneId zoneId) {
            this.zoneId = Objects.requireNonNull(zoneId, "zoneId must not be null");
            return this;
        }

        public Builder workloadHorizonDays(int workloadHorizonDays) {
            this.workloadHorizonDays = requirePositive(workloadHorizonDays, "workloadHorizonDays");
            return this;
        }

        public Builder lookaheadDays(int lookaheadDays) {
            this.lookaheadDays = requirePositive(lookaheadDays, "lookaheadDays");
            return this;
        }

        public Builder bookingRangeDays(int bookingRangeDays) {
            this.bookingRangeDays = requirePositive(bookingRangeDays, "bookingRangeDays");
            return this;
        }

        public Builder overloadedThreshold(int overloadedThreshold) {
            this.overloadedThreshold = requirePositive(overloadedThreshold, "overloadedThreshold");
            return this;
        }

        public Builder lightWorkloadThreshold(int lightWorkloadThreshold) {
            if (lightWorkloadThreshold < 0) {
                throw new IllegalArgumentException("lightWorkloadThreshold must not be negative");
            }
            this.lightWorkloadThreshold = lightWorkloadThreshold;
            return this;
        }

        public Builder maxRecommendations(int maxRecommendations) {
            this.maxRecommendations = requirePositive(maxRecommendations, "maxRecommendations");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder scoringConfig(ScoringConfig scoringConfig) {
            this.scoringConfig = Objects.requireNonNull(scoringConfig, "scoringConfig must not be null");
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }

        private static int requirePositive(int value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be at least 1");
            }
            return value;
        }
    }
}
