package org.rentalrepairs.engine.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rentalrepairs.engine.domain.model.ScoringConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class EngineConfigTest {

    @Test
    void test_defaults() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(ZoneId.of("UTC"), config.getZoneId());
        assertEquals(30, config.getWorkloadHorizonDays());
        assertEquals(60, config.getLookaheadDays());
        assertEquals(30, config.getBookingRangeDays());
        assertEquals(5, config.getOverloadedThreshold());
        assertEquals(2, config.getLightWorkloadThreshold());
        assertEquals(3, config.getMaxRecommendations());
        assertFalse(config.isFileLoggingEnabled());
        assertEquals(50, config.getScoringConfig().getEmergencyWeight());
    }

    @Test
    void test_lookup_overrides() {
        Map<String, String> env = new HashMap<>();
        env.put(EngineConfig.ZONE_ID_KEY, "Europe/Paris");
        env.put(EngineConfig.MAX_RECOMMENDATIONS_KEY, " 5 ");
        env.put(EngineConfig.FILE_LOGGING_ENABLED_KEY, "true");
        env.put("WEIGHT_EMERGENCY", "75");
        env.put("CONFIDENCE_EXACT", "0.85");

        EngineConfig config = EngineConfig.fromLookup(env::get);

        assertEquals(ZoneId.of("Europe/Paris"), config.getZoneId());
        assertEquals(5, config.getMaxRecommendations());
        assertTrue(config.isFileLoggingEnabled());
        assertEquals(75, config.getScoringConfig().getEmergencyWeight());
        assertEquals(0.85, config.getScoringConfig().getExactConfidence(), 1e-9);
        assertEquals(200, config.getScoringConfig().getExactSpecializationWeight());
    }

    @Test
    void test_malformed_values_fall_back_to_defaults() {
        Map<String, String> env = new HashMap<>();
        env.put(EngineConfig.WORKLOAD_HORIZON_DAYS_KEY, "thirty");
        env.put(EngineConfig.OVERLOADED_THRESHOLD_KEY, "-4");
        env.put(EngineConfig.ZONE_ID_KEY, "Mars/Olympus");
        env.put("WEIGHT_BASE_ELIGIBILITY", "lots");

        EngineConfig config = EngineConfig.fromLookup(env::get);

        assertEquals(30, config.getWorkloadHorizonDays());
        assertEquals(5, config.getOverloadedThreshold());
        assertEquals(ZoneId.of("UTC"), config.getZoneId());
        assertEquals(100, config.getScoringConfig().getBaseEligibilityWeight());
    }

    @Test
    void test_reads_dotenv_file(@TempDir Path dir) throws IOException {
        Files.write(dir.resolve(".env"), Arrays.asList(
                "AVAILABILITY_LOOKAHEAD_DAYS=14",
                "BOOKING_RANGE_DAYS=7",
                "WEIGHT_GENERAL_FALLBACK=120"), StandardCharsets.UTF_8);

        Dotenv dotenv = Dotenv.configure().directory(dir.toString()).load();
        EngineConfig config = EngineConfig.fromDotenv(dotenv);

        assertEquals(14, config.getLookaheadDays());
        assertEquals(7, config.getBookingRangeDays());
        assertEquals(120, config.getScoringConfig().getGeneralFallbackWeight());
        assertEquals(ScoringConfig.defaults().getEmergencyWeight(), config.getScoringConfig().getEmergencyWeight());
    }

    @Test
    void test_builder_rejects_invalid_values() {
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig.Builder().workloadHorizonDays(0));
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig.Builder().lightWorkloadThreshold(-1));
        assertThrows(NullPointerException.class, () -> new EngineConfig.Builder().scoringConfig(null));
    }
}
