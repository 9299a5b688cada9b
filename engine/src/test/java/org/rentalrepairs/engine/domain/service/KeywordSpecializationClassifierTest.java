package org.rentalrepairs.engine.domain.service;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.rentalrepairs.engine.domain.model.Specialization;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class KeywordSpecializationClassifierTest {

    private final SpecializationClassifier classifier = new KeywordSpecializationClassifier();

    @Test
    void test_water_issues_need_plumbing() {
        assertEquals(Specialization.PLUMBING, classifier.classify("Leaking faucet", "Water dripping under sink"));
        assertEquals(Specialization.PLUMBING, classifier.classify("Toilet won't flush", "Bathroom toilet issue"));
        assertEquals(Specialization.PLUMBING, classifier.classify("Drain clogged", "Sink drain backing up"));
    }

    @Test
    void test_power_issues_need_electrical() {
        assertEquals(Specialization.ELECTRICAL, classifier.classify("Outlet sparking", "Power outlet in bedroom"));
        assertEquals(Specialization.ELECTRICAL, classifier.classify("Circuit breaker tripped", "Electrical panel issue"));
    }

    @Test
    void test_temperature_issues_need_hvac() {
        assertEquals(Specialization.HVAC, classifier.classify("Heater not working", "Furnace won't turn on"));
        assertEquals(Specialization.HVAC, classifier.classify("AC broken", "Air conditioning not cooling"));
    }

    @Test
    void test_other_trades() {
        assertEquals(Specialization.LOCKSMITH, classifier.classify("Locked out", "Lost my key, can't get in"));
        assertEquals(Specialization.PAINTING, classifier.classify("Paint peeling", "Need repainting work"));
        assertEquals(Specialization.CARPENTRY, classifier.classify("Cabinet door broken", "Kitchen wooden cabinet"));
        assertEquals(Specialization.APPLIANCE_REPAIR, classifier.classify("Refrigerator broken", "Fridge not cooling"));
    }

    @Test
    void test_appliance_wins_over_plumbing() {
        assertEquals(Specialization.APPLIANCE_REPAIR, classifier.classify("Dishwasher leaking", "Water on the floor"));
    }

    @Test
    void test_lock_wins_over_carpentry() {
        assertEquals(Specialization.LOCKSMITH, classifier.classify("Door lock broken", "The wooden door lock is stuck"));
    }

    @Test
    void test_case_insensitive() {
        assertEquals(Specialization.PLUMBING, classifier.classify("LEAKING FAUCET", "WATER DRIPPING"));
    }

    @Test
    void test_unmatched_or_empty_text_falls_back_to_general_maintenance() {
        assertEquals(Specialization.GENERAL_MAINTENANCE, classifier.classify("Unknown problem", "Not sure what's wrong"));
        assertEquals(Specialization.GENERAL_MAINTENANCE, classifier.classify("", ""));
        assertEquals(Specialization.GENERAL_MAINTENANCE, classifier.classify(null, null));
    }
}
