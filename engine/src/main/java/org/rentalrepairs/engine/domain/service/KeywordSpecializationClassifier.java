package org.rentalrepairs.engine.domain.service;

import org.rentalrepairs.engine.domain.model.Specialization;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Keyword-based classifier. Trades are checked in a fixed priority order and the first trade
 * with a keyword contained in the lower-cased text wins.
 */
public final class KeywordSpecializationClassifier implements SpecializationClassifier {

    private static final Logger LOG = Logger.getLogger(KeywordSpecializationClassifier.class.getName());

    // Appliances before plumbing ("dishwasher leaking"), locks before carpentry ("door lock").
    private static final Map<Specialization, List<String>> KEYWORDS_BY_PRIORITY;

    static {
        Map<Specialization, List<String>> keywords = new LinkedHashMap<>();
        keywords.put(Specialization.APPLIANCE_REPAIR, Arrays.asList(
                "appliance", "refrigerator", "fridge", "washer", "dryer", "dishwasher", "oven", "stove",
                "microwave", "freezer"));
        keywords.put(Specialization.LOCKSMITH, Arrays.asList(
                "lock", "key", "security", "deadbolt", "locked out", "lockout", "unlock", "rekey"));
        keywords.put(Specialization.PLUMBING, Arrays.asList(
                "plumb", "leak", "water", "drain", "pipe", "faucet", "toilet", "sink", "clog", "drip",
                "flush", "sewer"));
        keywords.put(Specialization.ELECTRICAL, Arrays.asList(
                "electric", "power", "outlet", "wiring", "light", "switch", "breaker", "circuit", "lamp",
                "fixture", "voltage", "spark"));
        keywords.put(Specialization.HVAC, Arrays.asList(
                "hvac", "furnace", "thermostat", "ventilation", "conditioner", "heating system",
                "cooling system", "heat pump", "air conditioning"));
        keywords.put(Specialization.PAINTING, Arrays.asList(
                "paint", "repaint", "brush", "roller", "color"));
        keywords.put(Specialization.CARPENTRY, Arrays.asList(
                "wood", "cabinet", "carpenter", "shelf", "wooden"));
        KEYWORDS_BY_PRIORITY = Collections.unmodifiableMap(keywords);
    }

    @Override
    public Specialization classify(String title, String description) {
        String text = (nullToEmpty(title) + " " + nullToEmpty(description)).toLowerCase(Locale.ROOT).trim();
        if (text.isEmpty()) {
            return Specialization.GENERAL_MAINTENANCE;
        }

        for (Map.Entry<Specialization, List<String>> entry : KEYWORDS_BY_PRIORITY.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (text.contains(keyword)) {
                    LOG.fine(() -> String.format("Classified '%s' as %s (keyword '%s')",
                            text, entry.getKey(), keyword));
                    return entry.getKey();
                }
            }
        }
        return Specialization.GENERAL_MAINTENANCE;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
