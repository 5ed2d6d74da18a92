package com.coa.scoring;

import java.util.Locale;
import java.util.Optional;

/**
 * Base scoring factors, with default weights and the reference threshold
 * used to classify a factor score as a strength or weakness.
 */
public enum Factor {
    MISSION_ALIGNMENT("missionAlignment", 0.25, 0.6),
    COMBAT_POWER("combatPower", 0.15, 0.5),
    THREAT_RESPONSE("threatResponse", 0.20, 0.6),
    MOBILITY("mobility", 0.06, 0.5),
    CONSTRAINT_FIT("constraintFit", 0.07, 0.5),
    RESOURCES("resources", 0.15, 0.5),
    ASSETS("assets", 0.12, 0.5);

    /** Distance from the threshold at which a factor counts as strong or weak. */
    public static final double STRENGTH_MARGIN = 0.1;

    private final String key;
    private final double defaultWeight;
    private final double threshold;

    Factor(String key, double defaultWeight, double threshold) {
        this.key = key;
        this.defaultWeight = defaultWeight;
        this.threshold = threshold;
    }

    public String key() {
        return key;
    }

    public double defaultWeight() {
        return defaultWeight;
    }

    public double threshold() {
        return threshold;
    }

    public boolean isStrength(double score) {
        return score >= threshold + STRENGTH_MARGIN;
    }

    public boolean isWeakness(double score) {
        return score <= threshold - STRENGTH_MARGIN;
    }

    /**
     * Resolve a factor from its config key ("combatPower", "combat_power", "combat-power").
     */
    public static Optional<Factor> fromKey(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        for (Factor factor : values()) {
            if (factor.key.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(factor);
            }
        }
        return Optional.empty();
    }
}
