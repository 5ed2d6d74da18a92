package com.coa.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Course-of-action type tags.
 */
public enum CoaType {
    DEFENSE("Defense", 24.0),
    OFFENSIVE("Offensive", 48.0),
    COUNTER_ATTACK("CounterAttack", 36.0),
    MANEUVER("Maneuver", 18.0),
    DETERRENCE("Deterrence", 6.0),
    PREEMPTIVE("Preemptive", 12.0),
    INFORMATION_OPS("InformationOps", 4.0);

    private final String label;
    private final double defaultDurationHours;

    CoaType(String label, double defaultDurationHours) {
        this.label = label;
        this.defaultDurationHours = defaultDurationHours;
    }

    public String label() {
        return label;
    }

    /**
     * Typical execution time used when a COA declares no duration.
     */
    public double defaultDurationHours() {
        return defaultDurationHours;
    }

    /**
     * Resolve a type from a label, enum name or rule action value.
     * Accepts "Defense", "DEFENSE", "counter_attack", "CounterAttack" and a trailing "COA" ("DefenseCOA").
     *
     * @param value Raw type text
     * @return Matching type, or empty if unknown
     */
    public static Optional<CoaType> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String key = normalize(value);
        if (key.endsWith("coa") && key.length() > 3) {
            key = key.substring(0, key.length() - 3);
        }
        for (CoaType type : values()) {
            if (normalize(type.label).equals(key) || normalize(type.name()).equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static String normalize(String value) {
        return value.trim()
                .toLowerCase(Locale.ROOT)
                .replace("_", "")
                .replace("-", "")
                .replace(" ", "");
    }

    @Override
    public String toString() {
        return label;
    }
}
