package com.coa.mettc;

import java.util.Locale;
import java.util.Optional;

/**
 * The six METT-C evaluation dimensions.
 */
public enum MettCDimension {
    MISSION("mission"),
    ENEMY("enemy"),
    TERRAIN("terrain"),
    TROOPS("troops"),
    CIVILIAN("civilian"),
    TIME("time");

    private final String key;

    MettCDimension(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<MettCDimension> fromKey(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MettCDimension dimension : values()) {
            if (dimension.key.equals(normalized)) {
                return Optional.of(dimension);
            }
        }
        return Optional.empty();
    }
}
