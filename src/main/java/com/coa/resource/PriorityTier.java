package com.coa.resource;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resource requirement tiers and their weights.
 */
public enum PriorityTier {
    REQUIRED(1.0, List.of("필수", "required", "mandatory", "must")),
    RECOMMENDED(0.6, List.of("권장", "recommended", "suggested")),
    OPTIONAL(0.3, List.of("선택", "optional", "choice"));

    private final double weight;
    private final List<String> labels;

    PriorityTier(double weight, List<String> labels) {
        this.weight = weight;
        this.labels = labels;
    }

    public double weight() {
        return weight;
    }

    public List<String> labels() {
        return labels;
    }

    /**
     * Resolve a tier from its Korean or English label (case-insensitive).
     */
    public static Optional<PriorityTier> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String key = label.trim().toLowerCase(Locale.ROOT);
        for (PriorityTier tier : values()) {
            if (tier.labels.contains(key)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
