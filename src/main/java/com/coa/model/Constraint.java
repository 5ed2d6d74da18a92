package com.coa.model;

import java.util.Set;

/**
 * Operational constraint.
 *
 * @param id                 Constraint identifier
 * @param scope              Scope of application (mission, axis, unit)
 * @param timeCritical       Whether exceeding maxDurationHours is a hard violation
 * @param maxDurationHours   Duration budget in hours, or null for none
 * @param importance         Importance 1 (optional) to 5 (critical)
 * @param restrictedCoaTypes COA types the constraint prohibits or restricts
 */
public record Constraint(
        String id,
        String scope,
        boolean timeCritical,
        Double maxDurationHours,
        int importance,
        Set<CoaType> restrictedCoaTypes
) {
    public static final int IMPORTANCE_CRITICAL = 5;
    public static final int IMPORTANCE_MEDIUM = 3;

    public Constraint {
        importance = Math.min(IMPORTANCE_CRITICAL, Math.max(1, importance));
        restrictedCoaTypes = restrictedCoaTypes == null ? Set.of() : Set.copyOf(restrictedCoaTypes);
    }

    /**
     * Create a time constraint with medium importance.
     */
    public static Constraint time(String id, boolean timeCritical, double maxDurationHours) {
        return new Constraint(id, "mission", timeCritical, maxDurationHours, IMPORTANCE_MEDIUM, Set.of());
    }

    public boolean hasDurationBudget() {
        return maxDurationHours != null && maxDurationHours > 0;
    }

    public boolean restricts(CoaType type) {
        return restrictedCoaTypes.contains(type);
    }
}
