package com.coa.model;

import java.util.List;
import java.util.Set;

/**
 * Civilian area that a COA must protect.
 *
 * @param id                 Area identifier
 * @param name               Display name
 * @param protectionPriority Protection priority 0-1
 * @param populationDensity  Population density (people per km2)
 * @param cellIds            Terrain cells covered by the area
 * @param criticalFacilities Hospitals, schools and similar facilities inside the area
 */
public record CivilianArea(
        String id,
        String name,
        double protectionPriority,
        double populationDensity,
        Set<String> cellIds,
        List<String> criticalFacilities
) {
    public CivilianArea {
        protectionPriority = Math.min(1.0, Math.max(0.0, protectionPriority));
        populationDensity = Math.max(0.0, populationDensity);
        cellIds = cellIds == null ? Set.of() : Set.copyOf(cellIds);
        criticalFacilities = criticalFacilities == null ? List.of() : List.copyOf(criticalFacilities);
    }

    public CivilianArea(String id, double protectionPriority, double populationDensity, Set<String> cellIds) {
        this(id, id, protectionPriority, populationDensity, cellIds, List.of());
    }

    public boolean hasCriticalFacilities() {
        return !criticalFacilities.isEmpty();
    }
}
