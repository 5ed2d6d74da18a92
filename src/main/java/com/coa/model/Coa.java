package com.coa.model;

import com.coa.exception.InvalidInputException;
import com.coa.resource.ResourceRequirement;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A candidate course of action. Immutable once built.
 *
 * @param id                     Identifier, also the ranking tie-break key
 * @param type                   COA type tag
 * @param name                   Display name
 * @param description            Free-text description
 * @param requiredResources      Parsed resource requirements
 * @param requiredAssets         COA-specific asset requirements (may be empty)
 * @param impactTerrainCellIds   Terrain cells the COA affects
 * @param estimatedDurationHours Estimated duration; zero or negative means unknown
 * @param purposeTags            Purpose tags matched against mission objectives
 * @param compatibleTerrain      Terrain tags the COA is suited for
 * @param incompatibleTerrain    Terrain tags the COA is poorly suited for
 * @param requiredCombatPower    Combat power the COA needs, or null when undeclared
 * @param requiredMobility       Mobility 0-1 the COA needs, or null when undeclared
 * @param keywords               Keywords used for relevance similarity
 */
public record Coa(
        String id,
        CoaType type,
        String name,
        String description,
        List<ResourceRequirement> requiredResources,
        List<ResourceRequirement> requiredAssets,
        Set<String> impactTerrainCellIds,
        double estimatedDurationHours,
        Set<String> purposeTags,
        Set<String> compatibleTerrain,
        Set<String> incompatibleTerrain,
        Double requiredCombatPower,
        Double requiredMobility,
        Set<String> keywords
) {
    public Coa {
        if (id == null || id.isBlank()) {
            throw new InvalidInputException("COA id is required");
        }
        if (type == null) {
            throw new InvalidInputException("COA '" + id + "' has no type");
        }
        name = name == null ? id : name;
        description = description == null ? "" : description;
        requiredResources = requiredResources == null ? List.of() : List.copyOf(requiredResources);
        requiredAssets = requiredAssets == null ? List.of() : List.copyOf(requiredAssets);
        impactTerrainCellIds = impactTerrainCellIds == null ? Set.of() : Set.copyOf(impactTerrainCellIds);
        purposeTags = purposeTags == null ? Set.of() : Set.copyOf(purposeTags);
        compatibleTerrain = compatibleTerrain == null ? Set.of() : Set.copyOf(compatibleTerrain);
        incompatibleTerrain = incompatibleTerrain == null ? Set.of() : Set.copyOf(incompatibleTerrain);
        keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
    }

    public boolean hasKnownDuration() {
        return estimatedDurationHours > 0;
    }

    public static Builder builder(String id, CoaType type) {
        return new Builder(id, type);
    }

    /**
     * Builder for Coa.
     */
    public static final class Builder {
        private final String id;
        private final CoaType type;
        private String name;
        private String description;
        private final List<ResourceRequirement> requiredResources = new ArrayList<>();
        private final List<ResourceRequirement> requiredAssets = new ArrayList<>();
        private final Set<String> impactTerrainCellIds = new LinkedHashSet<>();
        private double estimatedDurationHours;
        private final Set<String> purposeTags = new LinkedHashSet<>();
        private final Set<String> compatibleTerrain = new LinkedHashSet<>();
        private final Set<String> incompatibleTerrain = new LinkedHashSet<>();
        private Double requiredCombatPower;
        private Double requiredMobility;
        private final Set<String> keywords = new LinkedHashSet<>();

        private Builder(String id, CoaType type) {
            this.id = id;
            this.type = type;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder requiredResources(List<ResourceRequirement> requirements) {
            this.requiredResources.addAll(requirements);
            return this;
        }

        public Builder requiredAssets(List<ResourceRequirement> assets) {
            this.requiredAssets.addAll(assets);
            return this;
        }

        public Builder impactTerrainCells(String... cellIds) {
            this.impactTerrainCellIds.addAll(List.of(cellIds));
            return this;
        }

        public Builder impactTerrainCells(Set<String> cellIds) {
            this.impactTerrainCellIds.addAll(cellIds);
            return this;
        }

        public Builder estimatedDurationHours(double hours) {
            this.estimatedDurationHours = hours;
            return this;
        }

        public Builder purposeTags(String... tags) {
            this.purposeTags.addAll(List.of(tags));
            return this;
        }

        public Builder purposeTags(Set<String> tags) {
            this.purposeTags.addAll(tags);
            return this;
        }

        public Builder compatibleTerrain(String... tags) {
            this.compatibleTerrain.addAll(List.of(tags));
            return this;
        }

        public Builder compatibleTerrain(Set<String> tags) {
            this.compatibleTerrain.addAll(tags);
            return this;
        }

        public Builder incompatibleTerrain(String... tags) {
            this.incompatibleTerrain.addAll(List.of(tags));
            return this;
        }

        public Builder incompatibleTerrain(Set<String> tags) {
            this.incompatibleTerrain.addAll(tags);
            return this;
        }

        public Builder requiredCombatPower(Double combatPower) {
            this.requiredCombatPower = combatPower;
            return this;
        }

        public Builder requiredMobility(Double mobility) {
            this.requiredMobility = mobility;
            return this;
        }

        public Builder keywords(String... words) {
            this.keywords.addAll(List.of(words));
            return this;
        }

        public Builder keywords(Set<String> words) {
            this.keywords.addAll(words);
            return this;
        }

        public Coa build() {
            return new Coa(id, type, name, description, requiredResources, requiredAssets,
                    impactTerrainCellIds, estimatedDurationHours, purposeTags, compatibleTerrain,
                    incompatibleTerrain, requiredCombatPower, requiredMobility, keywords);
        }
    }
}
