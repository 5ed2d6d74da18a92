package com.coa.model;

import com.coa.exception.InvalidInputException;
import com.coa.resource.AvailableResource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed description of the operational situation, validated once at construction.
 * <p>
 * Threat levels above 1 are read as percentages (85 becomes 0.85) and clamped to [0,1].
 *
 * @param situationId        Identifier
 * @param threatLevel        Threat level 0-1
 * @param dominantThreatType Threat type name or code used for relevance lookup
 * @param threatId           Threat event identifier (for critical relevance overrides), may be null
 * @param threatKeywords     Keywords describing the threat
 * @param mission            Mission summary, may be null
 * @param axisStates         Per-axis combat state
 * @param availableResources Friendly resources
 * @param constraints        Operational constraints
 * @param civilianAreas      Civilian areas to protect
 * @param terrainTags        Terrain tags present in the area of operations
 * @param attributes         Additional scalar attributes usable by rules
 */
public record SituationContext(
        String situationId,
        double threatLevel,
        String dominantThreatType,
        String threatId,
        Set<String> threatKeywords,
        MissionProfile mission,
        List<AxisState> axisStates,
        List<AvailableResource> availableResources,
        List<Constraint> constraints,
        List<CivilianArea> civilianAreas,
        Set<String> terrainTags,
        Map<String, Object> attributes
) {
    public SituationContext {
        if (situationId == null || situationId.isBlank()) {
            throw new InvalidInputException("Situation id is required");
        }
        threatLevel = normalizeThreatLevel(threatLevel);
        threatKeywords = threatKeywords == null ? Set.of() : Set.copyOf(threatKeywords);
        axisStates = axisStates == null ? List.of() : List.copyOf(axisStates);
        availableResources = availableResources == null ? List.of() : List.copyOf(availableResources);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        civilianAreas = civilianAreas == null ? List.of() : List.copyOf(civilianAreas);
        terrainTags = terrainTags == null ? Set.of() : Set.copyOf(terrainTags);
        attributes = withoutNullValues(attributes);
    }

    private static Map<String, Object> withoutNullValues(Map<String, Object> values) {
        if (values == null) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Map.copyOf(copy);
    }

    /** Raw threat levels at or above this value are read as percentages. */
    static final double PERCENT_CUTOFF = 1.5;

    /**
     * Normalize a threat level into [0, 1]. Values at or above {@value #PERCENT_CUTOFF} are
     * percentages and divided by 100; values between 1.0 and the cutoff are clamped to 1.0.
     */
    static double normalizeThreatLevel(double raw) {
        if (Double.isNaN(raw)) {
            return 0.0;
        }
        double value = raw >= PERCENT_CUTOFF ? raw / 100.0 : raw;
        return Math.min(1.0, Math.max(0.0, value));
    }

    /**
     * Friendly to enemy combat power across all axes, or null when unknown.
     */
    public Double forceRatio() {
        double friendly = 0.0;
        double enemy = 0.0;
        for (AxisState axis : axisStates) {
            friendly += axis.friendlyCombatPower();
            enemy += axis.enemyCombatPower();
        }
        if (axisStates.isEmpty() || enemy <= 0.0) {
            return null;
        }
        return friendly / enemy;
    }

    public double totalFriendlyCombatPower() {
        return axisStates.stream().mapToDouble(AxisState::friendlyCombatPower).sum();
    }

    /**
     * Mean axis mobility, or null when no axis reports mobility.
     */
    public Double averageMobility() {
        double sum = 0.0;
        int count = 0;
        for (AxisState axis : axisStates) {
            if (axis.mobility() != null) {
                sum += axis.mobility();
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }

    public int axisCount() {
        return axisStates.size();
    }

    /**
     * Whether any constraint declares a hard time limit.
     */
    public boolean timeCritical() {
        return constraints.stream().anyMatch(Constraint::timeCritical);
    }

    public String missionType() {
        return mission == null ? null : mission.missionType();
    }

    /**
     * Named scalar fields visible to rule conditions. Attributes are added first so
     * that derived fields take precedence on a name clash.
     */
    public Map<String, Object> scalarFields() {
        Map<String, Object> fields = new LinkedHashMap<>(attributes);
        fields.put("threatLevel", threatLevel);
        fields.put("axisCount", axisCount());
        fields.put("timeCritical", timeCritical());
        fields.put("civilianAreaCount", civilianAreas.size());
        fields.put("maxCivilianPriority", civilianAreas.stream()
                .mapToDouble(CivilianArea::protectionPriority).max().orElse(0.0));
        fields.put("availableResourceCount", availableResources.size());
        Double forceRatio = forceRatio();
        if (forceRatio != null) {
            fields.put("forceRatio", forceRatio);
        }
        Double mobility = averageMobility();
        if (mobility != null) {
            fields.put("averageMobility", mobility);
        }
        if (dominantThreatType != null) {
            fields.put("threatType", dominantThreatType);
        }
        if (mission != null) {
            fields.put("missionPriority", mission.priority());
            if (mission.missionType() != null) {
                fields.put("missionType", mission.missionType());
            }
        }
        return fields;
    }

    public static Builder builder(String situationId) {
        return new Builder(situationId);
    }

    /**
     * Builder for SituationContext.
     */
    public static final class Builder {
        private final String situationId;
        private double threatLevel;
        private String dominantThreatType;
        private String threatId;
        private final Set<String> threatKeywords = new LinkedHashSet<>();
        private MissionProfile mission;
        private final List<AxisState> axisStates = new ArrayList<>();
        private final List<AvailableResource> availableResources = new ArrayList<>();
        private final List<Constraint> constraints = new ArrayList<>();
        private final List<CivilianArea> civilianAreas = new ArrayList<>();
        private final Set<String> terrainTags = new LinkedHashSet<>();
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder(String situationId) {
            this.situationId = situationId;
        }

        public Builder threatLevel(double threatLevel) {
            this.threatLevel = threatLevel;
            return this;
        }

        public Builder dominantThreatType(String threatType) {
            this.dominantThreatType = threatType;
            return this;
        }

        public Builder threatId(String threatId) {
            this.threatId = threatId;
            return this;
        }

        public Builder threatKeywords(Set<String> keywords) {
            this.threatKeywords.addAll(keywords);
            return this;
        }

        public Builder mission(MissionProfile mission) {
            this.mission = mission;
            return this;
        }

        public Builder axis(AxisState axis) {
            this.axisStates.add(axis);
            return this;
        }

        public Builder axes(List<AxisState> axes) {
            this.axisStates.addAll(axes);
            return this;
        }

        public Builder resource(AvailableResource resource) {
            this.availableResources.add(resource);
            return this;
        }

        public Builder resources(List<AvailableResource> resources) {
            this.availableResources.addAll(resources);
            return this;
        }

        public Builder constraint(Constraint constraint) {
            this.constraints.add(constraint);
            return this;
        }

        public Builder constraints(List<Constraint> constraints) {
            this.constraints.addAll(constraints);
            return this;
        }

        public Builder civilianArea(CivilianArea area) {
            this.civilianAreas.add(area);
            return this;
        }

        public Builder civilianAreas(List<CivilianArea> areas) {
            this.civilianAreas.addAll(areas);
            return this;
        }

        public Builder terrainTags(Set<String> tags) {
            this.terrainTags.addAll(tags);
            return this;
        }

        public Builder attribute(String name, Object value) {
            this.attributes.put(name, value);
            return this;
        }

        public Builder attributes(Map<String, Object> values) {
            this.attributes.putAll(values);
            return this;
        }

        public SituationContext build() {
            return new SituationContext(situationId, threatLevel, dominantThreatType, threatId,
                    threatKeywords, mission, axisStates, availableResources, constraints,
                    civilianAreas, terrainTags, attributes);
        }
    }
}
