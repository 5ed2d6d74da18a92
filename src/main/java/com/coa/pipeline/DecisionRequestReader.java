package com.coa.pipeline;

import com.coa.diagnostics.Diagnostic;
import com.coa.exception.InvalidInputException;
import com.coa.model.AxisState;
import com.coa.model.CivilianArea;
import com.coa.model.Coa;
import com.coa.model.CoaType;
import com.coa.model.Constraint;
import com.coa.model.MissionProfile;
import com.coa.model.SituationContext;
import com.coa.resource.AvailableResource;
import com.coa.resource.ParsedRequirements;
import com.coa.resource.ResourcePriorityParser;
import com.coa.resource.ResourceRequirement;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link DecisionRequest} from a JSON document and renders a {@link DecisionResult}
 * back to JSON.
 * <p>
 * Expected shape:
 * <pre>
 * {
 *   "situation": {"id": "S1", "threatLevel": 0.85, "threatType": "포격", "mission": {...},
 *                 "axes": [...], "resources": [...], "constraints": [...],
 *                 "civilianAreas": [...], "terrainTags": [...], "attributes": {...}},
 *   "candidates": [{"id": "COA-1", "type": "defense", "resources": "포병대대(필수), 공격헬기(권장)", ...}]
 * }
 * </pre>
 * Missing identifiers and unknown candidate COA types are rejected with {@link InvalidInputException}.
 * Malformed resource tokens and unknown restricted COA types are skipped and reported on the request.
 */
public class DecisionRequestReader {

    private static final Logger log = LoggerFactory.getLogger(DecisionRequestReader.class);

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final ResourcePriorityParser resourceParser;

    public DecisionRequestReader(ResourcePriorityParser resourceParser) {
        this.resourceParser = resourceParser;
    }

    public DecisionRequestReader() {
        this(new ResourcePriorityParser());
    }

    /**
     * Parse a request document.
     *
     * @param json JSON text
     * @return Request with any resource parse warnings attached
     */
    public DecisionRequest read(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidInputException("Empty decision request");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Invalid JSON decision request: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidInputException("Decision request must be a JSON object");
        }

        JsonNode situationNode = root.path("situation");
        if (!situationNode.isObject()) {
            throw new InvalidInputException("Decision request has no 'situation' object");
        }
        List<Diagnostic> warnings = new ArrayList<>();
        SituationContext situation = readSituation(situationNode, warnings);

        List<Coa> candidates = new ArrayList<>();
        for (JsonNode node : root.path("candidates")) {
            candidates.add(readCoa(node, warnings));
        }
        return new DecisionRequest(candidates, situation, warnings);
    }

    /**
     * Render a result as indented JSON.
     */
    public String write(DecisionResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Could not render result for " + result.situationId(), e);
        }
    }

    SituationContext readSituation(JsonNode node, List<Diagnostic> warnings) {
        SituationContext.Builder builder = SituationContext.builder(requiredText(node, "id", "situation"))
                .threatLevel(node.path("threatLevel").asDouble(0.0))
                .dominantThreatType(optionalText(node, "threatType"))
                .threatId(optionalText(node, "threatId"))
                .threatKeywords(textSet(node.path("threatKeywords")))
                .terrainTags(textSet(node.path("terrainTags")));

        JsonNode mission = node.path("mission");
        if (mission.isObject()) {
            builder.mission(new MissionProfile(optionalText(mission, "id"), optionalText(mission, "type"),
                    mission.path("priority").asInt(5), textSet(mission.path("objectives"))));
        }
        for (JsonNode axis : node.path("axes")) {
            JsonNode mobility = axis.path("mobility");
            builder.axis(new AxisState(requiredText(axis, "id", "axis"),
                    axis.path("friendlyCombatPower").asDouble(0.0),
                    axis.path("enemyCombatPower").asDouble(0.0),
                    mobility.isNumber() ? mobility.asDouble() : null));
        }
        for (JsonNode resource : node.path("resources")) {
            builder.resource(new AvailableResource(requiredText(resource, "name", "resource"),
                    optionalText(resource, "role"),
                    resource.path("quantity").asInt(1),
                    resource.path("operational").asBoolean(true)));
        }
        for (JsonNode constraint : node.path("constraints")) {
            JsonNode max = constraint.path("maxDurationHours");
            String constraintId = requiredText(constraint, "id", "constraint");
            builder.constraint(new Constraint(constraintId,
                    constraint.path("scope").asText("mission"),
                    constraint.path("timeCritical").asBoolean(false),
                    max.isNumber() ? max.asDouble() : null,
                    constraint.path("importance").asInt(Constraint.IMPORTANCE_MEDIUM),
                    coaTypes(constraintId, constraint.path("restrictedCoaTypes"), warnings)));
        }
        for (JsonNode area : node.path("civilianAreas")) {
            String id = requiredText(area, "id", "civilian area");
            builder.civilianArea(new CivilianArea(id, area.path("name").asText(id),
                    area.path("protectionPriority").asDouble(0.0),
                    area.path("populationDensity").asDouble(0.0),
                    textSet(area.path("cells")),
                    new ArrayList<>(textSet(area.path("criticalFacilities")))));
        }
        JsonNode attributes = node.path("attributes");
        if (attributes.isObject()) {
            builder.attributes(objectMapper.convertValue(attributes, new TypeReference<Map<String, Object>>() {}));
        }
        return builder.build();
    }

    Coa readCoa(JsonNode node, List<Diagnostic> warnings) {
        String id = requiredText(node, "id", "candidate");
        String typeLabel = node.path("type").asText("");
        CoaType type = CoaType.fromLabel(typeLabel)
                .orElseThrow(() -> new InvalidInputException("COA '" + id + "' has unknown type '" + typeLabel + "'"));

        Coa.Builder builder = Coa.builder(id, type)
                .name(optionalText(node, "name"))
                .description(optionalText(node, "description"))
                .requiredResources(requirements(node.path("resources"), warnings))
                .requiredAssets(requirements(node.path("assets"), warnings))
                .impactTerrainCells(textSet(node.path("impactCells")))
                .estimatedDurationHours(node.path("durationHours").asDouble(0.0))
                .purposeTags(textSet(node.path("purposeTags")))
                .compatibleTerrain(textSet(node.path("compatibleTerrain")))
                .incompatibleTerrain(textSet(node.path("incompatibleTerrain")))
                .keywords(textSet(node.path("keywords")));

        JsonNode combatPower = node.path("requiredCombatPower");
        if (combatPower.isNumber()) {
            builder.requiredCombatPower(combatPower.asDouble());
        }
        JsonNode mobility = node.path("requiredMobility");
        if (mobility.isNumber()) {
            builder.requiredMobility(mobility.asDouble());
        }
        return builder.build();
    }

    // Accepts either the "name(tier), name(tier)" text form or an array of such tokens.
    private List<ResourceRequirement> requirements(JsonNode node, List<Diagnostic> warnings) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        String raw = node.isArray() ? String.join(",", textSet(node)) : node.asText("");
        ParsedRequirements parsed = resourceParser.parseWithWarnings(raw);
        warnings.addAll(parsed.warnings());
        return parsed.requirements();
    }

    // Unknown labels are dropped with a DATA_GAP warning
    private static Set<CoaType> coaTypes(String constraintId, JsonNode node, List<Diagnostic> warnings) {
        Set<CoaType> types = new LinkedHashSet<>();
        for (String label : textSet(node)) {
            Optional<CoaType> type = CoaType.fromLabel(label);
            if (type.isPresent()) {
                types.add(type.get());
            } else {
                warnings.add(Diagnostic.dataGap("unknown restricted COA type",
                        "Constraint '" + constraintId + "' restricts unknown COA type '" + label + "'; ignored"));
                log.warn("Constraint '{}' restricts unknown COA type '{}', ignoring it", constraintId, label);
            }
        }
        return types;
    }

    private static Set<String> textSet(JsonNode node) {
        Set<String> values = new LinkedHashSet<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (!element.isNull() && !element.asText().isBlank()) {
                    values.add(element.asText().trim());
                }
            }
        }
        return values;
    }

    private static String requiredText(JsonNode node, String field, String what) {
        String value = optionalText(node, field);
        if (value == null || value.isBlank()) {
            throw new InvalidInputException("Missing '" + field + "' on " + what);
        }
        return value;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }
}
