package com.coa.config;

import com.coa.condition.ConditionType;
import com.coa.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConditionExpressionParser and the underlying ExpressionParser.
 */
class ConditionExpressionParserTest {

    // =====================================================================
    // Full expressions
    // =====================================================================

    @Test
    @DisplayName("Should parse a single comparison")
    void parseSingleComparison() {
        ConditionConfig config = ConditionExpressionParser.parse("threatLevel > 0.7");

        assertEquals(ConditionType.GREATER_THAN, config.type());
        assertEquals("threatLevel", config.field());
        assertEquals(0.7, config.value());
    }

    @Test
    @DisplayName("AND binds tighter than OR")
    void andBindsTighterThanOr() {
        ConditionConfig config = ConditionExpressionParser.parse("a > 1 or b > 2 and c > 3");

        assertEquals(ConditionType.OR, config.type());
        assertEquals(2, config.conditions().size());
        assertEquals(ConditionType.GREATER_THAN, config.conditions().get(0).type());
        assertEquals(ConditionType.AND, config.conditions().get(1).type());
    }

    @Test
    @DisplayName("Parentheses override precedence")
    void parenthesesOverridePrecedence() {
        ConditionConfig config = ConditionExpressionParser.parse("(a > 1 or b > 2) and c > 3");

        assertEquals(ConditionType.AND, config.type());
        assertEquals(ConditionType.OR, config.conditions().get(0).type());
    }

    @Test
    @DisplayName("NOT wraps the following primary")
    void notWrapsPrimary() {
        ConditionConfig config = ConditionExpressionParser.parse("not threatType == \"사이버\"");

        assertEquals(ConditionType.NOT, config.type());
        ConditionConfig inner = config.conditions().get(0);
        assertEquals(ConditionType.EQUALS, inner.type());
        assertEquals("사이버", inner.value());
    }

    @Test
    @DisplayName("Blank expression is always true")
    void blankIsAlwaysTrue() {
        assertEquals(ConditionType.ALWAYS_TRUE, ConditionExpressionParser.parse("  ").type());
        assertEquals(ConditionType.ALWAYS_TRUE, ConditionExpressionParser.parse(null).type());
    }

    @ParameterizedTest
    @DisplayName("Should reject malformed expressions")
    @ValueSource(strings = {
            "threatLevel >",
            "threatLevel > \"high\"",
            "> 0.7",
            "threatLevel > 0.7 and",
            "(threatLevel > 0.7",
            "threatLevel 0.7"
    })
    void rejectMalformed(String expression) {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConditionExpressionParser.parse(expression));
        assertTrue(e.getMessage().startsWith("Invalid condition at position"));
    }

    // =====================================================================
    // Field-bound and map forms
    // =====================================================================

    @Test
    @DisplayName("Field-bound expression applies every comparison to the field")
    void fieldBoundExpression() {
        ConditionConfig config = ConditionExpressionParser.parseForField("threatLevel", "> 0.4 and <= 0.7");

        assertEquals(ConditionType.AND, config.type());
        assertEquals(ConditionType.GREATER_THAN, config.conditions().get(0).type());
        assertEquals("threatLevel", config.conditions().get(0).field());
        assertEquals(ConditionType.LESS_THAN_OR_EQUALS, config.conditions().get(1).type());
        assertEquals("threatLevel", config.conditions().get(1).field());
    }

    @Test
    @DisplayName("Map form AND-s its entries")
    void mapFormAndsEntries() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("threat_level", "> 0.4 and <= 0.7");
        fields.put("missionType", "방어");
        fields.put("axisCount", 2);

        ConditionConfig config = ConditionExpressionParser.parseFieldMap(fields);

        assertEquals(ConditionType.AND, config.type());
        List<ConditionConfig> parts = config.conditions();
        assertEquals(3, parts.size());
        assertEquals(ConditionType.AND, parts.get(0).type());
        assertEquals(ConditionType.EQUALS, parts.get(1).type());
        assertEquals("방어", parts.get(1).value());
        assertEquals(ConditionType.EQUALS, parts.get(2).type());
        assertEquals(2, parts.get(2).value());
    }

    @Test
    @DisplayName("Map form parses numeric strings as numbers")
    void mapFormNumericString() {
        ConditionConfig config = ConditionExpressionParser.parseFieldMap(Map.of("axisCount", "3"));

        assertEquals(ConditionType.EQUALS, config.type());
        assertEquals(3.0, config.value());
    }

    @Test
    @DisplayName("Empty map is always true")
    void emptyMapIsAlwaysTrue() {
        assertEquals(ConditionType.ALWAYS_TRUE, ConditionExpressionParser.parseFieldMap(Map.of()).type());
    }
}
