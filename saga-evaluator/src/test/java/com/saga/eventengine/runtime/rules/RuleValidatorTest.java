package com.saga.eventengine.runtime.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.saga.eventengine.api.model.Condition;
import com.saga.eventengine.api.model.RuleDefinition;
import com.saga.eventengine.api.model.RuleEffects;
import com.saga.eventengine.api.model.ValidationResult;
import com.saga.eventengine.runtime.condition.ConditionEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RuleValidatorTest {

    private final RuleValidator validator = new RuleValidator(new ConditionEvaluator());

    @Test
    @DisplayName("Well-formed rules are valid")
    void validRule() {
        RuleDefinition rule = RuleDefinition.of("vip",
                List.of(Condition.stat("gold", "gte", 100), Condition.or(Condition.quest("has", "guild"))),
                RuleEffects.builder().addTags("vip").build(), 1);

        ValidationResult result = validator.validate(rule);

        assertThat(result.isValid()).isTrue();
        assertThat(result.subject()).isEqualTo("vip");
    }

    @Test
    @DisplayName("Missing conditions and effects are reported")
    void missingSections() {
        ValidationResult result = validator.validate(new RuleDefinition("r", "r", null, null, null, 0, true));

        assertThat(result.errors()).containsExactly("Rule must have conditions array", "Rule must have effects object");
    }

    @Test
    @DisplayName("Condition types are checked recursively")
    void conditionTypes() {
        Condition untyped = Condition.of(null, Map.of());
        Condition nestedUnknown = Condition.and(Condition.stat("level", "gte", 1), Condition.of("teleport", Map.of()));
        RuleDefinition rule = RuleDefinition.of("r", Arrays.asList(untyped, Condition.of("warp", Map.of()), nestedUnknown),
                RuleEffects.builder().build(), 0);

        assertThat(validator.validate(rule).errors()).containsExactly(
                "Condition 0 missing type",
                "Condition 1 has unknown type: warp",
                "Condition 2.1 has unknown type: teleport");
    }

    @Test
    @DisplayName("Composite children under params are validated")
    void compositeChildrenInParams() throws Exception {
        RuleDefinition rule = new ObjectMapper().readValue("""
                {"name": "elite", "effects": {"addTags": ["elite"]}, "conditions": [
                    {"type": "and", "params": {"conditions": [
                        {"type": "stat_greater_than", "params": {"stat": "level", "value": 50}},
                        {"type": "levitate"}
                    ]}}
                ]}
                """, RuleDefinition.class);

        assertThat(validator.validate(rule).errors()).containsExactly("Condition 0.1 has unknown type: levitate");
    }

    @Test
    @DisplayName("Composite conditions without children are rejected")
    void emptyComposite() {
        RuleDefinition rule = RuleDefinition.of("r", List.of(Condition.and(), Condition.of(Condition.NOT, Map.of())),
                RuleEffects.builder().build(), 0);

        assertThat(validator.validate(rule).errors()).containsExactly(
                "Condition 0 (and) has no child conditions",
                "Condition 1 (not) has no child conditions");
    }

    @Test
    @DisplayName("Null rules are reported, not thrown")
    void nullRule() {
        assertThat(validator.validate(null).errors()).containsExactly("Rule must be an object");
    }
}
