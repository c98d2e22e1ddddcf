package com.saga.eventengine.api.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * JSON binding of templates and their nested structures.
 */
class TemplateJsonTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
    }

    @Test
    @DisplayName("Should accept a single parent id for extends")
    void shouldAcceptSingleExtends() throws Exception {
        // Given
        String json = """
                {"id": "child", "title": "T", "narrative": "N", "extends": "base",
                 "choices": [{"text": "Go", "effect": {"gold": 5}}]}
                """;

        // When
        Template template = mapper.readValue(json, Template.class);

        // Then
        assertThat(template.parents()).containsExactly("base");
        assertThat(template.choices()).extracting(Choice::text).containsExactly("Go");
        assertThat(template.choices().get(0).effect()).containsEntry("gold", 5.0);
    }

    @Test
    @DisplayName("Should accept a list of parent ids for extends")
    void shouldAcceptListExtends() throws Exception {
        String json = """
                {"id": "child", "extends": ["a", "b"], "mixins": ["m"]}
                """;

        Template template = mapper.readValue(json, Template.class);

        assertThat(template.parents()).containsExactly("a", "b");
        assertThat(template.mixins()).containsExactly("m");
    }

    @Test
    @DisplayName("Should normalize accumulating lists and keep optional sections absent")
    void shouldNormalizeDefaults() throws Exception {
        Template template = mapper.readValue("{\"id\": \"bare\"}", Template.class);

        assertThat(template.tags()).isEmpty();
        assertThat(template.choices()).isEmpty();
        assertThat(template.parents()).isEmpty();
        assertThat(template.mixins()).isEmpty();
        assertThat(template.conditions()).isNull();
        assertThat(template.conditionalChoices()).isNull();
        assertThat(template.dynamicFields()).isNull();
        assertThat(template.composition()).isNull();
    }

    @Test
    @DisplayName("Should bind conditional choices, dynamic fields and composition")
    void shouldBindNestedSections() throws Exception {
        String json = """
                {
                  "id": "rich",
                  "conditional_choices": [
                    {"choice_index": 1, "conditions": [{"type": "stat_requirement", "field": "level", "operator": "gte", "value": 5}]}
                  ],
                  "dynamic_fields": [
                    {"field": "title", "conditions": [{"type": "quest_requirement", "operator": "has", "value": "q1"}],
                     "value_if_true": "Hero", "value_if_false": ""}
                  ],
                  "composition": [
                    {"template_id": "weather", "priority": 2, "merge_strategy": "prepend"},
                    {"template_id": "loot"}
                  ]
                }
                """;

        Template template = mapper.readValue(json, Template.class);

        ConditionalChoice conditional = template.conditionalChoices().get(0);
        assertThat(conditional.choiceIndex()).isEqualTo(1);
        assertThat(conditional.showWhen()).isTrue();
        assertThat(conditional.conditions().get(0).field()).isEqualTo("level");
        assertThat(conditional.conditions().get(0).value()).isEqualTo(5);

        DynamicField dynamic = template.dynamicFields().get(0);
        assertThat(dynamic.field()).isEqualTo(DynamicField.TITLE);
        assertThat(dynamic.valueIfTrue()).isEqualTo("Hero");

        assertThat(template.composition()).extracting(TemplateComposition::strategy)
                .containsExactly(MergeStrategy.PREPEND, MergeStrategy.MERGE);
        assertThat(template.composition().get(1).priority()).isZero();
        assertThat(template.referencedIds()).containsExactly("weather", "loot");
    }

    @Test
    @DisplayName("Should bind composite and rule-style conditions")
    void shouldBindCompositeConditions() throws Exception {
        String json = """
                {"type": "or", "negate": true, "conditions": [
                  {"type": "season_is", "params": {"season": "winter"}},
                  {"type": "custom", "field": "isNight", "value": true}
                ]}
                """;

        Condition condition = mapper.readValue(json, Condition.class);

        assertThat(condition.isComposite()).isTrue();
        assertThat(condition.negate()).isTrue();
        assertThat(condition.conditions()).hasSize(2);
        assertThat(condition.conditions().get(0).param("season")).isEqualTo("winter");
        assertThat(condition.conditions().get(1).param("field")).isEqualTo("isNight");
    }

    @Test
    @DisplayName("Should keep unknown rule effect keys as custom effects")
    void shouldCaptureCustomEffects() throws Exception {
        String json = """
                {"id": "r1", "conditions": [],
                 "effects": {"addTags": ["storm"], "spawnNpc": "bandit", "custom": {"playSound": "thunder"},
                             "modifyTitle": {"append": "!"}}}
                """;

        RuleDefinition rule = mapper.readValue(json, RuleDefinition.class);

        assertThat(rule.priority()).isZero();
        assertThat(rule.enabled()).isTrue();
        assertThat(rule.effects().getAddTags()).containsExactly("storm");
        assertThat(rule.effects().getModifyTitle().apply("Storm")).isEqualTo("Storm!");
        assertThat(rule.effects().getCustom())
                .containsExactlyInAnyOrderEntriesOf(Map.of("spawnNpc", "bandit", "playSound", "thunder"));
    }

    @Test
    @DisplayName("Should write templates back with snake_case keys")
    void shouldSerializeSnakeCase() throws Exception {
        Template template = Template.builder("t")
                .title("T")
                .choice("Go")
                .conditionalChoices(List.of(ConditionalChoice.hideWhen(0, Condition.quest("has", "q"))))
                .build();

        String json = mapper.writeValueAsString(template);

        assertThat(json).contains("\"conditional_choices\"").contains("\"show_when\":false");
    }
}
