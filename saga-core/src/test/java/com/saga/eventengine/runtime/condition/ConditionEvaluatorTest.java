package com.saga.eventengine.runtime.condition;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.saga.eventengine.api.model.Condition;
import com.saga.eventengine.api.model.GenerationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class ConditionEvaluatorTest {

    private ConditionEvaluator evaluator;
    private GenerationContext context;

    @BeforeEach
    void setUp() {
        evaluator = new ConditionEvaluator(new Random(7));
        context = GenerationContext.builder()
                .level(5)
                .gold(120)
                .career("merchant")
                .environment("rain", "winter", "harbor")
                .relationship("elder", 30)
                .item("rope")
                .quest("lost_ring")
                .tag("night")
                .customCondition("isRich", (value, ctx) -> ctx.number("gold") >= ((Number) value).doubleValue())
                .build();
    }

    @Nested
    @DisplayName("stat_requirement")
    class StatRequirement {

        @Test
        @DisplayName("Should compare stats with every numeric operator")
        void shouldCompareWithOperators() {
            assertThat(evaluator.evaluate(Condition.stat("level", "gte", 5), context)).isTrue();
            assertThat(evaluator.evaluate(Condition.stat("level", "gt", 5), context)).isFalse();
            assertThat(evaluator.evaluate(Condition.stat("level", "lte", 5), context)).isTrue();
            assertThat(evaluator.evaluate(Condition.stat("level", "lt", 5), context)).isFalse();
            assertThat(evaluator.evaluate(Condition.stat("level", "eq", 5), context)).isTrue();
            assertThat(evaluator.evaluate(Condition.stat("level", "neq", 5), context)).isFalse();
        }

        @Test
        @DisplayName("Missing stats read as zero")
        void missingStatIsZero() {
            assertThat(evaluator.evaluate(Condition.stat("charisma", "eq", 0), context)).isTrue();
            assertThat(evaluator.evaluate(Condition.stat("charisma", "gte", 1), context)).isFalse();
        }

        @Test
        @DisplayName("Should resolve dot-paths")
        void shouldResolveDotPaths() {
            assertThat(evaluator.evaluate(Condition.stat("relationships.elder", "gt", 20), context)).isTrue();
        }

        @Test
        @DisplayName("Should default to gte and accept rule-style stat/min params")
        void shouldAcceptRuleStyleParams() {
            Condition condition = Condition.of(Condition.STAT_REQUIREMENT, Map.of("stat", "gold", "min", 100));
            assertThat(evaluator.evaluate(condition, context)).isTrue();
        }

        @Test
        @DisplayName("Should compare string stats for equality")
        void shouldCompareStrings() {
            assertThat(evaluator.evaluate(Condition.stat("career", "eq", "merchant"), context)).isTrue();
            assertThat(evaluator.evaluate(Condition.stat("career", "neq", "merchant"), context)).isFalse();
        }

        @Test
        @DisplayName("AND of two mutually exclusive comparisons is false")
        void mutuallyExclusiveAndIsFalse() {
            List<Condition> exclusive = List.of(
                    Condition.stat("level", "gte", 5),
                    Condition.stat("level", "lt", 5));

            assertThat(evaluator.evaluateAll(exclusive, context)).isFalse();
            assertThat(evaluator.evaluate(Condition.and(exclusive.toArray(new Condition[0])), context)).isFalse();
        }
    }

    @Nested
    @DisplayName("membership and relationship types")
    class MembershipTypes {

        @Test
        void itemRequirement() {
            assertThat(evaluator.evaluate(Condition.item("has", "rope"), context)).isTrue();
            assertThat(evaluator.evaluate(Condition.item("not_has", "rope"), context)).isFalse();
            assertThat(evaluator.evaluate(Condition.item("has", "sword"), context)).isFalse();
        }

        @Test
        void questRequirement() {
            assertThat(evaluator.evaluate(Condition.quest("has", "lost_ring"), context)).isTrue();
            assertThat(evaluator.evaluate(Condition.quest("not_has", "dragon"), context)).isTrue();
        }

        @Test
        @DisplayName("Relationship thresholds treat unknown NPCs as zero")
        void relationshipRequirement() {
            assertThat(evaluator.evaluate(Condition.relationship("elder", "gte", 30), context)).isTrue();
            assertThat(evaluator.evaluate(Condition.relationship("stranger", "lt", 1), context)).isTrue();
            assertThat(evaluator.evaluate(
                    Condition.of(Condition.RELATIONSHIP_REQUIREMENT, Map.of("npc", "elder", "min", 50)), context))
                    .isFalse();
        }
    }

    @Nested
    @DisplayName("composite and custom types")
    class CompositeTypes {

        @Test
        @DisplayName("Empty AND is true, empty OR is false")
        void emptyComposites() {
            assertThat(evaluator.evaluate(Condition.and(), context)).isTrue();
            assertThat(evaluator.evaluate(Condition.or(), context)).isFalse();
            assertThat(evaluator.evaluateAll(null, context)).isTrue();
        }

        @Test
        @DisplayName("Composite children may be given under params")
        void childrenUnderParams() throws Exception {
            // Given
            ObjectMapper mapper = new ObjectMapper();
            Condition andInParams = mapper.readValue("""
                    {"type": "and", "params": {"conditions": [
                        {"type": "stat_greater_than", "params": {"stat": "level", "value": 50}}
                    ]}}
                    """, Condition.class);
            Condition notInParams = mapper.readValue("""
                    {"type": "not", "params": {"condition": {"type": "has_tag", "params": {"tag": "night"}}}}
                    """, Condition.class);

            // When / Then
            assertThat(andInParams.children()).hasSize(1);
            assertThat(evaluator.evaluate(andInParams, context)).isFalse();
            assertThat(evaluator.evaluate(notInParams, context)).isFalse();
        }

        @Test
        @DisplayName("Unreadable params children never match")
        void unreadableParamsChild() {
            Condition or = Condition.of(Condition.OR, Map.of("conditions", List.of("level > 1")));

            assertThat(or.children()).extracting(Condition::type).containsExactly((String) null);
            assertThat(evaluator.evaluate(or, context)).isFalse();
        }

        @Test
        @DisplayName("NOT negates the AND of its children")
        void notNegatesConjunction() {
            Condition high = Condition.stat("level", "gte", 5);
            Condition rich = Condition.stat("gold", "gte", 1000);

            assertThat(evaluator.evaluate(Condition.not(high, rich), context)).isTrue();
            assertThat(evaluator.evaluate(Condition.not(high), context)).isFalse();
        }

        @Test
        void nestedOr() {
            Condition condition = Condition.or(
                    Condition.stat("level", "gte", 50),
                    Condition.and(Condition.item("has", "rope"), Condition.quest("has", "lost_ring")));

            assertThat(evaluator.evaluate(condition, context)).isTrue();
        }

        @Test
        @DisplayName("Negate inverts the handler result")
        void negateInverts() {
            assertThat(evaluator.evaluate(Condition.item("has", "rope").negated(), context)).isFalse();
        }

        @Test
        @DisplayName("Custom predicates come from the context; missing ones are false")
        void customPredicates() {
            assertThat(evaluator.evaluate(Condition.custom("isRich", 100), context)).isTrue();
            assertThat(evaluator.evaluate(Condition.custom("isRich", 500), context)).isFalse();
            assertThat(evaluator.evaluate(Condition.custom("unknown", 1), context)).isFalse();
        }
    }

    @Nested
    @DisplayName("rule-style types")
    class RuleStyleTypes {

        @Test
        void statComparisons() {
            assertThat(evaluator.evaluate(
                    Condition.of("stat_greater_than", Map.of("stat", "gold", "value", 100)), context)).isTrue();
            assertThat(evaluator.evaluate(
                    Condition.of("stat_less_than", Map.of("stat", "gold", "value", 100)), context)).isFalse();
            assertThat(evaluator.evaluate(
                    Condition.of("stat_equals", Map.of("stat", "level", "value", 5.0)), context)).isTrue();
        }

        @Test
        @DisplayName("stat_greater_than requires a numeric stat")
        void greaterThanRequiresNumber() {
            assertThat(evaluator.evaluate(
                    Condition.of("stat_greater_than", Map.of("stat", "career", "value", 0)), context)).isFalse();
        }

        @Test
        void environmentAndIdentity() {
            assertThat(evaluator.evaluate(Condition.of("season_is", Map.of("season", "winter")), context)).isTrue();
            assertThat(evaluator.evaluate(Condition.of("weather_is", Map.of("weather", "clear")), context)).isFalse();
            assertThat(evaluator.evaluate(Condition.of("career_is", Map.of("career", "merchant")), context)).isTrue();
            assertThat(evaluator.evaluate(Condition.of("has_tag", Map.of("tag", "night")), context)).isTrue();
        }

        @Test
        @DisplayName("season_is falls back to a top-level stat")
        void seasonFallsBackToStat() {
            GenerationContext flat = GenerationContext.builder().stat("season", "autumn").build();
            assertThat(evaluator.evaluate(Condition.of("season_is", Map.of("season", "autumn")), flat)).isTrue();
        }

        @Test
        @DisplayName("random_chance honours the probability bounds")
        void randomChance() {
            assertThat(evaluator.evaluate(Condition.of("random_chance", Map.of("probability", 1.0)), context)).isTrue();
            assertThat(evaluator.evaluate(Condition.of("random_chance", Map.of("probability", 0.0)), context)).isFalse();
        }
    }

    @Nested
    @DisplayName("failure handling")
    class FailureHandling {

        @Test
        @DisplayName("Unknown types evaluate to false, even when negated")
        void unknownTypeIsFalse() {
            Condition unknown = Condition.of("moon_phase", Map.of());
            assertThat(evaluator.evaluate(unknown, context)).isFalse();
            assertThat(evaluator.evaluate(unknown.negated(), context)).isFalse();
        }

        @Test
        @DisplayName("Handler exceptions are contained")
        void handlerExceptionIsFalse() {
            evaluator.register("explode", (c, ctx, ev) -> {
                throw new IllegalStateException("boom");
            });

            assertThatCode(() -> evaluator.evaluate(Condition.of("explode", Map.of()), context))
                    .doesNotThrowAnyException();
            assertThat(evaluator.evaluate(Condition.of("explode", Map.of()), context)).isFalse();
        }

        @Test
        @DisplayName("Unsupported operators evaluate to false")
        void unsupportedOperator() {
            assertThat(evaluator.evaluate(Condition.stat("level", "between", 5), context)).isFalse();
        }

        @Test
        @DisplayName("Null context is treated as empty")
        void nullContext() {
            assertThat(evaluator.evaluate(Condition.stat("level", "eq", 0), null)).isTrue();
        }

        @Test
        @DisplayName("Custom handlers can be registered")
        void customHandler() {
            evaluator.register("is_night", (c, ctx, ev) -> ctx.tags().contains("night"));

            assertThat(evaluator.supports("is_night")).isTrue();
            assertThat(evaluator.evaluate(Condition.of("is_night", Map.of()), context)).isTrue();
        }
    }
}
