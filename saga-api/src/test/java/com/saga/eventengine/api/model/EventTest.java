package com.saga.eventengine.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class EventTest {

    @Test
    @DisplayName("withId should produce an independent deep copy")
    void withIdShouldDeepCopy() {
        // Given
        Event original = new Event("e1", "Title", "Desc", List.of(Choice.of("Go", Map.of("gold", 1.0))));
        original.setTags(List.of("a"));
        original.setContext(Map.of("environment", Map.of("season", "winter")));

        // When
        Event copy = original.withId("e2");
        copy.getTags().add("b");
        copy.getChoices().add(Choice.of("Stay"));
        copy.getContext().put("level", 1);

        // Then
        assertThat(copy.getId()).isEqualTo("e2");
        assertThat(original.getId()).isEqualTo("e1");
        assertThat(original.getTags()).containsExactly("a");
        assertThat(original.getChoices()).hasSize(1);
        assertThat(original.getContext()).containsOnlyKeys("environment");
        assertThat(copy.getType()).isEqualTo(Event.DEFAULT_TYPE);
    }

    @Test
    @DisplayName("Text modifications apply append, then prepend, then replace")
    void textModificationOrder() {
        assertThat(new RuleEffects.TextModification(" end", "start ", null).apply("mid"))
                .isEqualTo("start mid end");
        assertThat(new RuleEffects.TextModification(" end", "start ", "fixed").apply("mid"))
                .isEqualTo("fixed");
    }

    @Test
    @DisplayName("Operators should parse wire names and legacy aliases")
    void operatorParsing() {
        assertThat(ComparisonOperator.fromString("gte")).isEqualTo(ComparisonOperator.GTE);
        assertThat(ComparisonOperator.fromString("NOT_HAS")).isEqualTo(ComparisonOperator.NOT_HAS);
        assertThat(ComparisonOperator.fromString("ne")).isEqualTo(ComparisonOperator.NEQ);
        assertThat(ComparisonOperator.fromString("between")).isNull();
        assertThat(ComparisonOperator.LT.compare(1, 2)).isTrue();
        assertThat(ComparisonOperator.HAS.compare(1, 1)).isFalse();
    }
}
