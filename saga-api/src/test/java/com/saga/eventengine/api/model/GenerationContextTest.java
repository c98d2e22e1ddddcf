package com.saga.eventengine.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class GenerationContextTest {

    @Test
    @DisplayName("Should resolve dot-paths across stats, environment and relationships")
    void shouldResolveDotPaths() {
        GenerationContext context = GenerationContext.builder()
                .level(7)
                .season("winter")
                .relationship("elder", 40)
                .stat("guild", Map.of("rank", 3))
                .build();

        assertThat(context.lookup("level")).isEqualTo(7);
        assertThat(context.lookup("environment.season")).isEqualTo("winter");
        assertThat(context.lookup("environment.weather")).isNull();
        assertThat(context.lookup("relationships.elder")).isEqualTo(40.0);
        assertThat(context.lookup("guild.rank")).isEqualTo(3);
        assertThat(context.lookup("missing.path")).isNull();
        assertThat(context.number("missing")).isZero();
        assertThat(context.relationship("stranger")).isZero();
    }

    @Test
    @DisplayName("Should build typed sections from a plain map")
    void shouldBuildFromMap() {
        GenerationContext context = GenerationContext.fromMap(Map.of(
                "level", 3,
                "career", "merchant",
                "environment", Map.of("weather", "rain"),
                "relationships", Map.of("smith", 12),
                "inventory", List.of("rope"),
                "quests", List.of("q1"),
                "tags", List.of("night")));

        assertThat(context.number("level")).isEqualTo(3.0);
        assertThat(context.stat("career")).isEqualTo("merchant");
        assertThat(context.environment().weather()).isEqualTo("rain");
        assertThat(context.relationship("smith")).isEqualTo(12.0);
        assertThat(context.inventory()).containsExactly("rope");
        assertThat(context.quests()).containsExactly("q1");
        assertThat(context.tags()).containsExactly("night");
    }

    @Test
    @DisplayName("Snapshot should omit empty sections and custom predicates")
    void snapshotShouldOmitEmptySections() {
        GenerationContext context = GenerationContext.builder()
                .gold(10)
                .customCondition("always", (value, ctx) -> true)
                .build();

        assertThat(context.toSnapshot()).containsOnlyKeys("gold");
        assertThat(GenerationContext.empty().toSnapshot()).isEmpty();
    }
}
