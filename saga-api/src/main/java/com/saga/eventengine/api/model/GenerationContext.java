/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied state that templates and rules are evaluated against.
 *
 * <p>Stats form an open map ({@code level}, {@code gold}, {@code career}, ...).
 * Environment, relationships, inventory, quests and tags are first-class.
 * {@link #lookup(String)} resolves dot-paths such as {@code environment.season}
 * or {@code relationships.elder} across all of them.
 *
 * <p>Instances are immutable and safe to share between generation calls.
 */
public final class GenerationContext {

    public static final String ENVIRONMENT = "environment";
    public static final String RELATIONSHIPS = "relationships";
    public static final String INVENTORY = "inventory";
    public static final String QUESTS = "quests";
    public static final String TAGS = "tags";

    private static final GenerationContext EMPTY = builder().build();

    private final Map<String, Object> stats;
    private final Environment environment;
    private final Map<String, Double> relationships;
    private final List<String> inventory;
    private final List<String> quests;
    private final List<String> tags;
    private final Map<String, CustomCondition> customConditions;

    /**
     * Weather, season and location; any of them may be null.
     */
    public record Environment(
            @JsonProperty("weather") String weather,
            @JsonProperty("season") String season,
            @JsonProperty("location") String location
    ) {
        public static final Environment NONE = new Environment(null, null, null);

        Object get(String key) {
            return switch (key) {
                case "weather" -> weather;
                case "season" -> season;
                case "location" -> location;
                default -> null;
            };
        }

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            if (weather != null) map.put("weather", weather);
            if (season != null) map.put("season", season);
            if (location != null) map.put("location", location);
            return map;
        }
    }

    private GenerationContext(Builder builder) {
        this.stats = Collections.unmodifiableMap(new LinkedHashMap<>(builder.stats));
        this.environment = builder.environment;
        this.relationships = Collections.unmodifiableMap(new LinkedHashMap<>(builder.relationships));
        this.inventory = List.copyOf(builder.inventory);
        this.quests = List.copyOf(builder.quests);
        this.tags = List.copyOf(builder.tags);
        this.customConditions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.customConditions));
    }

    public static GenerationContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a context from a plain map, e.g. one read from JSON.
     * Known keys populate the typed sections; every other key becomes a stat.
     */
    @SuppressWarnings("unchecked")
    public static GenerationContext fromMap(Map<String, ?> source) {
        Builder builder = builder();
        if (source == null) {
            return builder.build();
        }
        source.forEach((key, value) -> {
            switch (key) {
                case ENVIRONMENT -> {
                    if (value instanceof Map<?, ?> env) {
                        builder.environment(asString(env.get("weather")), asString(env.get("season")),
                                asString(env.get("location")));
                    }
                }
                case RELATIONSHIPS -> {
                    if (value instanceof Map<?, ?> rels) {
                        rels.forEach((npc, level) -> {
                            if (level instanceof Number n) {
                                builder.relationship(String.valueOf(npc), n.doubleValue());
                            }
                        });
                    }
                }
                case INVENTORY -> builder.inventory(asStringList(value));
                case QUESTS -> builder.quests(asStringList(value));
                case TAGS -> builder.tags(asStringList(value));
                default -> builder.stat(key, value);
            }
        });
        return builder.build();
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static List<String> asStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Iterable<?> iterable) {
            for (Object item : iterable) {
                if (item != null) result.add(String.valueOf(item));
            }
        }
        return result;
    }

    // ========================================================================
    // LOOKUP
    // ========================================================================

    /**
     * Resolves a dot-path against this context.
     *
     * @param path e.g. {@code level}, {@code environment.season}, {@code relationships.elder}
     * @return the value, or null when any segment is missing
     */
    public Object lookup(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        String[] segments = path.split("\\.");
        Object current = root(segments[0]);
        for (int i = 1; i < segments.length && current != null; i++) {
            if (current instanceof Environment env) {
                current = env.get(segments[i]);
            } else if (current instanceof Map<?, ?> map) {
                current = map.get(segments[i]);
            } else {
                return null;
            }
        }
        return current;
    }

    private Object root(String key) {
        return switch (key) {
            case ENVIRONMENT -> environment;
            case RELATIONSHIPS -> relationships;
            case INVENTORY -> inventory;
            case QUESTS -> quests;
            case TAGS -> tags;
            default -> stats.get(key);
        };
    }

    /**
     * Numeric value at {@code path}; missing or non-numeric values read as 0.
     */
    public double number(String path) {
        Object value = lookup(path);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    public double relationship(String npc) {
        Double level = relationships.get(npc);
        return level != null ? level : 0;
    }

    /**
     * Plain-map view used as the event's context snapshot. Custom predicates are not included.
     */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>(stats);
        Map<String, Object> env = environment.toMap();
        if (!env.isEmpty()) snapshot.put(ENVIRONMENT, env);
        if (!relationships.isEmpty()) snapshot.put(RELATIONSHIPS, new LinkedHashMap<>(relationships));
        if (!inventory.isEmpty()) snapshot.put(INVENTORY, new ArrayList<>(inventory));
        if (!quests.isEmpty()) snapshot.put(QUESTS, new ArrayList<>(quests));
        if (!tags.isEmpty()) snapshot.put(TAGS, new ArrayList<>(tags));
        return snapshot;
    }

    public Builder toBuilder() {
        Builder builder = builder();
        builder.stats.putAll(stats);
        builder.environment = environment;
        builder.relationships.putAll(relationships);
        builder.inventory.addAll(inventory);
        builder.quests.addAll(quests);
        builder.tags.addAll(tags);
        builder.customConditions.putAll(customConditions);
        return builder;
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    public Map<String, Object> stats() {
        return stats;
    }

    public Object stat(String name) {
        return stats.get(name);
    }

    public Environment environment() {
        return environment;
    }

    public Map<String, Double> relationships() {
        return relationships;
    }

    public List<String> inventory() {
        return inventory;
    }

    public List<String> quests() {
        return quests;
    }

    public List<String> tags() {
        return tags;
    }

    public CustomCondition customCondition(String name) {
        return customConditions.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GenerationContext other)) return false;
        return stats.equals(other.stats)
                && environment.equals(other.environment)
                && relationships.equals(other.relationships)
                && inventory.equals(other.inventory)
                && quests.equals(other.quests)
                && tags.equals(other.tags)
                && customConditions.equals(other.customConditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stats, environment, relationships, inventory, quests, tags, customConditions);
    }

    @Override
    public String toString() {
        return "GenerationContext" + toSnapshot();
    }

    public static final class Builder {
        private final Map<String, Object> stats = new LinkedHashMap<>();
        private Environment environment = Environment.NONE;
        private final Map<String, Double> relationships = new LinkedHashMap<>();
        private final List<String> inventory = new ArrayList<>();
        private final List<String> quests = new ArrayList<>();
        private final List<String> tags = new ArrayList<>();
        private final Map<String, CustomCondition> customConditions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder stat(String name, Object value) {
            Objects.requireNonNull(name, "stat name");
            if (value == null) {
                stats.remove(name);
            } else {
                stats.put(name, value);
            }
            return this;
        }

        public Builder stats(Map<String, ?> values) {
            values.forEach(this::stat);
            return this;
        }

        public Builder level(int level) {
            return stat("level", level);
        }

        public Builder reputation(int reputation) {
            return stat("reputation", reputation);
        }

        public Builder gold(int gold) {
            return stat("gold", gold);
        }

        public Builder career(String career) {
            return stat("career", career);
        }

        public Builder environment(String weather, String season, String location) {
            this.environment = new Environment(weather, season, location);
            return this;
        }

        public Builder weather(String weather) {
            return environment(weather, environment.season(), environment.location());
        }

        public Builder season(String season) {
            return environment(environment.weather(), season, environment.location());
        }

        public Builder location(String location) {
            return environment(environment.weather(), environment.season(), location);
        }

        public Builder relationship(String npc, double level) {
            relationships.put(npc, level);
            return this;
        }

        public Builder inventory(List<String> items) {
            inventory.addAll(items);
            return this;
        }

        public Builder item(String item) {
            inventory.add(item);
            return this;
        }

        public Builder quests(List<String> questIds) {
            quests.addAll(questIds);
            return this;
        }

        public Builder quest(String quest) {
            quests.add(quest);
            return this;
        }

        public Builder tags(List<String> values) {
            tags.addAll(values);
            return this;
        }

        public Builder tag(String tag) {
            tags.add(tag);
            return this;
        }

        public Builder customCondition(String name, CustomCondition predicate) {
            customConditions.put(name, predicate);
            return this;
        }

        public GenerationContext build() {
            return new GenerationContext(this);
        }
    }
}
