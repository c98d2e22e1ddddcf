/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single condition node, shared by template gating, conditional choices,
 * dynamic fields, composition entries and rules.
 *
 * <p>Template-style atomic conditions use {@code field}, {@code operator} and
 * {@code value}; rule-style ones carry their arguments in {@code params}.
 * Composite nodes ({@code and}, {@code or}, {@code not}) hold their children in
 * {@code conditions}, or rule-style in {@code params.conditions} (a single child
 * may be given as {@code params.condition}).
 *
 * <pre>{@code
 * {"type": "stat_requirement", "field": "level", "operator": "gte", "value": 5}
 * {"type": "season_is", "params": {"season": "winter"}}
 * {"type": "or", "conditions": [ ... ]}
 * {"type": "not", "params": {"condition": { ... }}}
 * }</pre>
 *
 * @param type       condition type tag used for handler dispatch
 * @param operator   comparison operator for atomic types (may be null)
 * @param field      context field, dot-path, relationship id or custom predicate name
 * @param value      expected value
 * @param negate     inverts the result of the node
 * @param params     free-form arguments for rule-style types (never null)
 * @param conditions children of composite nodes (never null)
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Condition(
        @JsonProperty("type") String type,
        @JsonProperty("operator") String operator,
        @JsonProperty("field") String field,
        @JsonProperty("value") Object value,
        @JsonProperty("negate") boolean negate,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("conditions") List<Condition> conditions
) {

    public static final String STAT_REQUIREMENT = "stat_requirement";
    public static final String ITEM_REQUIREMENT = "item_requirement";
    public static final String RELATIONSHIP_REQUIREMENT = "relationship_requirement";
    public static final String QUEST_REQUIREMENT = "quest_requirement";
    public static final String CUSTOM = "custom";
    public static final String AND = "and";
    public static final String OR = "or";
    public static final String NOT = "not";

    private static final ObjectMapper PARAM_MAPPER = new ObjectMapper();

    public Condition {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static Condition stat(String field, String operator, Object value) {
        return new Condition(STAT_REQUIREMENT, operator, field, value, false, null, null);
    }

    public static Condition item(String operator, String item) {
        return new Condition(ITEM_REQUIREMENT, operator, null, item, false, null, null);
    }

    public static Condition relationship(String npc, String operator, Object value) {
        return new Condition(RELATIONSHIP_REQUIREMENT, operator, npc, value, false, null, null);
    }

    public static Condition quest(String operator, String quest) {
        return new Condition(QUEST_REQUIREMENT, operator, null, quest, false, null, null);
    }

    public static Condition custom(String predicateName, Object value) {
        return new Condition(CUSTOM, null, predicateName, value, false, null, null);
    }

    public static Condition and(Condition... children) {
        return new Condition(AND, null, null, null, false, null, Arrays.asList(children));
    }

    public static Condition or(Condition... children) {
        return new Condition(OR, null, null, null, false, null, Arrays.asList(children));
    }

    public static Condition not(Condition... children) {
        return new Condition(NOT, null, null, null, false, null, Arrays.asList(children));
    }

    /**
     * Rule-style condition with named parameters, e.g. {@code of("season_is", Map.of("season", "winter"))}.
     */
    public static Condition of(String type, Map<String, Object> params) {
        return new Condition(type, null, null, null, false, params, null);
    }

    /**
     * Returns a copy of this condition with the negate flag set.
     */
    public Condition negated() {
        return new Condition(type, operator, field, value, true, params, conditions);
    }

    /**
     * Returns a named parameter, falling back to the top-level field of the same name.
     */
    public Object param(String name) {
        Object fromParams = params.get(name);
        if (fromParams != null) {
            return fromParams;
        }
        return switch (name) {
            case "field" -> field;
            case "operator" -> operator;
            case "value" -> value;
            default -> null;
        };
    }

    /**
     * Children of a composite node: {@code conditions} when present, otherwise
     * {@code params.conditions} or {@code params.condition}. A child that cannot be
     * read as a condition is returned as an untyped node, which never matches.
     */
    @JsonIgnore
    public List<Condition> children() {
        if (!conditions.isEmpty()) {
            return conditions;
        }
        Object nested = params.get("conditions");
        if (nested == null) {
            nested = params.get("condition");
        }
        if (nested == null) {
            return List.of();
        }
        Collection<?> raw = nested instanceof Collection<?> many ? many : List.of(nested);
        List<Condition> children = new ArrayList<>(raw.size());
        for (Object child : raw) {
            children.add(toCondition(child));
        }
        return Collections.unmodifiableList(children);
    }

    private static Condition toCondition(Object raw) {
        if (raw instanceof Condition condition) {
            return condition;
        }
        if (raw instanceof Map<?, ?>) {
            try {
                return PARAM_MAPPER.convertValue(raw, Condition.class);
            } catch (IllegalArgumentException e) {
                return new Condition(null, null, null, raw, false, null, null);
            }
        }
        return new Condition(null, null, null, raw, false, null, null);
    }

    @JsonIgnore
    public boolean isComposite() {
        return AND.equals(type) || OR.equals(type) || NOT.equals(type);
    }
}
