/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON representation of a post-processing rule.
 *
 * <p>{@code conditions} is ANDed; composite nodes inside it define their own logic.
 * A null {@code conditions} list is kept as null so validation can report it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleDefinition(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("conditions") List<Condition> conditions,
        @JsonProperty("effects") RuleEffects effects,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("enabled") Boolean enabled
) {

    public RuleDefinition {
        conditions = conditions == null ? null : List.copyOf(conditions);
    }

    public static RuleDefinition of(String name, List<Condition> conditions, RuleEffects effects, int priority) {
        return new RuleDefinition(name, name, null, conditions, effects, priority, true);
    }

    // Default values for optional fields

    public Integer priority() {
        return priority != null ? priority : 0;
    }

    public Boolean enabled() {
        return enabled != null ? enabled : true;
    }

    public RuleDefinition withEnabled(boolean value) {
        return new RuleDefinition(id, name, description, conditions, effects, priority, value);
    }

    public RuleDefinition withId(String newId) {
        return new RuleDefinition(newId, name != null ? name : newId, description, conditions, effects,
                priority, enabled);
    }
}
