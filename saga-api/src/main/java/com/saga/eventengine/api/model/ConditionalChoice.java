/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Visibility rule for the choice at {@code choiceIndex}.
 *
 * @param choiceIndex index into the resolved choice list
 * @param conditions  conditions evaluated with AND semantics
 * @param showWhen    true: show when the conditions hold; false: show when they do not
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConditionalChoice(
        @JsonProperty("choice_index") int choiceIndex,
        @JsonProperty("conditions") List<Condition> conditions,
        @JsonProperty("show_when") Boolean showWhen
) {

    public ConditionalChoice {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        if (showWhen == null) showWhen = true;
    }

    public static ConditionalChoice showWhen(int choiceIndex, Condition... conditions) {
        return new ConditionalChoice(choiceIndex, List.of(conditions), true);
    }

    public static ConditionalChoice hideWhen(int choiceIndex, Condition... conditions) {
        return new ConditionalChoice(choiceIndex, List.of(conditions), false);
    }
}
