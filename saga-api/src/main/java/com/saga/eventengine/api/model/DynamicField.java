/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * A template field whose value is chosen from the context when the template is processed.
 *
 * @param field        target: {@value #TITLE}, {@value #NARRATIVE} or {@value #CHOICE_TEXT}
 * @param choiceIndex  choice to rewrite when the target is {@value #CHOICE_TEXT}
 * @param conditions   conditions evaluated with AND semantics
 * @param valueIfTrue  value used when the conditions hold
 * @param valueIfFalse value used otherwise; empty or null keeps the current value
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DynamicField(
        @JsonProperty("field") String field,
        @JsonProperty("choice_index") Integer choiceIndex,
        @JsonProperty("conditions") List<Condition> conditions,
        @JsonProperty("value_if_true") String valueIfTrue,
        @JsonProperty("value_if_false") String valueIfFalse
) {

    public static final String TITLE = "title";
    public static final String NARRATIVE = "narrative";
    public static final String CHOICE_TEXT = "choice_text";

    public static final Set<String> TARGETS = Set.of(TITLE, NARRATIVE, CHOICE_TEXT);

    public DynamicField {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
}
