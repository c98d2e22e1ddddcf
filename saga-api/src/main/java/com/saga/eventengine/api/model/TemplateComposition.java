/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One entry of a template's ordered composition list.
 *
 * @param templateId    id of the component template
 * @param priority      application order, ascending (default 0)
 * @param conditions    gate; the entry is skipped when they do not hold
 * @param mergeStrategy raw strategy name as written in the template (see {@link #strategy()})
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TemplateComposition(
        @JsonProperty("template_id") String templateId,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("conditions") List<Condition> conditions,
        @JsonProperty("merge_strategy") String mergeStrategy
) {

    public TemplateComposition {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static TemplateComposition of(String templateId, int priority, MergeStrategy strategy) {
        return new TemplateComposition(templateId, priority, null, strategy.getValue());
    }

    public Integer priority() {
        return priority != null ? priority : 0;
    }

    /**
     * Parsed strategy; unknown or absent names fall back to {@link MergeStrategy#DEFAULT}.
     */
    @JsonIgnore
    public MergeStrategy strategy() {
        return MergeStrategy.parse(mergeStrategy).orElse(MergeStrategy.DEFAULT);
    }
}
