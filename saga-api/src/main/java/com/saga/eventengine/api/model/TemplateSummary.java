/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Listing metadata for a stored template.
 */
public record TemplateSummary(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("type") String type,
        @JsonProperty("difficulty") String difficulty,
        @JsonProperty("tags") List<String> tags
) {

    public static TemplateSummary of(Template template) {
        return new TemplateSummary(template.id(), template.title(), template.type(), template.difficulty(),
                template.tags());
    }
}
