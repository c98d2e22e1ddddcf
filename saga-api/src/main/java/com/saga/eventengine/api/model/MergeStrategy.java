/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * How a composition component is merged into the accumulated template.
 */
public enum MergeStrategy {
    /** Component choices and tags go after the accumulated ones. */
    APPEND,
    /** Component choices and tags go before the accumulated ones. */
    PREPEND,
    /** Fields present on the component replace the accumulated ones. */
    REPLACE,
    /** Shallow overwrite from the component, with choices and tags concatenated. */
    MERGE;

    public static final MergeStrategy DEFAULT = MERGE;

    public static Optional<MergeStrategy> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(text.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
