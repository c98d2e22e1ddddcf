/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A selectable option of an event.
 *
 * <p>Choices are immutable; the text is the identity used when mixins
 * de-duplicate choice lists. Effect values are additive stat deltas.
 *
 * @param text         label shown to the player
 * @param effect       stat name to numeric delta (never null)
 * @param consequence  optional consequence tag
 * @param requirements optional stat minimums (never null)
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Choice(
        @JsonProperty("text") String text,
        @JsonProperty("effect") Map<String, Double> effect,
        @JsonProperty("consequence") String consequence,
        @JsonProperty("requirements") Map<String, Double> requirements
) {

    public Choice {
        effect = effect == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(effect));
        requirements = requirements == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(requirements));
    }

    public static Choice of(String text) {
        return new Choice(text, null, null, null);
    }

    public static Choice of(String text, Map<String, Double> effect) {
        return new Choice(text, effect, null, null);
    }

    public Choice withText(String newText) {
        return new Choice(newText, effect, consequence, requirements);
    }

    public Choice withEffect(Map<String, Double> newEffect) {
        return new Choice(text, newEffect, consequence, requirements);
    }
}
