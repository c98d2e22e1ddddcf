/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Effects a rule applies to an event.
 *
 * <p>Keys other than the built-in ones are kept as custom effects and dispatched to
 * applicators registered under the same name. A nested {@code custom} object is
 * flattened into the same table.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RuleEffects {

    public static final String ADD_TAGS = "addTags";
    public static final String MODIFY_TITLE = "modifyTitle";
    public static final String MODIFY_DESCRIPTION = "modifyDescription";
    public static final String ADJUST_EFFECTS = "adjustEffects";
    public static final String MODIFY_CHOICES = "modifyChoices";
    public static final String MODIFY_DIFFICULTY = "modifyDifficulty";
    public static final String SET_URGENCY = "setUrgency";
    public static final String ADD_CONTEXT = "addContext";

    /**
     * Text edit applied append first, then prepend, then replace.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TextModification(
            @JsonProperty("append") String append,
            @JsonProperty("prepend") String prepend,
            @JsonProperty("replace") String replace
    ) {
        public String apply(String original) {
            String result = original == null ? "" : original;
            if (append != null) result = result + append;
            if (prepend != null) result = prepend + result;
            if (replace != null) result = replace;
            return result;
        }
    }

    /**
     * Per-stat edits to every choice's effect map. Multipliers apply only to
     * existing non-zero values and round to the nearest integer; additions
     * create missing keys from 0. Null factors and deltas are ignored.
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ChoiceModification(
            @JsonProperty("multiply") Map<String, Double> multiply,
            @JsonProperty("add") Map<String, Double> add
    ) {
        public ChoiceModification {
            multiply = multiply == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(multiply));
            add = add == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(add));
        }

        public Map<String, Double> apply(Map<String, Double> effect) {
            Map<String, Double> result = new LinkedHashMap<>(effect);
            multiply.forEach((stat, factor) -> {
                Double current = result.get(stat);
                if (factor != null && current != null && current != 0) {
                    result.put(stat, (double) Math.round(current * factor));
                }
            });
            add.forEach((stat, delta) -> {
                if (delta != null) {
                    result.merge(stat, delta, Double::sum);
                }
            });
            return result;
        }
    }

    @JsonProperty(ADD_TAGS)
    private List<String> addTags;
    @JsonProperty(MODIFY_TITLE)
    private TextModification modifyTitle;
    @JsonProperty(MODIFY_DESCRIPTION)
    private TextModification modifyDescription;
    @JsonProperty(ADJUST_EFFECTS)
    private Map<String, Double> adjustEffects;
    @JsonProperty(MODIFY_CHOICES)
    private ChoiceModification modifyChoices;
    @JsonProperty(MODIFY_DIFFICULTY)
    private String modifyDifficulty;
    @JsonProperty(SET_URGENCY)
    private String setUrgency;
    @JsonProperty(ADD_CONTEXT)
    private Map<String, Object> addContext;

    @JsonIgnore
    private final Map<String, Object> custom = new LinkedHashMap<>();

    public RuleEffects() {
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getAddTags() {
        return addTags;
    }

    public TextModification getModifyTitle() {
        return modifyTitle;
    }

    public TextModification getModifyDescription() {
        return modifyDescription;
    }

    public Map<String, Double> getAdjustEffects() {
        return adjustEffects;
    }

    public ChoiceModification getModifyChoices() {
        return modifyChoices;
    }

    public String getModifyDifficulty() {
        return modifyDifficulty;
    }

    public String getSetUrgency() {
        return setUrgency;
    }

    public Map<String, Object> getAddContext() {
        return addContext;
    }

    @JsonAnyGetter
    public Map<String, Object> getCustom() {
        return Collections.unmodifiableMap(custom);
    }

    @JsonAnySetter
    @SuppressWarnings("unchecked")
    public void putCustom(String key, Object value) {
        if ("custom".equals(key) && value instanceof Map<?, ?> nested) {
            ((Map<String, Object>) nested).forEach(custom::put);
        } else {
            custom.put(key, value);
        }
    }

    @JsonIgnore
    public boolean isEmpty() {
        return addTags == null && modifyTitle == null && modifyDescription == null
                && adjustEffects == null && modifyChoices == null && modifyDifficulty == null
                && setUrgency == null && addContext == null && custom.isEmpty();
    }

    public static final class Builder {
        private final RuleEffects effects = new RuleEffects();

        private Builder() {
        }

        public Builder addTags(String... tags) {
            effects.addTags = new ArrayList<>(List.of(tags));
            return this;
        }

        public Builder modifyTitle(String append, String prepend, String replace) {
            effects.modifyTitle = new TextModification(append, prepend, replace);
            return this;
        }

        public Builder modifyDescription(String append, String prepend, String replace) {
            effects.modifyDescription = new TextModification(append, prepend, replace);
            return this;
        }

        public Builder adjustEffect(String stat, double delta) {
            if (effects.adjustEffects == null) {
                effects.adjustEffects = new LinkedHashMap<>();
            }
            effects.adjustEffects.put(stat, delta);
            return this;
        }

        public Builder modifyChoices(Map<String, Double> multiply, Map<String, Double> add) {
            effects.modifyChoices = new ChoiceModification(multiply, add);
            return this;
        }

        public Builder modifyDifficulty(String difficulty) {
            effects.modifyDifficulty = difficulty;
            return this;
        }

        public Builder setUrgency(String urgency) {
            effects.setUrgency = urgency;
            return this;
        }

        public Builder addContext(String key, Object value) {
            if (effects.addContext == null) {
                effects.addContext = new LinkedHashMap<>();
            }
            effects.addContext.put(key, value);
            return this;
        }

        public Builder custom(String type, Object value) {
            effects.custom.put(type, value);
            return this;
        }

        public RuleEffects build() {
            return effects;
        }
    }
}
