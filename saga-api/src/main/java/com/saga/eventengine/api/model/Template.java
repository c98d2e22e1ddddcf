/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON representation of an event template.
 *
 * <p>List-valued fields that only accumulate ({@code tags}, {@code choices},
 * {@code extends}, {@code mixins}) are never null. Fields that follow
 * "child if present, else parent" semantics during resolution
 * ({@code conditions}, {@code conditional_choices}, {@code dynamic_fields},
 * {@code composition}) stay null when absent.
 *
 * <p>{@code extends} accepts a single id or a list of ids.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Template(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("narrative") String narrative,
        @JsonProperty("type") String type,
        @JsonProperty("difficulty") String difficulty,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("choices") List<Choice> choices,
        @JsonProperty("conditions") List<Condition> conditions,
        @JsonProperty("conditional_choices") List<ConditionalChoice> conditionalChoices,
        @JsonProperty("dynamic_fields") List<DynamicField> dynamicFields,
        @JsonProperty("composition") List<TemplateComposition> composition,
        @JsonProperty("extends")
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> parents,
        @JsonProperty("mixins") List<String> mixins
) {

    public Template {
        tags = tags == null ? List.of() : List.copyOf(tags);
        choices = choices == null ? List.of() : List.copyOf(choices);
        parents = parents == null ? List.of() : List.copyOf(parents);
        mixins = mixins == null ? List.of() : List.copyOf(mixins);
        conditions = conditions == null ? null : List.copyOf(conditions);
        conditionalChoices = conditionalChoices == null ? null : List.copyOf(conditionalChoices);
        dynamicFields = dynamicFields == null ? null : List.copyOf(dynamicFields);
        composition = composition == null ? null : List.copyOf(composition);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(String id) {
        return new Builder().id(id);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .narrative(narrative)
                .type(type)
                .difficulty(difficulty)
                .tags(tags)
                .choices(choices)
                .conditions(conditions)
                .conditionalChoices(conditionalChoices)
                .dynamicFields(dynamicFields)
                .composition(composition)
                .parents(parents)
                .mixins(mixins);
    }

    public Template withId(String newId) {
        return toBuilder().id(newId).build();
    }

    /**
     * Ids this template refers to through {@code extends}, {@code mixins} or {@code composition}.
     */
    public List<String> referencedIds() {
        List<String> refs = new ArrayList<>(parents);
        refs.addAll(mixins);
        if (composition != null) {
            for (TemplateComposition entry : composition) {
                if (entry.templateId() != null) {
                    refs.add(entry.templateId());
                }
            }
        }
        return refs;
    }

    public static final class Builder {
        private String id;
        private String title;
        private String narrative;
        private String type;
        private String difficulty;
        private List<String> tags = new ArrayList<>();
        private List<Choice> choices = new ArrayList<>();
        private List<Condition> conditions;
        private List<ConditionalChoice> conditionalChoices;
        private List<DynamicField> dynamicFields;
        private List<TemplateComposition> composition;
        private List<String> parents = new ArrayList<>();
        private List<String> mixins = new ArrayList<>();

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder narrative(String narrative) {
            this.narrative = narrative;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder difficulty(String difficulty) {
            this.difficulty = difficulty;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
            return this;
        }

        public Builder tags(String... tags) {
            return tags(List.of(tags));
        }

        public Builder choices(List<Choice> choices) {
            this.choices = choices == null ? new ArrayList<>() : new ArrayList<>(choices);
            return this;
        }

        public Builder choice(Choice choice) {
            this.choices.add(choice);
            return this;
        }

        public Builder choice(String text) {
            return choice(Choice.of(text));
        }

        public Builder conditions(List<Condition> conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder conditionalChoices(List<ConditionalChoice> conditionalChoices) {
            this.conditionalChoices = conditionalChoices;
            return this;
        }

        public Builder dynamicFields(List<DynamicField> dynamicFields) {
            this.dynamicFields = dynamicFields;
            return this;
        }

        public Builder composition(List<TemplateComposition> composition) {
            this.composition = composition;
            return this;
        }

        public Builder parents(List<String> parents) {
            this.parents = parents == null ? new ArrayList<>() : new ArrayList<>(parents);
            return this;
        }

        public Builder extendsFrom(String... parentIds) {
            return parents(List.of(parentIds));
        }

        public Builder mixins(List<String> mixins) {
            this.mixins = mixins == null ? new ArrayList<>() : new ArrayList<>(mixins);
            return this;
        }

        public Builder mixins(String... mixinIds) {
            return mixins(List.of(mixinIds));
        }

        public Template build() {
            return new Template(id, title, narrative, type, difficulty, tags, choices, conditions,
                    conditionalChoices, dynamicFields, composition, parents, mixins);
        }
    }
}
