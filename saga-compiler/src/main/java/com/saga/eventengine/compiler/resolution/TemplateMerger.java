/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.compiler.resolution;

import com.saga.eventengine.api.model.Choice;
import com.saga.eventengine.api.model.MergeStrategy;
import com.saga.eventengine.api.model.Template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Field-level merge rules shared by inheritance, mixins and composition.
 *
 * <p>A field is "present" when it is non-null; for lists, when it is non-empty.
 */
public final class TemplateMerger {

    private TemplateMerger() {
    }

    /**
     * Inheritance: derived scalars win when present, choices and tags concatenate
     * parent first (duplicates kept), gating sections use the child's when present.
     */
    public static Template inherit(Template parent, Template child) {
        return Template.builder()
                .id(pick(child.id(), parent.id()))
                .title(pick(child.title(), parent.title()))
                .narrative(pick(child.narrative(), parent.narrative()))
                .type(pick(child.type(), parent.type()))
                .difficulty(pick(child.difficulty(), parent.difficulty()))
                .choices(concat(parent.choices(), child.choices()))
                .tags(concat(parent.tags(), child.tags()))
                .conditions(pick(child.conditions(), parent.conditions()))
                .conditionalChoices(pick(child.conditionalChoices(), parent.conditionalChoices()))
                .dynamicFields(pick(child.dynamicFields(), parent.dynamicFields()))
                .composition(pick(child.composition(), parent.composition()))
                .parents(child.parents())
                .mixins(child.mixins())
                .build();
    }

    /**
     * Mixin: the mixin supplies defaults and the template wins. Choices are de-duplicated
     * by text (first occurrence wins, template choices first); tags are a set union with
     * mixin tags first. Structural references stay the template's.
     */
    public static Template applyMixin(Template template, Template mixin) {
        return Template.builder()
                .id(pick(template.id(), mixin.id()))
                .title(pick(template.title(), mixin.title()))
                .narrative(pick(template.narrative(), mixin.narrative()))
                .type(pick(template.type(), mixin.type()))
                .difficulty(pick(template.difficulty(), mixin.difficulty()))
                .choices(dedupeByText(concat(template.choices(), mixin.choices())))
                .tags(new ArrayList<>(new LinkedHashSet<>(concat(mixin.tags(), template.tags()))))
                .conditions(pick(template.conditions(), mixin.conditions()))
                .conditionalChoices(pick(template.conditionalChoices(), mixin.conditionalChoices()))
                .dynamicFields(pick(template.dynamicFields(), mixin.dynamicFields()))
                .composition(template.composition())
                .parents(template.parents())
                .mixins(template.mixins())
                .build();
    }

    /**
     * Composition: merge {@code component} into {@code template} with the given strategy.
     * The template's id, {@code extends}, {@code mixins} and {@code composition} are never overwritten.
     */
    public static Template compose(Template template, Template component, MergeStrategy strategy) {
        return switch (strategy) {
            case APPEND -> template.toBuilder()
                    .choices(concat(template.choices(), component.choices()))
                    .tags(concat(template.tags(), component.tags()))
                    .build();
            case PREPEND -> template.toBuilder()
                    .choices(concat(component.choices(), template.choices()))
                    .tags(concat(component.tags(), template.tags()))
                    .build();
            case REPLACE -> overlay(template, component);
            case MERGE -> overlay(template, component).toBuilder()
                    .choices(concat(template.choices(), component.choices()))
                    .tags(concat(template.tags(), component.tags()))
                    .build();
        };
    }

    private static Template overlay(Template base, Template top) {
        return base.toBuilder()
                .title(pick(top.title(), base.title()))
                .narrative(pick(top.narrative(), base.narrative()))
                .type(pick(top.type(), base.type()))
                .difficulty(pick(top.difficulty(), base.difficulty()))
                .choices(pick(top.choices(), base.choices()))
                .tags(pick(top.tags(), base.tags()))
                .conditions(pick(top.conditions(), base.conditions()))
                .conditionalChoices(pick(top.conditionalChoices(), base.conditionalChoices()))
                .dynamicFields(pick(top.dynamicFields(), base.dynamicFields()))
                .build();
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    static <T> List<T> pick(List<T> preferred, List<T> fallback) {
        return preferred != null && !preferred.isEmpty() ? preferred : fallback;
    }

    static <T> List<T> concat(List<T> first, List<T> second) {
        List<T> result = new ArrayList<>(first.size() + second.size());
        result.addAll(first);
        result.addAll(second);
        return result;
    }

    static List<Choice> dedupeByText(List<Choice> choices) {
        Map<String, Choice> unique = new LinkedHashMap<>();
        for (Choice choice : choices) {
            unique.putIfAbsent(choice.text(), choice);
        }
        return new ArrayList<>(unique.values());
    }
}
