/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.runtime.choice;

import com.saga.eventengine.api.model.Choice;
import com.saga.eventengine.api.model.ConditionalChoice;
import com.saga.eventengine.api.model.GenerationContext;
import com.saga.eventengine.api.model.Template;
import com.saga.eventengine.runtime.condition.ConditionEvaluator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Selects the choices shown for one generation.
 *
 * <p>Runs on every generation and is never cached. For each choice index, the first
 * {@link ConditionalChoice} naming it decides visibility: with {@code show_when=true}
 * the choice is shown when its conditions hold, with {@code false} when they do not.
 * Choices without an entry are always shown. When nothing remains, a single
 * {@link #FALLBACK_TEXT} choice with no effect is returned.
 */
public class ChoiceFilter {

    public static final String FALLBACK_TEXT = "Continue…";

    private final ConditionEvaluator conditionEvaluator;

    public ChoiceFilter(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    public List<Choice> filter(Template template, GenerationContext context) {
        List<Choice> choices = template.choices();
        Map<Integer, ConditionalChoice> entries = firstEntryPerIndex(template.conditionalChoices());

        List<Choice> visible = new ArrayList<>(choices.size());
        for (int i = 0; i < choices.size(); i++) {
            ConditionalChoice entry = entries.get(i);
            if (entry == null || isShown(entry, context)) {
                visible.add(choices.get(i));
            }
        }

        if (visible.isEmpty()) {
            visible.add(fallback());
        }
        return visible;
    }

    public static Choice fallback() {
        return Choice.of(FALLBACK_TEXT);
    }

    private boolean isShown(ConditionalChoice entry, GenerationContext context) {
        boolean met = conditionEvaluator.evaluateAll(entry.conditions(), context);
        return entry.showWhen() == met;
    }

    private static Map<Integer, ConditionalChoice> firstEntryPerIndex(List<ConditionalChoice> entries) {
        if (entries == null || entries.isEmpty()) {
            return Map.of();
        }
        Map<Integer, ConditionalChoice> byIndex = new HashMap<>();
        for (ConditionalChoice entry : entries) {
            byIndex.putIfAbsent(entry.choiceIndex(), entry);
        }
        return byIndex;
    }
}
