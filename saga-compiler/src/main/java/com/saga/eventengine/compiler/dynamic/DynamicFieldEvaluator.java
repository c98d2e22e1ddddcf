/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.compiler.dynamic;

import com.saga.eventengine.api.model.Choice;
import com.saga.eventengine.api.model.DynamicField;
import com.saga.eventengine.api.model.GenerationContext;
import com.saga.eventengine.api.model.Template;
import com.saga.eventengine.runtime.condition.ConditionEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Rewrites title, narrative or a choice's text from context-dependent alternatives.
 *
 * <p>An empty selected value leaves the field unchanged. {@code choice_text} with a
 * missing or out-of-range index is a no-op; unknown targets are logged and skipped.
 */
public class DynamicFieldEvaluator {

    private static final Logger logger = Logger.getLogger(DynamicFieldEvaluator.class.getName());

    private final ConditionEvaluator conditionEvaluator;

    public DynamicFieldEvaluator(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    public Template apply(Template template, GenerationContext context) {
        if (template.dynamicFields() == null || template.dynamicFields().isEmpty()) {
            return template;
        }

        String title = template.title();
        String narrative = template.narrative();
        List<Choice> choices = new ArrayList<>(template.choices());

        for (DynamicField field : template.dynamicFields()) {
            boolean met = conditionEvaluator.evaluateAll(field.conditions(), context);
            String value = met ? field.valueIfTrue() : field.valueIfFalse();
            if (value == null || value.isEmpty()) {
                continue;
            }

            String target = field.field() == null ? "" : field.field();
            switch (target) {
                case DynamicField.TITLE -> title = value;
                case DynamicField.NARRATIVE -> narrative = value;
                case DynamicField.CHOICE_TEXT -> {
                    Integer index = field.choiceIndex();
                    if (index != null && index >= 0 && index < choices.size()) {
                        choices.set(index, choices.get(index).withText(value));
                    }
                }
                default -> logger.warning(String.format("Unknown dynamic field target '%s' in template '%s'",
                        field.field(), template.id()));
            }
        }

        return template.toBuilder()
                .title(title)
                .narrative(narrative)
                .choices(choices)
                .build();
    }
}
