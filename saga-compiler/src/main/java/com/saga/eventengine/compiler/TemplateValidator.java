/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.compiler;

import com.saga.eventengine.api.model.Choice;
import com.saga.eventengine.api.model.ConditionalChoice;
import com.saga.eventengine.api.model.DynamicField;
import com.saga.eventengine.api.model.MergeStrategy;
import com.saga.eventengine.api.model.Template;
import com.saga.eventengine.api.model.TemplateComposition;
import com.saga.eventengine.api.model.ValidationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural validation of a single template, before any reference is resolved.
 * Never throws; every problem found is reported.
 */
public class TemplateValidator {

    public ValidationResult validate(Template template) {
        if (template == null) {
            return ValidationResult.invalid(null, List.of("Template must be an object"));
        }

        List<String> errors = new ArrayList<>();

        if (isBlank(template.title())) {
            errors.add("Template must have title");
        }
        if (isBlank(template.narrative())) {
            errors.add("Template must have narrative");
        }
        if (template.choices().isEmpty()) {
            errors.add("Template must have choices");
        }
        for (int i = 0; i < template.choices().size(); i++) {
            Choice choice = template.choices().get(i);
            if (choice == null || isBlank(choice.text())) {
                errors.add("Choice " + i + " must have text");
            }
        }

        int choiceCount = template.choices().size();

        if (template.conditionalChoices() != null) {
            for (int i = 0; i < template.conditionalChoices().size(); i++) {
                ConditionalChoice cc = template.conditionalChoices().get(i);
                if (cc.choiceIndex() < 0 || cc.choiceIndex() >= choiceCount) {
                    errors.add("Conditional choice " + i + " references invalid choice index " + cc.choiceIndex());
                }
                if (cc.conditions().isEmpty()) {
                    errors.add("Conditional choice " + i + " must have at least one condition");
                }
            }
        }

        if (template.dynamicFields() != null) {
            for (int i = 0; i < template.dynamicFields().size(); i++) {
                validateDynamicField(i, template.dynamicFields().get(i), choiceCount, errors);
            }
        }

        if (template.composition() != null) {
            for (int i = 0; i < template.composition().size(); i++) {
                TemplateComposition entry = template.composition().get(i);
                if (isBlank(entry.templateId())) {
                    errors.add("Composition " + i + " must specify template_id");
                }
                if (entry.mergeStrategy() != null && MergeStrategy.parse(entry.mergeStrategy()).isEmpty()) {
                    errors.add("Composition " + i + " has invalid merge_strategy '" + entry.mergeStrategy() + "'");
                }
            }
        }

        return ValidationResult.of(template.id(), errors);
    }

    private static void validateDynamicField(int i, DynamicField field, int choiceCount, List<String> errors) {
        if (field.field() == null || !DynamicField.TARGETS.contains(field.field())) {
            errors.add("Dynamic field " + i + " has invalid field type '" + field.field() + "'");
        }
        if (DynamicField.CHOICE_TEXT.equals(field.field())) {
            if (field.choiceIndex() == null) {
                errors.add("Dynamic field " + i + " with field 'choice_text' must specify choice_index");
            } else if (field.choiceIndex() < 0 || field.choiceIndex() >= choiceCount) {
                errors.add("Dynamic field " + i + " references invalid choice index " + field.choiceIndex());
            }
        }
        if (field.conditions().isEmpty()) {
            errors.add("Dynamic field " + i + " must have at least one condition");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
