/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.runtime.rules;

import com.saga.eventengine.api.model.Condition;
import com.saga.eventengine.api.model.RuleDefinition;
import com.saga.eventengine.api.model.ValidationResult;
import com.saga.eventengine.runtime.condition.ConditionEvaluator;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural validation of rule definitions. Never throws.
 *
 * <p>Condition types are checked against the evaluator's registry, so types added
 * through {@link RuleEngine#addConditionEvaluator} are accepted.
 */
public class RuleValidator {

    private final ConditionEvaluator conditionEvaluator;

    public RuleValidator(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    public ValidationResult validate(RuleDefinition rule) {
        if (rule == null) {
            return ValidationResult.invalid(null, List.of("Rule must be an object"));
        }

        List<String> errors = new ArrayList<>();

        if (rule.conditions() == null) {
            errors.add("Rule must have conditions array");
        } else {
            for (int i = 0; i < rule.conditions().size(); i++) {
                validateCondition(String.valueOf(i), rule.conditions().get(i), errors);
            }
        }

        if (rule.effects() == null) {
            errors.add("Rule must have effects object");
        }

        return ValidationResult.of(rule.id() != null ? rule.id() : rule.name(), errors);
    }

    private void validateCondition(String path, Condition condition, List<String> errors) {
        if (condition == null || condition.type() == null || condition.type().isBlank()) {
            errors.add("Condition " + path + " missing type");
            return;
        }
        if (!conditionEvaluator.supports(condition.type())) {
            errors.add("Condition " + path + " has unknown type: " + condition.type());
        }
        List<Condition> children = condition.children();
        if (condition.isComposite() && children.isEmpty()) {
            errors.add("Condition " + path + " (" + condition.type() + ") has no child conditions");
        }
        for (int i = 0; i < children.size(); i++) {
            validateCondition(path + "." + i, children.get(i), errors);
        }
    }
}
