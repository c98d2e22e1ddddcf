/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api;

import com.saga.eventengine.api.model.Event;
import com.saga.eventengine.api.model.GenerationContext;
import com.saga.eventengine.api.model.RuleDefinition;
import com.saga.eventengine.api.model.ValidationResult;

import java.util.Map;
import java.util.Optional;

/**
 * Contract for post-processing generated events with conditional rules.
 *
 * <p>Rules are keyed by name. Enabled rules whose conditions hold are applied in
 * descending priority; ties keep insertion order.
 */
public interface IRuleEngine {

    /**
     * Add or replace a rule without validation.
     */
    void addRule(String name, RuleDefinition rule);

    /**
     * Add a rule after validation.
     *
     * @return false if the rule is invalid or the name is taken
     */
    boolean registerRule(String name, RuleDefinition rule);

    boolean removeRule(String name);

    Optional<RuleDefinition> getRule(String name);

    /**
     * Snapshot of all rules in insertion order.
     */
    Map<String, RuleDefinition> getRules();

    int getRuleCount();

    void clearRules();

    /**
     * Validate a rule. Never throws.
     */
    ValidationResult validateRule(RuleDefinition rule);

    /**
     * Whether the rule is enabled and its conditions hold for the context.
     */
    boolean evaluateRule(RuleDefinition rule, GenerationContext context);

    /**
     * Apply every matching rule to the event in place.
     *
     * @return the same event instance
     */
    Event processEvent(Event event, GenerationContext context);
}
