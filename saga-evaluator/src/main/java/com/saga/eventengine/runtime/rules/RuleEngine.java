/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.runtime.rules;

import com.saga.eventengine.api.IRuleEngine;
import com.saga.eventengine.api.model.Choice;
import com.saga.eventengine.api.model.Event;
import com.saga.eventengine.api.model.GenerationContext;
import com.saga.eventengine.api.model.RuleDefinition;
import com.saga.eventengine.api.model.RuleEffects;
import com.saga.eventengine.api.model.ValidationResult;
import com.saga.eventengine.runtime.condition.ConditionEvaluator;
import com.saga.eventengine.runtime.condition.ConditionHandler;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Post-processes generated events with conditional rules.
 *
 * <p>Enabled rules whose conditions all hold are applied in descending priority,
 * ties in insertion order. Each rule's effects are applied in place in a fixed order:
 * <ol>
 *   <li>{@code addTags}</li>
 *   <li>{@code modifyTitle}, {@code modifyDescription} (append, then prepend, then replace)</li>
 *   <li>{@code adjustEffects} (only stats a choice already has)</li>
 *   <li>{@code modifyChoices}</li>
 *   <li>{@code modifyDifficulty}, {@code setUrgency}</li>
 *   <li>{@code addContext}</li>
 *   <li>custom effects, through registered {@link EffectApplicator}s</li>
 * </ol>
 * Later rules see the results of earlier ones. An unknown custom effect type is logged
 * and skipped, and an effect that fails is logged without stopping the remaining
 * effects or rules. Null stat deltas and factors are ignored.
 */
public class RuleEngine implements IRuleEngine {

    private static final Logger logger = Logger.getLogger(RuleEngine.class.getName());

    private static final List<String> BUILT_IN_EFFECTS = List.of(
            RuleEffects.ADD_TAGS, RuleEffects.MODIFY_TITLE, RuleEffects.MODIFY_DESCRIPTION,
            RuleEffects.ADJUST_EFFECTS, RuleEffects.MODIFY_CHOICES, RuleEffects.MODIFY_DIFFICULTY,
            RuleEffects.SET_URGENCY, RuleEffects.ADD_CONTEXT);

    private final Map<String, RuleDefinition> rules = new LinkedHashMap<>();
    private final Map<String, EffectApplicator> effectApplicators = new ConcurrentHashMap<>();
    private final ConditionEvaluator conditionEvaluator;
    private final RuleValidator validator;
    private final Tracer tracer;

    public RuleEngine() {
        this(new ConditionEvaluator(), OpenTelemetry.noop().getTracer(RuleEngine.class.getName()));
    }

    public RuleEngine(ConditionEvaluator conditionEvaluator, Tracer tracer) {
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator, "conditionEvaluator");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.validator = new RuleValidator(conditionEvaluator);
    }

    // ========================================================================
    // RULE MANAGEMENT
    // ========================================================================

    @Override
    public synchronized void addRule(String name, RuleDefinition rule) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rule, "rule");
        rules.put(name, rule);
    }

    @Override
    public synchronized boolean registerRule(String name, RuleDefinition rule) {
        Objects.requireNonNull(name, "name");
        if (rules.containsKey(name)) {
            logger.warning(String.format("Rule '%s' is already registered", name));
            return false;
        }
        ValidationResult validation = validator.validate(rule);
        if (!validation.isValid()) {
            logger.warning(String.format("Rule '%s' rejected: %s", name, validation.errors()));
            return false;
        }
        rules.put(name, rule);
        return true;
    }

    @Override
    public synchronized boolean removeRule(String name) {
        return rules.remove(name) != null;
    }

    @Override
    public synchronized Optional<RuleDefinition> getRule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    @Override
    public synchronized Map<String, RuleDefinition> getRules() {
        return new LinkedHashMap<>(rules);
    }

    @Override
    public synchronized int getRuleCount() {
        return rules.size();
    }

    @Override
    public synchronized void clearRules() {
        rules.clear();
    }

    @Override
    public ValidationResult validateRule(RuleDefinition rule) {
        return validator.validate(rule);
    }

    /**
     * Register or replace a condition type, usable by rules and by templates sharing
     * this engine's evaluator.
     */
    public void addConditionEvaluator(String type, ConditionHandler handler) {
        conditionEvaluator.register(type, handler);
    }

    /**
     * Register or replace a custom effect type.
     */
    public void addEffectApplicator(String type, EffectApplicator applicator) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(applicator, "applicator");
        if (BUILT_IN_EFFECTS.contains(type)) {
            throw new IllegalArgumentException("Cannot replace built-in effect: " + type);
        }
        effectApplicators.put(type, applicator);
    }

    public RuleEngineStats getStats() {
        List<RuleDefinition> snapshot = snapshot();
        int enabled = (int) snapshot.stream().filter(RuleDefinition::enabled).count();
        return new RuleEngineStats(snapshot.size(), enabled, conditionEvaluator.supportedTypes().size(),
                BUILT_IN_EFFECTS.size() + effectApplicators.size());
    }

    // ========================================================================
    // EVALUATION
    // ========================================================================

    /**
     * A rule without a conditions list never matches; an empty list always does.
     */
    @Override
    public boolean evaluateRule(RuleDefinition rule, GenerationContext context) {
        if (rule == null || !rule.enabled() || rule.conditions() == null) {
            return false;
        }
        return conditionEvaluator.evaluateAll(rule.conditions(), context);
    }

    @Override
    public Event processEvent(Event event, GenerationContext context) {
        Objects.requireNonNull(event, "event");
        GenerationContext ctx = context != null ? context : GenerationContext.empty();

        Span span = tracer.spanBuilder("process-event").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("eventId", String.valueOf(event.getId()));

            int applied = 0;
            for (RuleDefinition rule : byPriority()) {
                if (!evaluateRule(rule, ctx)) {
                    continue;
                }
                applyEffects(event, rule, ctx);
                applied++;
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine(String.format("Applied rule '%s' (priority %d) to event %s",
                            rule.name(), rule.priority(), event.getId()));
                }
            }

            span.setAttribute("rulesApplied", applied);
            return event;
        } finally {
            span.end();
        }
    }

    private synchronized List<RuleDefinition> snapshot() {
        return new ArrayList<>(rules.values());
    }

    private List<RuleDefinition> byPriority() {
        return snapshot().stream()
                .sorted(Comparator.comparingInt((RuleDefinition rule) -> rule.priority()).reversed())
                .collect(Collectors.toList());
    }

    // ========================================================================
    // EFFECTS
    // ========================================================================

    private void applyEffects(Event event, RuleDefinition rule, GenerationContext context) {
        RuleEffects effects = rule.effects();
        if (effects == null) {
            return;
        }

        if (effects.getAddTags() != null) {
            applyStep(rule, RuleEffects.ADD_TAGS, () -> {
                List<String> tags = new ArrayList<>(event.getTags());
                effects.getAddTags().stream().filter(Objects::nonNull).forEach(tags::add);
                event.setTags(tags);
            });
        }
        if (effects.getModifyTitle() != null) {
            applyStep(rule, RuleEffects.MODIFY_TITLE,
                    () -> event.setTitle(effects.getModifyTitle().apply(event.getTitle())));
        }
        if (effects.getModifyDescription() != null) {
            applyStep(rule, RuleEffects.MODIFY_DESCRIPTION,
                    () -> event.setDescription(effects.getModifyDescription().apply(event.getDescription())));
        }
        if (effects.getAdjustEffects() != null) {
            Map<String, Double> deltas = effects.getAdjustEffects();
            applyStep(rule, RuleEffects.ADJUST_EFFECTS,
                    () -> mapChoiceEffects(event, effect -> adjustExisting(effect, deltas)));
        }
        if (effects.getModifyChoices() != null) {
            applyStep(rule, RuleEffects.MODIFY_CHOICES,
                    () -> mapChoiceEffects(event, effects.getModifyChoices()::apply));
        }
        if (effects.getModifyDifficulty() != null) {
            event.setDifficulty(effects.getModifyDifficulty());
        }
        if (effects.getSetUrgency() != null) {
            event.setUrgency(effects.getSetUrgency());
        }
        if (effects.getAddContext() != null) {
            applyStep(rule, RuleEffects.ADD_CONTEXT, () -> {
                Map<String, Object> merged = new LinkedHashMap<>(event.getContext());
                merged.putAll(effects.getAddContext());
                event.setContext(merged);
            });
        }

        effects.getCustom().forEach((type, params) -> applyCustom(event, rule, type, params, context));
    }

    /**
     * Runs one built-in effect. A failure is logged and leaves the event as the
     * earlier effects left it.
     */
    private static void applyStep(RuleDefinition rule, String type, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, String.format("Effect '%s' of rule '%s' failed", type, rule.name()), e);
        }
    }

    private void applyCustom(Event event, RuleDefinition rule, String type, Object params,
                             GenerationContext context) {
        EffectApplicator applicator = effectApplicators.get(type);
        if (applicator == null) {
            logger.warning(String.format("Unknown effect type '%s' in rule '%s'", type, rule.name()));
            return;
        }
        try {
            applicator.apply(event, params, context);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, String.format("Effect '%s' of rule '%s' failed", type, rule.name()), e);
        }
    }

    private static void mapChoiceEffects(Event event, UnaryOperator<Map<String, Double>> change) {
        List<Choice> updated = new ArrayList<>(event.getChoices().size());
        for (Choice choice : event.getChoices()) {
            updated.add(choice.withEffect(change.apply(choice.effect())));
        }
        event.setChoices(updated);
    }

    private static Map<String, Double> adjustExisting(Map<String, Double> effect, Map<String, Double> deltas) {
        Map<String, Double> result = new LinkedHashMap<>(effect);
        deltas.forEach((stat, delta) -> {
            if (delta != null) {
                result.computeIfPresent(stat, (key, current) -> current + delta);
            }
        });
        return result;
    }
}
