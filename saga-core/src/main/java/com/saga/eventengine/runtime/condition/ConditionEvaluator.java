/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.runtime.condition;

import com.saga.eventengine.api.model.ComparisonOperator;
import com.saga.eventengine.api.model.Condition;
import com.saga.eventengine.api.model.CustomCondition;
import com.saga.eventengine.api.model.GenerationContext;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluates {@link Condition} trees against a {@link GenerationContext}.
 *
 * <p>Dispatch is a type-tag to {@link ConditionHandler} table. Evaluation never throws:
 * <ul>
 *   <li>unknown types log a warning and evaluate to false</li>
 *   <li>handler failures are logged and evaluate to false</li>
 *   <li>{@code negate} inverts any other result</li>
 * </ul>
 *
 * <p>All built-in handlers are pure except {@code random_chance}, which draws from the
 * {@link Random} passed at construction.
 *
 * <h2>Built-in types</h2>
 * <pre>
 * stat_requirement          field/stat, operator (default gte), value/min (default 0); missing stat = 0
 * item_requirement          has | not_has on inventory
 * relationship_requirement  field/npc, operator (default gte), value/min; missing relationship = 0
 * quest_requirement         has | not_has on quests
 * custom                    named predicate from the context; missing = false
 * and / or / not            over nested conditions; not negates the AND of its children
 * stat_greater_than         params: stat, value (stat must be numeric)
 * stat_less_than            params: stat, value (stat must be numeric)
 * stat_equals               params: stat, value
 * has_tag                   params: tag
 * career_is                 params: career
 * season_is / weather_is    params: season / weather (environment first, then top-level stat)
 * random_chance             params: probability
 * </pre>
 */
public class ConditionEvaluator {

    private static final Logger logger = Logger.getLogger(ConditionEvaluator.class.getName());

    private final Map<String, ConditionHandler> handlers = new ConcurrentHashMap<>();
    private final Random random;

    public ConditionEvaluator() {
        this(new Random());
    }

    public ConditionEvaluator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
        registerBuiltIns();
    }

    // ========================================================================
    // PUBLIC API
    // ========================================================================

    /**
     * Register or replace the handler for a condition type.
     */
    public void register(String type, ConditionHandler handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        if (handlers.put(type, handler) != null) {
            logger.fine("Replaced condition handler: " + type);
        }
    }

    public boolean supports(String type) {
        return type != null && handlers.containsKey(type);
    }

    public Set<String> supportedTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }

    /**
     * Evaluate a single condition. Never throws.
     */
    public boolean evaluate(Condition condition, GenerationContext context) {
        if (condition == null) {
            logger.warning("Null condition evaluated as false");
            return false;
        }
        GenerationContext ctx = context != null ? context : GenerationContext.empty();

        ConditionHandler handler = condition.type() != null ? handlers.get(condition.type()) : null;
        if (handler == null) {
            logger.warning("Unknown condition type: " + condition.type());
            return false;
        }

        boolean result;
        try {
            result = handler.evaluate(condition, ctx, this);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error evaluating condition " + condition.type(), e);
            return false;
        }
        return condition.negate() != result;
    }

    /**
     * AND over the list; true when the list is null or empty.
     */
    public boolean evaluateAll(List<Condition> conditions, GenerationContext context) {
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        for (Condition condition : conditions) {
            if (!evaluate(condition, context)) {
                return false;
            }
        }
        return true;
    }

    /**
     * OR over the list; false when the list is null or empty.
     */
    public boolean evaluateAny(List<Condition> conditions, GenerationContext context) {
        if (conditions == null) {
            return false;
        }
        for (Condition condition : conditions) {
            if (evaluate(condition, context)) {
                return true;
            }
        }
        return false;
    }

    // ========================================================================
    // BUILT-IN HANDLERS
    // ========================================================================

    private void registerBuiltIns() {
        handlers.put(Condition.STAT_REQUIREMENT, ConditionEvaluator::statRequirement);
        handlers.put(Condition.ITEM_REQUIREMENT, (c, ctx, ev) -> membership(c, ctx.inventory()));
        handlers.put(Condition.RELATIONSHIP_REQUIREMENT, ConditionEvaluator::relationshipRequirement);
        handlers.put(Condition.QUEST_REQUIREMENT, (c, ctx, ev) -> membership(c, ctx.quests()));
        handlers.put(Condition.CUSTOM, ConditionEvaluator::customPredicate);

        handlers.put(Condition.AND, (c, ctx, ev) -> ev.evaluateAll(c.children(), ctx));
        handlers.put(Condition.OR, (c, ctx, ev) -> ev.evaluateAny(c.children(), ctx));
        handlers.put(Condition.NOT, (c, ctx, ev) -> !ev.evaluateAll(c.children(), ctx));

        handlers.put("stat_greater_than", (c, ctx, ev) -> numericParamCompare(c, ctx, ComparisonOperator.GT));
        handlers.put("stat_less_than", (c, ctx, ev) -> numericParamCompare(c, ctx, ComparisonOperator.LT));
        handlers.put("stat_equals", (c, ctx, ev) ->
                valuesEqual(ctx.lookup(asString(c.param("stat"))), c.param("value")));
        handlers.put("has_tag", (c, ctx, ev) -> ctx.tags().contains(asString(c.param("tag"))));
        handlers.put("career_is", (c, ctx, ev) ->
                valuesEqual(ctx.stat("career"), c.param("career")));
        handlers.put("season_is", (c, ctx, ev) ->
                valuesEqual(environmentValue(ctx, "season"), c.param("season")));
        handlers.put("weather_is", (c, ctx, ev) ->
                valuesEqual(environmentValue(ctx, "weather"), c.param("weather")));
        handlers.put("random_chance", (c, ctx, ev) -> {
            Double probability = toDouble(c.param("probability"));
            return probability != null && random.nextDouble() < probability;
        });
    }

    private static boolean statRequirement(Condition condition, GenerationContext context, ConditionEvaluator ev) {
        String field = firstString(condition.field(), condition.param("stat"));
        if (field == null) {
            return false;
        }
        ComparisonOperator operator = operatorOrDefault(condition);
        Object expected = firstNonNull(condition.value(), condition.param("min"));

        Double expectedNumber = toDouble(expected == null ? 0 : expected);
        if (expectedNumber != null && operator.isNumeric()) {
            return operator.compare(context.number(field), expectedNumber);
        }
        return operator.compareObjects(context.lookup(field), expected);
    }

    private static boolean relationshipRequirement(Condition condition, GenerationContext context,
                                                   ConditionEvaluator ev) {
        String npc = firstString(condition.field(), condition.param("npc"));
        if (npc == null) {
            return false;
        }
        ComparisonOperator operator = operatorOrDefault(condition);
        Double expected = toDouble(firstNonNull(condition.value(), condition.param("min")));
        return operator.isNumeric() && operator.compare(context.relationship(npc), expected != null ? expected : 0);
    }

    private static boolean membership(Condition condition, List<String> values) {
        ComparisonOperator operator = ComparisonOperator.fromString(condition.operator());
        String item = asString(condition.value());
        if (operator == ComparisonOperator.HAS) {
            return values.contains(item);
        }
        if (operator == ComparisonOperator.NOT_HAS) {
            return !values.contains(item);
        }
        return false;
    }

    private static boolean customPredicate(Condition condition, GenerationContext context, ConditionEvaluator ev) {
        CustomCondition predicate = condition.field() != null ? context.customCondition(condition.field()) : null;
        if (predicate == null) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("No custom predicate named " + condition.field());
            }
            return false;
        }
        return predicate.test(condition.value(), context);
    }

    private static boolean numericParamCompare(Condition condition, GenerationContext context,
                                               ComparisonOperator operator) {
        Object actual = context.lookup(asString(condition.param("stat")));
        Double expected = toDouble(condition.param("value"));
        return actual instanceof Number n && expected != null && operator.compare(n.doubleValue(), expected);
    }

    private static Object environmentValue(GenerationContext context, String key) {
        Object value = context.lookup(GenerationContext.ENVIRONMENT + "." + key);
        return value != null ? value : context.stat(key);
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private static ComparisonOperator operatorOrDefault(Condition condition) {
        String raw = firstString(condition.operator(), condition.param("operator"));
        if (raw == null) {
            return ComparisonOperator.GTE;
        }
        ComparisonOperator operator = ComparisonOperator.fromString(raw);
        if (operator == null) {
            throw new IllegalArgumentException("Unsupported operator: " + raw);
        }
        return operator;
    }

    static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return a.doubleValue() == e.doubleValue();
        }
        return Objects.equals(actual, expected);
    }

    static Double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Object firstNonNull(Object first, Object second) {
        return first != null ? first : second;
    }

    private static String firstString(Object first, Object second) {
        return asString(firstNonNull(first, second));
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
