/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.runtime.condition;

import com.saga.eventengine.api.model.Condition;
import com.saga.eventengine.api.model.GenerationContext;

/**
 * Evaluates one condition type. Registered with {@link ConditionEvaluator} under its type tag.
 *
 * <p>Handlers do not apply {@link Condition#negate()}; the evaluator does. Composite
 * handlers recurse through the {@code evaluator} argument.
 */
@FunctionalInterface
public interface ConditionHandler {

    boolean evaluate(Condition condition, GenerationContext context, ConditionEvaluator evaluator);
}
