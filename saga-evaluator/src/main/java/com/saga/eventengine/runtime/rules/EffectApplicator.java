/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.runtime.rules;

import com.saga.eventengine.api.model.Event;
import com.saga.eventengine.api.model.GenerationContext;

/**
 * Applies one custom rule effect to an event in place.
 *
 * <p>{@code params} is the raw value found under the effect's type in
 * {@link com.saga.eventengine.api.model.RuleEffects#getCustom()}.
 */
@FunctionalInterface
public interface EffectApplicator {

    void apply(Event event, Object params, GenerationContext context);
}
