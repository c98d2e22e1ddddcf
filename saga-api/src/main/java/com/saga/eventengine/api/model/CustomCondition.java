/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

/**
 * Caller-supplied named predicate, referenced from conditions of type {@code custom}.
 */
@FunctionalInterface
public interface CustomCondition {

    /**
     * @param value   the condition's {@code value}
     * @param context the generation context
     * @return whether the predicate holds
     */
    boolean test(Object value, GenerationContext context);
}
