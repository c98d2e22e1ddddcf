/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.runtime.rules;

/**
 * @param totalRules     rules currently registered
 * @param enabledRules   rules that take part in {@link RuleEngine#processEvent}
 * @param conditionTypes condition types the evaluator supports
 * @param effectTypes    built-in plus custom effect types
 */
public record RuleEngineStats(int totalRules, int enabledRules, int conditionTypes, int effectTypes) {
}
