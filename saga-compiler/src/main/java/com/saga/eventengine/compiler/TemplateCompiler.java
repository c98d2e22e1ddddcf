/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.compiler;

import com.saga.eventengine.api.ITemplateStore;
import com.saga.eventengine.api.model.GenerationContext;
import com.saga.eventengine.api.model.Template;
import com.saga.eventengine.compiler.composition.CompositionEngine;
import com.saga.eventengine.compiler.dynamic.DynamicFieldEvaluator;
import com.saga.eventengine.compiler.resolution.InheritanceResolver;
import com.saga.eventengine.runtime.condition.ConditionEvaluator;

/**
 * Turns a stored template into a processed template for one context:
 * inheritance and mixins, then composition, then dynamic fields.
 *
 * <p>The result is what the processed-template cache stores. Conditional choices are
 * not applied here since they must be evaluated on every generation.
 */
public class TemplateCompiler {

    private final TemplateLookup lookup;
    private final InheritanceResolver inheritanceResolver;
    private final CompositionEngine compositionEngine;
    private final DynamicFieldEvaluator dynamicFieldEvaluator;

    public TemplateCompiler(ITemplateStore store, ConditionEvaluator conditionEvaluator) {
        this.lookup = new TemplateLookup(store);
        this.inheritanceResolver = new InheritanceResolver(lookup);
        this.compositionEngine = new CompositionEngine(lookup, conditionEvaluator);
        this.dynamicFieldEvaluator = new DynamicFieldEvaluator(conditionEvaluator);
    }

    /**
     * @param template    the stored template
     * @param templateKey its store key
     * @param context     generation context
     */
    public Template compile(Template template, String templateKey, GenerationContext context) {
        Template resolved = inheritanceResolver.resolve(template, templateKey);
        Template composed = compositionEngine.compose(resolved, context, templateKey);
        return dynamicFieldEvaluator.apply(composed, context);
    }

    public Template resolve(Template template, String templateKey) {
        return inheritanceResolver.resolve(template, templateKey);
    }

    public TemplateLookup lookup() {
        return lookup;
    }
}
