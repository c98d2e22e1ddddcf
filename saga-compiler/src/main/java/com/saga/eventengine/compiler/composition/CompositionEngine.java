/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.compiler.composition;

import com.saga.eventengine.api.model.GenerationContext;
import com.saga.eventengine.api.model.Template;
import com.saga.eventengine.api.model.TemplateComposition;
import com.saga.eventengine.compiler.TemplateLookup;
import com.saga.eventengine.compiler.resolution.TemplateMerger;
import com.saga.eventengine.runtime.condition.ConditionEvaluator;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Applies a template's ordered composition list.
 *
 * <p>Entries run in ascending priority (stable for ties). An entry whose conditions do
 * not hold is skipped; a missing component is logged and skipped. Components are merged
 * as stored, without resolving their own inheritance.
 */
public class CompositionEngine {

    private static final Logger logger = Logger.getLogger(CompositionEngine.class.getName());

    private final TemplateLookup lookup;
    private final ConditionEvaluator conditionEvaluator;

    public CompositionEngine(TemplateLookup lookup, ConditionEvaluator conditionEvaluator) {
        this.lookup = lookup;
        this.conditionEvaluator = conditionEvaluator;
    }

    public Template compose(Template template, GenerationContext context, String templateKey) {
        if (template.composition() == null || template.composition().isEmpty()) {
            return template;
        }

        List<TemplateComposition> ordered = template.composition().stream()
                .sorted(Comparator.comparingInt(TemplateComposition::priority))
                .collect(Collectors.toList());

        Template composed = template;
        for (TemplateComposition entry : ordered) {
            if (!conditionEvaluator.evaluateAll(entry.conditions(), context)) {
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine("Composition entry '" + entry.templateId() + "' gated off for " + template.id());
                }
                continue;
            }
            Optional<TemplateLookup.ResolvedTemplate> component = lookup.resolve(entry.templateId(), templateKey);
            if (component.isEmpty()) {
                logger.warning(String.format("Composition component '%s' of template '%s' not found, skipping",
                        entry.templateId(), template.id()));
                continue;
            }
            composed = TemplateMerger.compose(composed, component.get().template(), entry.strategy());
        }
        return composed;
    }
}
