/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.runtime;

import com.saga.eventengine.api.model.Event;
import com.saga.eventengine.api.model.GenerationContext;
import com.saga.eventengine.infra.config.EngineConfig;
import com.saga.eventengine.runtime.condition.ConditionEvaluator;
import com.saga.eventengine.runtime.generation.TemplateEngine;
import com.saga.eventengine.runtime.rules.RuleEngine;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import java.util.Objects;
import java.util.Optional;

/**
 * Generation followed by rule processing.
 *
 * <p>Both engines share one {@link ConditionEvaluator}, so a condition type added with
 * {@link RuleEngine#addConditionEvaluator} is also usable in template conditions.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * EventGenerator generator = new EventGenerator(EngineConfig.defaults());
 * generator.templates().registerTemplate("ambush", template);
 * generator.rules().addRule("vip", vipRule);
 *
 * Optional<Event> event = generator.generate("ambush", context);
 * }</pre>
 */
public class EventGenerator {

    private final TemplateEngine templates;
    private final RuleEngine rules;

    public EventGenerator() {
        this(EngineConfig.defaults());
    }

    public EventGenerator(EngineConfig config) {
        this(config, OpenTelemetry.noop().getTracer(EventGenerator.class.getName()));
    }

    public EventGenerator(EngineConfig config, Tracer tracer) {
        ConditionEvaluator conditionEvaluator = new ConditionEvaluator(config.newRandom());
        this.templates = TemplateEngine.builder()
                .config(config)
                .conditionEvaluator(conditionEvaluator)
                .tracer(tracer)
                .build();
        this.rules = new RuleEngine(conditionEvaluator, tracer);
    }

    public EventGenerator(TemplateEngine templates, RuleEngine rules) {
        this.templates = Objects.requireNonNull(templates, "templates");
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    /**
     * @return empty only when no template is known under the id
     */
    public Optional<Event> generate(String templateId, GenerationContext context) {
        return templates.generateFromTemplate(templateId, context)
                .map(event -> rules.processEvent(event, context));
    }

    public Optional<Event> generateFromGenre(String genre, GenerationContext context) {
        return templates.generateFromGenre(genre, context)
                .map(event -> rules.processEvent(event, context));
    }

    public TemplateEngine templates() {
        return templates;
    }

    public RuleEngine rules() {
        return rules;
    }
}
