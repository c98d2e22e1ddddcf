/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.runtime.generation;

import com.saga.eventengine.api.ITemplateEngine;
import com.saga.eventengine.api.ITemplateStore;
import com.saga.eventengine.api.model.Choice;
import com.saga.eventengine.api.model.Event;
import com.saga.eventengine.api.model.GenerationContext;
import com.saga.eventengine.api.model.Template;
import com.saga.eventengine.api.model.TemplateQuery;
import com.saga.eventengine.api.model.TemplateSummary;
import com.saga.eventengine.api.model.ValidationResult;
import com.saga.eventengine.compiler.TemplateCompiler;
import com.saga.eventengine.compiler.TemplateLookup.ResolvedTemplate;
import com.saga.eventengine.compiler.TemplateValidator;
import com.saga.eventengine.infra.cache.TwoTierCache;
import com.saga.eventengine.infra.config.EngineConfig;
import com.saga.eventengine.infra.store.InMemoryTemplateStore;
import com.saga.eventengine.infra.store.JsonTemplateLibraryLoader;
import com.saga.eventengine.runtime.choice.ChoiceFilter;
import com.saga.eventengine.runtime.condition.ConditionEvaluator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Template registry and event generation pipeline.
 *
 * <p>Generation runs: generation cache → processed-template cache (else compile:
 * inheritance, composition, dynamic fields) → conditional choice filter → event.
 * Both caches are owned by this instance.
 *
 * <p>Templates live in one {@link ITemplateStore}: caller-registered ones under
 * {@code custom:<id>}, library templates under {@code <genre>:<id>}. An id passed to
 * {@link #generateFromTemplate} is looked up as {@code custom:<id>}, then
 * {@code <defaultLibrary>:<id>}, then as the literal key.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * TemplateEngine engine = TemplateEngine.builder()
 *         .config(EngineConfig.fromEnvironment())
 *         .defaultLibrary("fantasy")
 *         .build();
 * engine.loadTemplateLibrary(Path.of("templates/fantasy"), "fantasy");
 *
 * Optional<Event> event = engine.generateFromTemplate("ambush",
 *         GenerationContext.builder().level(5).gold(120).build());
 * }</pre>
 */
public class TemplateEngine implements ITemplateEngine {

    private static final Logger logger = Logger.getLogger(TemplateEngine.class.getName());

    private final EngineConfig config;
    private final ITemplateStore store;
    private final String defaultLibrary;
    private final ConditionEvaluator conditionEvaluator;
    private final TemplateValidator validator;
    private final TemplateCompiler compiler;
    private final ChoiceFilter choiceFilter;
    private final TwoTierCache cache;
    private final JsonTemplateLibraryLoader libraryLoader;
    private final Tracer tracer;
    private final Supplier<String> eventIds;
    private final Random random;

    public TemplateEngine() {
        this(builder());
    }

    public TemplateEngine(EngineConfig config) {
        this(builder().config(config));
    }

    private TemplateEngine(Builder builder) {
        this.config = builder.config;
        this.config.validate();
        this.store = builder.store != null ? builder.store : new InMemoryTemplateStore();
        this.defaultLibrary = builder.defaultLibrary;
        this.random = config.newRandom();
        this.conditionEvaluator = builder.conditionEvaluator != null
                ? builder.conditionEvaluator
                : new ConditionEvaluator(random);
        this.validator = new TemplateValidator();
        this.compiler = new TemplateCompiler(store, conditionEvaluator);
        this.choiceFilter = new ChoiceFilter(conditionEvaluator);
        this.cache = TwoTierCache.from(config);
        this.libraryLoader = builder.libraryLoader != null ? builder.libraryLoader : new JsonTemplateLibraryLoader();
        this.tracer = builder.tracer != null
                ? builder.tracer
                : OpenTelemetry.noop().getTracer(TemplateEngine.class.getName());
        this.eventIds = builder.eventIds != null ? builder.eventIds : TemplateEngine::nextEventId;

        logger.info(String.format("TemplateEngine initialized: defaultLibrary=%s, %s", defaultLibrary, config));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // REGISTRATION
    // ========================================================================

    @Override
    public boolean registerTemplate(String id, Template template) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(template, "template");

        ValidationResult validation = validator.validate(template);
        if (!validation.isValid()) {
            logger.warning(String.format("Template '%s' rejected: %s", id, validation.errors()));
            return false;
        }

        String key = ITemplateStore.customKey(id);
        if (store.exists(key)) {
            logger.warning(String.format("Template '%s' is already registered", id));
            return false;
        }

        store.save(key, template.withId(id));
        invalidate(key);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Registered template " + key);
        }
        return true;
    }

    @Override
    public boolean unregisterTemplate(String id) {
        Objects.requireNonNull(id, "id");
        String key = ITemplateStore.customKey(id);
        Set<String> affected = affectedKeys(key);
        if (!store.delete(key)) {
            return false;
        }
        cache.invalidate(affected);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Unregistered template " + key);
        }
        return true;
    }

    @Override
    public ValidationResult validateTemplate(Template template) {
        return validator.validate(template);
    }

    @Override
    public int loadTemplateLibrary(Path directory, String genre) {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(genre, "genre");
        int loaded = libraryLoader.loadLibrary(directory, genre, store);
        if (loaded > 0) {
            // New keys can change how existing references resolve
            cache.clear();
        }
        return loaded;
    }

    private void invalidate(String key) {
        cache.invalidate(affectedKeys(key));
    }

    private Set<String> affectedKeys(String key) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(key);
        keys.addAll(compiler.lookup().dependentsOf(key));
        return keys;
    }

    // ========================================================================
    // GENERATION
    // ========================================================================

    @Override
    public Optional<Event> generateFromTemplate(String id, GenerationContext context) {
        Objects.requireNonNull(id, "id");
        Optional<ResolvedTemplate> template = find(id);
        if (template.isEmpty()) {
            logger.warning(String.format("Template '%s' not found", id));
            return Optional.empty();
        }
        return Optional.of(generate(id, template.get(), orEmpty(context)));
    }

    @Override
    public Optional<Event> generateFromGenre(String genre, GenerationContext context) {
        Objects.requireNonNull(genre, "genre");
        GenerationContext ctx = orEmpty(context);

        List<ResolvedTemplate> candidates = new ArrayList<>();
        for (Map.Entry<String, Template> entry : store.findAll().entrySet()) {
            if (genre.equals(ITemplateStore.namespaceOf(entry.getKey()))) {
                ResolvedTemplate candidate = new ResolvedTemplate(entry.getKey(), entry.getValue());
                if (isAvailable(candidate, ctx)) {
                    candidates.add(candidate);
                }
            }
        }

        if (candidates.isEmpty()) {
            logger.warning(String.format("No available templates for genre '%s'", genre));
            return Optional.empty();
        }

        ResolvedTemplate chosen = candidates.get(random.nextInt(candidates.size()));
        return Optional.of(generate(ITemplateStore.idOf(chosen.key()), chosen, ctx));
    }

    @Override
    public boolean isTemplateAvailable(String id, GenerationContext context) {
        Objects.requireNonNull(id, "id");
        return find(id).map(template -> isAvailable(template, orEmpty(context))).orElse(false);
    }

    private boolean isAvailable(ResolvedTemplate template, GenerationContext context) {
        Template resolved = compiler.resolve(template.template(), template.key());
        return conditionEvaluator.evaluateAll(resolved.conditions(), context);
    }

    private Event generate(String id, ResolvedTemplate template, GenerationContext context) {
        Span span = tracer.spanBuilder("generate-from-template").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("templateId", id);
            String key = template.key();
            String eventId = eventIds.get();

            Optional<Event> cached = cache.getGenerated(key, context, eventId);
            span.setAttribute("generationCacheHit", cached.isPresent());
            if (cached.isPresent()) {
                span.setAttribute("choiceCount", cached.get().getChoices().size());
                return cached.get();
            }

            Optional<Template> processed = cache.getProcessed(key, context);
            span.setAttribute("processedCacheHit", processed.isPresent());
            Template compiled = processed.orElseGet(() -> {
                Template result = compiler.compile(template.template(), key, context);
                cache.putProcessed(key, context, result);
                return result;
            });

            List<Choice> choices = choiceFilter.filter(compiled, context);
            span.setAttribute("choiceCount", choices.size());

            Event event = new Event(eventId, compiled.title(), compiled.narrative(), choices);
            event.setType(compiled.type() != null ? compiled.type() : config.getDefaultEventType());
            event.setContext(context.toSnapshot());
            event.setDifficulty(compiled.difficulty());
            event.setTags(compiled.tags());

            cache.putGenerated(key, context, event);
            return event;
        } finally {
            span.end();
        }
    }

    private Optional<ResolvedTemplate> find(String id) {
        String customKey = ITemplateStore.customKey(id);
        Optional<Template> custom = store.findByKey(customKey);
        if (custom.isPresent()) {
            return Optional.of(new ResolvedTemplate(customKey, custom.get()));
        }
        if (defaultLibrary != null) {
            String libraryKey = ITemplateStore.key(defaultLibrary, id);
            Optional<Template> library = store.findByKey(libraryKey);
            if (library.isPresent()) {
                return Optional.of(new ResolvedTemplate(libraryKey, library.get()));
            }
        }
        return store.findByKey(id).map(template -> new ResolvedTemplate(id, template));
    }

    private static GenerationContext orEmpty(GenerationContext context) {
        return context != null ? context : GenerationContext.empty();
    }

    private static String nextEventId() {
        return "event_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    @Override
    public boolean hasTemplate(String id) {
        Objects.requireNonNull(id, "id");
        return find(id).isPresent();
    }

    @Override
    public Map<String, Template> getCustomTemplates() {
        Map<String, Template> custom = new LinkedHashMap<>();
        store.findAll().forEach((key, template) -> {
            if (ITemplateStore.CUSTOM_NAMESPACE.equals(ITemplateStore.namespaceOf(key))) {
                custom.put(ITemplateStore.idOf(key), template);
            }
        });
        return custom;
    }

    @Override
    public Map<String, Map<String, TemplateSummary>> getAvailableTemplates() {
        Map<String, Map<String, TemplateSummary>> byGenre = new LinkedHashMap<>();
        store.findAll().forEach((key, template) -> {
            String genre = ITemplateStore.namespaceOf(key);
            if (genre != null) {
                byGenre.computeIfAbsent(genre, g -> new LinkedHashMap<>())
                        .put(ITemplateStore.idOf(key), TemplateSummary.of(template));
            }
        });
        return byGenre;
    }

    public List<Template> search(TemplateQuery query) {
        return store.search(query);
    }

    public TemplateEngineStats getStats() {
        Map<String, Template> all = store.findAll();
        Set<String> genres = new LinkedHashSet<>();
        int custom = 0;
        for (String key : all.keySet()) {
            String genre = ITemplateStore.namespaceOf(key);
            if (genre != null) {
                genres.add(genre);
            }
            if (ITemplateStore.CUSTOM_NAMESPACE.equals(genre)) {
                custom++;
            }
        }
        return new TemplateEngineStats(custom, all.size(), new ArrayList<>(genres), defaultLibrary);
    }

    public TwoTierCache.CacheStats getCacheStats() {
        return cache.getStats();
    }

    @Override
    public void clearAllCaches() {
        cache.clear();
        logger.info("Template caches cleared");
    }

    public ConditionEvaluator getConditionEvaluator() {
        return conditionEvaluator;
    }

    public EngineConfig getConfig() {
        return config;
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private EngineConfig config = EngineConfig.defaults();
        private ITemplateStore store;
        private String defaultLibrary;
        private ConditionEvaluator conditionEvaluator;
        private JsonTemplateLibraryLoader libraryLoader;
        private Tracer tracer;
        private Supplier<String> eventIds;

        private Builder() {
        }

        public Builder config(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder store(ITemplateStore store) {
            this.store = store;
            return this;
        }

        /**
         * Genre consulted for un-prefixed ids after the custom namespace.
         */
        public Builder defaultLibrary(String genre) {
            this.defaultLibrary = genre;
            return this;
        }

        public Builder conditionEvaluator(ConditionEvaluator conditionEvaluator) {
            this.conditionEvaluator = conditionEvaluator;
            return this;
        }

        public Builder libraryLoader(JsonTemplateLibraryLoader libraryLoader) {
            this.libraryLoader = libraryLoader;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder eventIds(Supplier<String> eventIds) {
            this.eventIds = eventIds;
            return this;
        }

        public TemplateEngine build() {
            return new TemplateEngine(this);
        }
    }
}
