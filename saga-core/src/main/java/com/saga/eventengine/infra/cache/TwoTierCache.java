/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.infra.cache;

import com.saga.eventengine.api.model.Event;
import com.saga.eventengine.api.model.GenerationContext;
import com.saga.eventengine.api.model.Template;
import com.saga.eventengine.infra.config.EngineConfig;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The processed-template cache and the generation cache of one engine.
 *
 * <p>Processed templates are immutable and stored as is. Generated events are
 * copied on the way in and on every hit, so callers can mutate what they receive.
 *
 * <p>Entries are keyed by the template's store key (see {@link CacheKeys}).
 */
public class TwoTierCache {

    private static final Logger logger = Logger.getLogger(TwoTierCache.class.getName());

    private final ContentCache<Template> processed;
    private final ContentCache<Event> generation;
    private final ProcessedKeyMode keyMode;

    public TwoTierCache(ContentCache<Template> processed, ContentCache<Event> generation, ProcessedKeyMode keyMode) {
        this.processed = processed;
        this.generation = generation;
        this.keyMode = keyMode;
    }

    public static TwoTierCache from(EngineConfig config) {
        if (!config.isCachingEnabled()) {
            logger.info("Template caching disabled");
            return new TwoTierCache(new NoOpContentCache<>(), new NoOpContentCache<>(), config.getProcessedKeyMode());
        }
        ContentCache<Template> processed = CaffeineContentCache.builder()
                .name("processed-templates")
                .maxSize(config.getProcessedCacheMaxSize())
                .expireAfterAccess(config.getExpireAfterAccessSeconds(), TimeUnit.SECONDS)
                .recordStats(config.isRecordStats())
                .build();
        ContentCache<Event> generation = CaffeineContentCache.builder()
                .name("generated-events")
                .maxSize(config.getGenerationCacheMaxSize())
                .expireAfterAccess(config.getExpireAfterAccessSeconds(), TimeUnit.SECONDS)
                .recordStats(config.isRecordStats())
                .build();
        return new TwoTierCache(processed, generation, config.getProcessedKeyMode());
    }

    // ========================================================================
    // PROCESSED TEMPLATES
    // ========================================================================

    public Optional<Template> getProcessed(String templateKey, GenerationContext context) {
        String key = CacheKeys.processedKey(templateKey, context, keyMode);
        Optional<Template> hit = processed.get(key);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine((hit.isPresent() ? "Processed cache hit: " : "Processed cache miss: ") + key);
        }
        return hit;
    }

    public void putProcessed(String templateKey, GenerationContext context, Template template) {
        processed.put(CacheKeys.processedKey(templateKey, context, keyMode), template);
    }

    // ========================================================================
    // GENERATED EVENTS
    // ========================================================================

    /**
     * @return a copy of the cached event carrying {@code newId}
     */
    public Optional<Event> getGenerated(String templateKey, GenerationContext context, String newId) {
        String key = CacheKeys.generationKey(templateKey, context, keyMode);
        Optional<Event> hit = generation.get(key);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine((hit.isPresent() ? "Generation cache hit: " : "Generation cache miss: ") + key);
        }
        return hit.map(event -> event.withId(newId));
    }

    public void putGenerated(String templateKey, GenerationContext context, Event event) {
        generation.put(CacheKeys.generationKey(templateKey, context, keyMode), event.copy());
    }

    // ========================================================================
    // INVALIDATION
    // ========================================================================

    /**
     * Purge every entry of either tier that belongs to one of the given template keys.
     *
     * @return number of entries removed
     */
    public int invalidate(Collection<String> templateKeys) {
        if (templateKeys.isEmpty()) {
            return 0;
        }
        int removed = processed.invalidateMatching(key -> referencesAny(key, templateKeys))
                + generation.invalidateMatching(key -> referencesAny(key, templateKeys));
        if (removed > 0 && logger.isLoggable(Level.FINE)) {
            logger.fine("Invalidated " + removed + " cache entries for " + templateKeys);
        }
        return removed;
    }

    private static boolean referencesAny(String cacheKey, Collection<String> templateKeys) {
        for (String templateKey : templateKeys) {
            if (CacheKeys.references(cacheKey, templateKey)) {
                return true;
            }
        }
        return false;
    }

    public void clear() {
        processed.invalidateAll();
        generation.invalidateAll();
    }

    public CacheStats getStats() {
        return new CacheStats(processed.size(), generation.size(), processed.getMetrics(), generation.getMetrics());
    }

    public ProcessedKeyMode getKeyMode() {
        return keyMode;
    }

    /**
     * Sizes and hit/miss counters of both tiers.
     */
    public record CacheStats(
            long processedTemplates,
            long generatedEvents,
            ContentCache.CacheMetrics processedMetrics,
            ContentCache.CacheMetrics generationMetrics
    ) {
        public String format() {
            return String.format("processed=%d [%s], generated=%d [%s]",
                    processedTemplates, processedMetrics.format(), generatedEvents, generationMetrics.format());
        }
    }
}
