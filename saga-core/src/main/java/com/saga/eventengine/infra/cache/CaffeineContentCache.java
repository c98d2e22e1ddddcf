/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.infra.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Bounded in-process cache backed by Caffeine (Window TinyLFU eviction, lock-free reads).
 *
 * <p>Values are stored as given; callers that cache mutable values copy them on the way in and out.
 *
 * @param <V> cached value type
 */
public class CaffeineContentCache<V> implements ContentCache<V> {

    private static final Logger logger = Logger.getLogger(CaffeineContentCache.class.getName());

    private final Cache<String, V> cache;
    private final boolean statsEnabled;
    private final String name;

    private CaffeineContentCache(Builder builder) {
        Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder();

        if (builder.maxSize > 0) {
            cacheBuilder.maximumSize(builder.maxSize);
        }

        if (builder.expireAfterAccessDuration > 0) {
            cacheBuilder.expireAfterAccess(builder.expireAfterAccessDuration, builder.expireAfterAccessUnit);
        }

        this.statsEnabled = builder.recordStats;
        if (builder.recordStats) {
            cacheBuilder.recordStats();
        }

        this.name = builder.name;
        this.cache = cacheBuilder.build();

        logger.info(String.format(
                "CaffeineContentCache[%s] initialized: maxSize=%d, expireAfterAccess=%d %s, stats=%b",
                name, builder.maxSize, builder.expireAfterAccessDuration, builder.expireAfterAccessUnit,
                builder.recordStats
        ));
    }

    @Override
    public Optional<V> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, V value) {
        cache.put(key, value);
    }

    @Override
    public int invalidateMatching(Predicate<String> keyFilter) {
        List<String> matching = cache.asMap().keySet().stream()
                .filter(keyFilter)
                .collect(Collectors.toList());
        cache.invalidateAll(matching);
        return matching.size();
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public CacheMetrics getMetrics() {
        CacheStats stats = statsEnabled ? cache.stats() : CacheStats.empty();
        return new CacheMetrics(
                stats.requestCount(),
                stats.hitCount(),
                stats.missCount(),
                stats.evictionCount(),
                size(),
                stats.hitRate()
        );
    }

    public String getName() {
        return name;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name = "content";
        private long maxSize = 10_000;
        private long expireAfterAccessDuration = 0;
        private TimeUnit expireAfterAccessUnit = TimeUnit.SECONDS;
        private boolean recordStats = false;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder expireAfterAccess(long duration, TimeUnit unit) {
            this.expireAfterAccessDuration = duration;
            this.expireAfterAccessUnit = unit;
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public <V> CaffeineContentCache<V> build() {
            return new CaffeineContentCache<>(this);
        }
    }
}
