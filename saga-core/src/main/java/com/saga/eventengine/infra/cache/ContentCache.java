/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.infra.cache;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * String-keyed cache for generated content.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link CaffeineContentCache}: bounded, optional expiry, Caffeine statistics</li>
 *   <li>{@link NoOpContentCache}: caching disabled</li>
 * </ul>
 *
 * @param <V> cached value type
 */
public interface ContentCache<V> {

    Optional<V> get(String key);

    void put(String key, V value);

    /**
     * Remove every entry whose key matches.
     *
     * @return number of entries removed
     */
    int invalidateMatching(Predicate<String> keyFilter);

    void invalidateAll();

    long size();

    CacheMetrics getMetrics();

    /**
     * Cache performance metrics.
     */
    record CacheMetrics(
            long totalRequests,
            long hits,
            long misses,
            long evictions,
            long currentSize,
            double hitRate
    ) {
        public static CacheMetrics empty(long size) {
            return new CacheMetrics(0, 0, 0, 0, size, 0.0);
        }

        public String format() {
            return String.format(
                    "Cache Metrics: requests=%d, hits=%d (%.1f%%), misses=%d, evictions=%d, size=%d",
                    totalRequests, hits, hitRate * 100, misses, evictions, currentSize
            );
        }
    }
}
