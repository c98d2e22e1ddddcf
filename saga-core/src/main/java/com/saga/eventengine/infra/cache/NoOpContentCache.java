/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.infra.cache;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Cache that stores nothing. Every lookup is a miss; metrics count requests only.
 *
 * @param <V> value type
 */
public class NoOpContentCache<V> implements ContentCache<V> {

    private final AtomicLong requestCount = new AtomicLong();

    @Override
    public Optional<V> get(String key) {
        requestCount.incrementAndGet();
        return Optional.empty();
    }

    @Override
    public void put(String key, V value) {
        // nothing to store
    }

    @Override
    public int invalidateMatching(Predicate<String> keyFilter) {
        return 0;
    }

    @Override
    public void invalidateAll() {
        // nothing to clear
    }

    @Override
    public long size() {
        return 0;
    }

    @Override
    public CacheMetrics getMetrics() {
        long requests = requestCount.get();
        return new CacheMetrics(requests, 0, requests, 0, 0, 0.0);
    }
}
