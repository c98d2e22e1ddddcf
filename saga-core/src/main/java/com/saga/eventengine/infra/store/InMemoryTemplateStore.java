/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.infra.store;

import com.saga.eventengine.api.ITemplateStore;
import com.saga.eventengine.api.model.Template;
import com.saga.eventengine.api.model.TemplateQuery;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ITemplateStore}.
 *
 * <p>Templates are lost on restart. Listing order is insertion order; replacing a
 * template keeps its original position.
 *
 * <p><b>Thread Safety:</b> All operations are thread-safe.
 */
public class InMemoryTemplateStore implements ITemplateStore {

    private record Entry(long sequence, Template template) {
    }

    private final ConcurrentMap<String, Entry> templates = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public void save(String key, Template template) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(template, "template");
        templates.compute(key, (k, existing) -> existing == null
                ? new Entry(sequence.incrementAndGet(), template)
                : new Entry(existing.sequence(), template));
    }

    @Override
    public Optional<Template> findByKey(String key) {
        Entry entry = key == null ? null : templates.get(key);
        return entry == null ? Optional.empty() : Optional.of(entry.template());
    }

    @Override
    public Map<String, Template> findAll() {
        return templates.entrySet().stream()
                .sorted(Comparator.comparingLong(e -> e.getValue().sequence()))
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().template(),
                        (a, b) -> a, LinkedHashMap::new));
    }

    @Override
    public boolean delete(String key) {
        return key != null && templates.remove(key) != null;
    }

    @Override
    public boolean exists(String key) {
        return key != null && templates.containsKey(key);
    }

    @Override
    public long count() {
        return templates.size();
    }

    @Override
    public List<Template> search(TemplateQuery query) {
        TemplateQuery criteria = query != null ? query : TemplateQuery.all();
        return findAll().values().stream()
                .filter(criteria::matches)
                .collect(Collectors.toList());
    }

    @Override
    public void clear() {
        templates.clear();
    }
}
