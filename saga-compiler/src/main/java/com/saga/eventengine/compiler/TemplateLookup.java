/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.compiler;

import com.saga.eventengine.api.ITemplateStore;
import com.saga.eventengine.api.model.Template;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves template references ({@code extends}, {@code mixins}, composition ids) to stored templates.
 *
 * <p>A reference {@code ref} made from a template stored under {@code ns:id} is tried as
 * {@code custom:ref}, then as the literal key {@code ref}, then as {@code ns:ref}.
 */
public class TemplateLookup {

    /**
     * A reference resolved to its store key.
     */
    public record ResolvedTemplate(String key, Template template) {
    }

    private final ITemplateStore store;

    public TemplateLookup(ITemplateStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public ITemplateStore store() {
        return store;
    }

    /**
     * @param reference      id as written in the referencing template
     * @param referencingKey store key of the referencing template (may be null)
     */
    public Optional<ResolvedTemplate> resolve(String reference, String referencingKey) {
        if (reference == null || reference.isEmpty()) {
            return Optional.empty();
        }
        Optional<ResolvedTemplate> found = find(ITemplateStore.customKey(reference))
                .or(() -> find(reference));
        if (found.isPresent() || referencingKey == null) {
            return found;
        }
        String namespace = ITemplateStore.namespaceOf(referencingKey);
        if (namespace == null || ITemplateStore.CUSTOM_NAMESPACE.equals(namespace)) {
            return Optional.empty();
        }
        return find(ITemplateStore.key(namespace, reference));
    }

    private Optional<ResolvedTemplate> find(String key) {
        return store.findByKey(key).map(template -> new ResolvedTemplate(key, template));
    }

    /**
     * Store keys of every template that reaches {@code key} through {@code extends},
     * {@code mixins} or {@code composition}, directly or transitively. Excludes {@code key} itself.
     */
    public Set<String> dependentsOf(String key) {
        Map<String, Template> all = store.findAll();
        Set<String> dependents = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(key);
        while (!pending.isEmpty()) {
            String target = pending.pop();
            for (Map.Entry<String, Template> entry : all.entrySet()) {
                String candidate = entry.getKey();
                if (candidate.equals(key) || dependents.contains(candidate)) {
                    continue;
                }
                if (refersTo(entry.getValue(), candidate, target)) {
                    dependents.add(candidate);
                    pending.push(candidate);
                }
            }
        }
        return dependents;
    }

    private static boolean refersTo(Template template, String templateKey, String targetKey) {
        String namespace = ITemplateStore.namespaceOf(templateKey);
        for (String reference : template.referencedIds()) {
            if (targetKey.equals(ITemplateStore.customKey(reference)) || targetKey.equals(reference)) {
                return true;
            }
            if (namespace != null && targetKey.equals(ITemplateStore.key(namespace, reference))) {
                return true;
            }
        }
        return false;
    }
}
