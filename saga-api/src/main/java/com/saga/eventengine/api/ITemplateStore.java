/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api;

import com.saga.eventengine.api.model.Template;
import com.saga.eventengine.api.model.TemplateQuery;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage for templates, addressed by qualified key.
 *
 * <p>Keys take the form {@code <namespace>:<id>}: caller-registered templates live
 * under {@value #CUSTOM_NAMESPACE}, library templates under their genre.
 *
 * <p><b>Thread Safety:</b> Implementations must be safe for concurrent reads.
 */
public interface ITemplateStore {

    String CUSTOM_NAMESPACE = "custom";

    static String key(String namespace, String id) {
        return namespace + ":" + id;
    }

    static String customKey(String id) {
        return key(CUSTOM_NAMESPACE, id);
    }

    /**
     * Namespace part of a qualified key, or null for an unqualified one.
     */
    static String namespaceOf(String key) {
        int separator = key.indexOf(':');
        return separator < 0 ? null : key.substring(0, separator);
    }

    /**
     * Id part of a qualified key; unqualified keys are returned unchanged.
     */
    static String idOf(String key) {
        int separator = key.indexOf(':');
        return separator < 0 ? key : key.substring(separator + 1);
    }

    /**
     * Save a template, replacing any existing one under the same key.
     */
    void save(String key, Template template);

    Optional<Template> findByKey(String key);

    /**
     * All templates in insertion order, keyed by qualified key.
     */
    Map<String, Template> findAll();

    /**
     * @return true if a template was removed
     */
    boolean delete(String key);

    boolean exists(String key);

    long count();

    List<Template> search(TemplateQuery query);

    /**
     * Remove every template.
     */
    void clear();
}
