/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.runtime.generation;

import java.util.List;

/**
 * Snapshot of a {@link TemplateEngine}'s template registry.
 *
 * @param customTemplates number of caller-registered templates
 * @param loadedTemplates number of templates in the store, custom ones included
 * @param genres          distinct namespaces present in the store
 * @param templateLibrary default library consulted by id lookups, or null
 */
public record TemplateEngineStats(
        int customTemplates,
        int loadedTemplates,
        List<String> genres,
        String templateLibrary
) {
    public TemplateEngineStats {
        genres = List.copyOf(genres);
    }
}
