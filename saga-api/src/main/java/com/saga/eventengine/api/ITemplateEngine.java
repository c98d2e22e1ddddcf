/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api;

import com.saga.eventengine.api.model.Event;
import com.saga.eventengine.api.model.GenerationContext;
import com.saga.eventengine.api.model.Template;
import com.saga.eventengine.api.model.TemplateSummary;
import com.saga.eventengine.api.model.ValidationResult;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Contract for turning templates into events.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ITemplateEngine engine = new TemplateEngine();
 * engine.registerTemplate("ambush", template);
 *
 * Optional<Event> event = engine.generateFromTemplate("ambush",
 *         GenerationContext.builder().level(5).build());
 * }</pre>
 */
public interface ITemplateEngine {

    /**
     * Register a caller-defined template.
     *
     * @return false if the id is already registered or the template fails structural validation
     */
    boolean registerTemplate(String id, Template template);

    /**
     * Remove a caller-defined template and purge every cache entry that references it.
     *
     * @return false if no template was registered under the id
     */
    boolean unregisterTemplate(String id);

    /**
     * Generate an event. The result always carries at least one choice.
     *
     * @return empty only when no template is known under the id
     */
    Optional<Event> generateFromTemplate(String id, GenerationContext context);

    ValidationResult validateTemplate(Template template);

    boolean hasTemplate(String id);

    /**
     * Caller-registered templates keyed by id.
     */
    Map<String, Template> getCustomTemplates();

    /**
     * All known templates grouped by namespace (genre or {@code custom}), then by id.
     */
    Map<String, Map<String, TemplateSummary>> getAvailableTemplates();

    /**
     * Load every {@code *.json} file in {@code directory} as a template of {@code genre}.
     * The file name without extension is the template id.
     *
     * @return number of templates loaded
     */
    int loadTemplateLibrary(Path directory, String genre);

    /**
     * Generate from a random template of the genre whose template-level conditions hold.
     */
    Optional<Event> generateFromGenre(String genre, GenerationContext context);

    /**
     * Whether the template exists and its template-level conditions hold.
     */
    boolean isTemplateAvailable(String id, GenerationContext context);

    void clearAllCaches();
}
