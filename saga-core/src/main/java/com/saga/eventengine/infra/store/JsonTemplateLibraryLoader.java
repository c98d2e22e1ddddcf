/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.infra.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.saga.eventengine.api.ITemplateStore;
import com.saga.eventengine.api.TemplateLoadException;
import com.saga.eventengine.api.model.Template;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads template libraries from JSON files: one template per {@code *.json} file,
 * the file name (without extension) being the template id.
 *
 * <p>Loaded templates are saved under {@code <genre>:<id>}.
 */
public class JsonTemplateLibraryLoader {

    private static final Logger logger = Logger.getLogger(JsonTemplateLibraryLoader.class.getName());

    private static final String EXTENSION = ".json";

    private final ObjectMapper objectMapper;

    public JsonTemplateLibraryLoader() {
        this(JsonMapper.builder()
                .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build());
    }

    public JsonTemplateLibraryLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load every JSON file of {@code directory} into the store. Unreadable files are
     * logged and skipped; a missing directory loads nothing.
     *
     * @return number of templates loaded
     */
    public int loadLibrary(Path directory, String genre, ITemplateStore store) {
        if (directory == null || !Files.isDirectory(directory)) {
            logger.warning("Template genre '" + genre + "' not found at " + directory);
            return 0;
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to list template library '" + genre + "'", e);
            return 0;
        }

        int loaded = 0;
        for (Path file : files) {
            try {
                Template template = readTemplate(file);
                store.save(ITemplateStore.key(genre, template.id()), template);
                loaded++;
            } catch (TemplateLoadException e) {
                logger.warning("Failed to load template " + file.getFileName() + ": " + e.getMessage());
            }
        }

        logger.info(String.format("Loaded %d templates from genre '%s'", loaded, genre));
        return loaded;
    }

    /**
     * Read one template file. The template's id is set to the file name.
     *
     * @throws TemplateLoadException if the file cannot be read or parsed
     */
    public Template readTemplate(Path file) {
        String fileName = file.getFileName().toString();
        String id = fileName.endsWith(EXTENSION)
                ? fileName.substring(0, fileName.length() - EXTENSION.length())
                : fileName;
        try (InputStream in = Files.newInputStream(file)) {
            return readTemplate(in, id);
        } catch (IOException e) {
            throw new TemplateLoadException("Cannot read " + file, e);
        }
    }

    /**
     * Parse a template from a stream, assigning {@code id}.
     *
     * @throws TemplateLoadException if the content is not a template
     */
    public Template readTemplate(InputStream in, String id) {
        try {
            Template template = objectMapper.readValue(in, Template.class);
            if (template == null) {
                throw new TemplateLoadException("Empty template document for " + id);
            }
            return template.withId(id);
        } catch (IOException e) {
            throw new TemplateLoadException("Invalid template JSON for " + id + ": " + e.getMessage(), e);
        }
    }
}
