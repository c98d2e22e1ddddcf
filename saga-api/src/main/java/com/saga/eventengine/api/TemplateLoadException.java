/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api;

/**
 * Thrown when a template file cannot be read or parsed.
 *
 * <p>Unchecked; library loaders catch it per file and continue with the rest.
 */
public class TemplateLoadException extends RuntimeException {

    public TemplateLoadException(String message) {
        super(message);
    }

    public TemplateLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
