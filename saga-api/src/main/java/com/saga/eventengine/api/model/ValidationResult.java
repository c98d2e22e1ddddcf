/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of validating a template or rule. Validation never throws; problems are listed here.
 *
 * @param isValid true when {@code errors} is empty
 * @param subject id of the validated template or rule (may be null)
 * @param errors  human-readable problems, in discovery order
 */
public record ValidationResult(
        @JsonProperty("valid") boolean isValid,
        @JsonProperty("subject") String subject,
        @JsonProperty("errors") List<String> errors
) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult valid(String subject) {
        return new ValidationResult(true, subject, List.of());
    }

    public static ValidationResult invalid(String subject, List<String> errors) {
        return new ValidationResult(false, subject, errors);
    }

    public static ValidationResult of(String subject, List<String> errors) {
        return new ValidationResult(errors == null || errors.isEmpty(), subject, errors);
    }
}
