/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Operators understood by condition types that compare or test membership.
 */
public enum ComparisonOperator {
    GTE("gte"),
    LTE("lte"),
    GT("gt"),
    LT("lt"),
    EQ("eq"),
    NEQ("neq"),
    HAS("has"),
    NOT_HAS("not_has");

    private final String value;

    ComparisonOperator(String value) {
        this.value = value;
    }

    /**
     * Safely converts a string to an operator.
     * Accepts the wire form ("gte"), the enum name ("GTE") and the legacy "ne" alias.
     *
     * @param text the operator string
     * @return the matching operator, or null if not recognized
     */
    public static ComparisonOperator fromString(String text) {
        if (text == null) return null;
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("ne")) return NEQ;
        for (ComparisonOperator operator : values()) {
            if (operator.value.equals(normalized)) {
                return operator;
            }
        }
        return null;
    }

    /**
     * Checks if this operator orders two numbers.
     */
    public boolean isNumeric() {
        return this != HAS && this != NOT_HAS;
    }

    /**
     * Numeric comparison of {@code actual} against {@code expected}.
     * Membership operators always return false here.
     */
    public boolean compare(double actual, double expected) {
        return switch (this) {
            case GTE -> actual >= expected;
            case LTE -> actual <= expected;
            case GT -> actual > expected;
            case LT -> actual < expected;
            case EQ -> actual == expected;
            case NEQ -> actual != expected;
            default -> false;
        };
    }

    /**
     * Equality-only comparison for non-numeric operands (strings, booleans).
     */
    public boolean compareObjects(Object actual, Object expected) {
        return switch (this) {
            case EQ -> Objects.equals(actual, expected);
            case NEQ -> !Objects.equals(actual, expected);
            default -> false;
        };
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
