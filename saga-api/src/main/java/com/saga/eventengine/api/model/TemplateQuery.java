/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import java.util.List;
import java.util.Locale;

/**
 * Search criteria for template stores. Null criteria match everything.
 *
 * @param tags          every tag must be present on the template
 * @param type          exact type
 * @param difficulty    exact difficulty
 * @param titleContains case-insensitive title substring
 */
public record TemplateQuery(List<String> tags, String type, String difficulty, String titleContains) {

    public TemplateQuery {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static TemplateQuery all() {
        return new TemplateQuery(null, null, null, null);
    }

    public static TemplateQuery byTags(String... tags) {
        return new TemplateQuery(List.of(tags), null, null, null);
    }

    public static TemplateQuery byType(String type) {
        return new TemplateQuery(null, type, null, null);
    }

    public boolean matches(Template template) {
        if (!template.tags().containsAll(tags)) {
            return false;
        }
        if (type != null && !type.equals(template.type())) {
            return false;
        }
        if (difficulty != null && !difficulty.equals(template.difficulty())) {
            return false;
        }
        if (titleContains != null) {
            String title = template.title();
            return title != null
                    && title.toLowerCase(Locale.ROOT).contains(titleContains.toLowerCase(Locale.ROOT));
        }
        return true;
    }
}
