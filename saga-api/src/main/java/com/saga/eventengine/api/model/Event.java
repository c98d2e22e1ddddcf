/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A generated event.
 *
 * <p>Events are mutable so the rule engine can post-process them in place.
 * Cached events are never handed out directly: {@link #copy()} and
 * {@link #withId(String)} produce deep, independent copies.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Event {

    public static final String DEFAULT_TYPE = "TEMPLATE_EVENT";

    @JsonProperty("id")
    private String id;
    @JsonProperty("title")
    private String title;
    @JsonProperty("description")
    private String description;
    @JsonProperty("choices")
    private List<Choice> choices = new ArrayList<>();
    @JsonProperty("type")
    private String type = DEFAULT_TYPE;
    @JsonProperty("context")
    private Map<String, Object> context = new LinkedHashMap<>();
    @JsonProperty("difficulty")
    private String difficulty;
    @JsonProperty("tags")
    private List<String> tags = new ArrayList<>();
    @JsonProperty("urgency")
    private String urgency;

    public Event() {
    }

    public Event(String id, String title, String description, List<Choice> choices) {
        this.id = id;
        this.title = title;
        this.description = description;
        setChoices(choices);
    }

    /**
     * Deep copy; the choice list, tag list and context map are fresh instances.
     */
    public Event copy() {
        Event copy = new Event(id, title, description, choices);
        copy.type = type;
        copy.difficulty = difficulty;
        copy.urgency = urgency;
        copy.tags = new ArrayList<>(tags);
        copy.context = deepCopy(context);
        return copy;
    }

    public Event withId(String newId) {
        Event copy = copy();
        copy.id = newId;
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> target = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (value instanceof Map<?, ?> nested) {
                target.put(key, deepCopy((Map<String, Object>) nested));
            } else if (value instanceof List<?> list) {
                target.put(key, new ArrayList<>(list));
            } else {
                target.put(key, value);
            }
        });
        return target;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<Choice> getChoices() {
        return choices;
    }

    public void setChoices(List<Choice> choices) {
        this.choices = choices == null ? new ArrayList<>() : new ArrayList<>(choices);
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public void setContext(Map<String, Object> context) {
        this.context = context == null ? new LinkedHashMap<>() : deepCopy(context);
    }

    public String getDifficulty() {
        return difficulty;
    }

    public void setDifficulty(String difficulty) {
        this.difficulty = difficulty;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
    }

    public String getUrgency() {
        return urgency;
    }

    public void setUrgency(String urgency) {
        this.urgency = urgency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event other)) return false;
        return Objects.equals(id, other.id)
                && Objects.equals(title, other.title)
                && Objects.equals(description, other.description)
                && Objects.equals(choices, other.choices)
                && Objects.equals(type, other.type)
                && Objects.equals(context, other.context)
                && Objects.equals(difficulty, other.difficulty)
                && Objects.equals(tags, other.tags)
                && Objects.equals(urgency, other.urgency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, description, choices, type, context, difficulty, tags, urgency);
    }

    @Override
    public String toString() {
        return "Event{id='" + id + "', title='" + title + "', choices=" + choices.size()
                + ", tags=" + tags + "}";
    }
}
