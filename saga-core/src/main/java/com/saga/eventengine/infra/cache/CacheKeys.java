/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.infra.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.saga.eventengine.api.model.GenerationContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Cache key derivation for both tiers.
 *
 * <pre>
 * template:&lt;id&gt;:&lt;level&gt;|&lt;reputation&gt;|&lt;gold&gt;|&lt;perception&gt;|&lt;charisma&gt;   (COARSE)
 * template:&lt;id&gt;:&lt;full-json&gt;                                         (EXACT)
 * generation:&lt;id&gt;:&lt;json&gt;                                            (COARSE)
 * generation:&lt;id&gt;:&lt;full-json&gt;                                       (EXACT)
 * </pre>
 *
 * <p>{@code <json>} is a key-sorted serialization of the bucket stats plus
 * relationships, quests and inventory. {@code <full-json>} serializes the whole
 * context snapshot (every stat, environment and tags included). Integral numbers
 * print without a fraction, so {@code 5} and {@code 5.0} produce the same key.
 */
public final class CacheKeys {

    public static final String PROCESSED_TIER = "template";
    public static final String GENERATION_TIER = "generation";

    static final List<String> BUCKET_STATS = List.of("level", "reputation", "gold", "perception", "charisma");
    static final String ANY = "any";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private CacheKeys() {
    }

    public static String processedKey(String id, GenerationContext context, ProcessedKeyMode mode) {
        if (mode == ProcessedKeyMode.EXACT) {
            return PROCESSED_TIER + ":" + id + ":" + fullContextJson(context);
        }
        StringJoiner bucket = new StringJoiner("|");
        for (String stat : BUCKET_STATS) {
            Object value = normalize(context.stat(stat));
            bucket.add(value == null ? ANY : String.valueOf(value));
        }
        return PROCESSED_TIER + ":" + id + ":" + bucket;
    }

    public static String generationKey(String id, GenerationContext context, ProcessedKeyMode mode) {
        String json = mode == ProcessedKeyMode.EXACT ? fullContextJson(context) : contextJson(context);
        return GENERATION_TIER + ":" + id + ":" + json;
    }

    /**
     * Whether a key of either tier belongs to the template {@code id}.
     */
    public static boolean references(String cacheKey, String id) {
        return matchesTier(cacheKey, PROCESSED_TIER, id) || matchesTier(cacheKey, GENERATION_TIER, id);
    }

    private static boolean matchesTier(String cacheKey, String tier, String id) {
        String base = tier + ":" + id;
        return cacheKey.equals(base) || cacheKey.startsWith(base + ":");
    }

    static String contextJson(GenerationContext context) {
        Map<String, Object> projection = new TreeMap<>();
        for (String stat : BUCKET_STATS) {
            Object value = normalize(context.stat(stat));
            if (value != null) {
                projection.put(stat, value);
            }
        }
        if (!context.relationships().isEmpty()) {
            Map<String, Object> relationships = new TreeMap<>();
            context.relationships().forEach((npc, level) -> relationships.put(npc, normalize(level)));
            projection.put(GenerationContext.RELATIONSHIPS, relationships);
        }
        if (!context.quests().isEmpty()) {
            projection.put(GenerationContext.QUESTS, context.quests());
        }
        if (!context.inventory().isEmpty()) {
            projection.put(GenerationContext.INVENTORY, context.inventory());
        }
        return write(projection);
    }

    static String fullContextJson(GenerationContext context) {
        return write(normalize(context.toSnapshot()));
    }

    private static String write(Object projection) {
        try {
            return MAPPER.writeValueAsString(projection);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize cache key for context " + projection, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Object normalize(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            // Integral values render without a fraction; beyond long range they stay doubles
            if (d == Math.rint(d) && Math.abs(d) < 0x1p63) {
                return (long) d;
            }
            return d;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new LinkedHashMap<>();
            new TreeMap<>((Map<String, Object>) map).forEach((k, v) -> sorted.put(k, normalize(v)));
            return sorted;
        }
        return value;
    }
}
