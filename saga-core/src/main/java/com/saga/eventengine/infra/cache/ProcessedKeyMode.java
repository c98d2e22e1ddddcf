/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.infra.cache;

/**
 * How cache keys are derived from the context.
 */
public enum ProcessedKeyMode {
    /**
     * Processed templates bucket by level, reputation, gold, perception and charisma;
     * generated events add relationships, quests and inventory. Conditions reading
     * other context data may be served from an entry computed for a different context.
     */
    COARSE,

    /**
     * Both tiers key by the whole context snapshot.
     */
    EXACT
}
