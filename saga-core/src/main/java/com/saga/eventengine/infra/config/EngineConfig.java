/*
 * Copyright (c) 2025 Saga Event Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.saga.eventengine.infra.config;

import com.saga.eventengine.api.model.Event;
import com.saga.eventengine.infra.cache.ProcessedKeyMode;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.Random;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Configuration for the template engine and its two caches.
 *
 * <p><b>Environment Variable Override:</b>
 * <pre>
 * SAGA_CACHE_ENABLED=false
 * SAGA_CACHE_PROCESSED_MAX_SIZE=5000
 * SAGA_CACHE_GENERATION_MAX_SIZE=20000
 * SAGA_CACHE_EXPIRE_SECONDS=600
 * SAGA_CACHE_RECORD_STATS=true
 * SAGA_CACHE_KEY_MODE=EXACT
 * SAGA_RANDOM_SEED=42
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * EngineConfig config = EngineConfig.builder()
 *     .processedCacheMaxSize(1_000)
 *     .processedKeyMode(ProcessedKeyMode.EXACT)
 *     .build();
 *
 * EngineConfig fromEnv = EngineConfig.fromEnvironment();
 * EngineConfig fromFile = EngineConfig.loadFromProperties("saga.properties");
 * }</pre>
 */
public final class EngineConfig {

    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_CACHE_ENABLED = "SAGA_CACHE_ENABLED";
    static final String ENV_PROCESSED_MAX_SIZE = "SAGA_CACHE_PROCESSED_MAX_SIZE";
    static final String ENV_GENERATION_MAX_SIZE = "SAGA_CACHE_GENERATION_MAX_SIZE";
    static final String ENV_EXPIRE_SECONDS = "SAGA_CACHE_EXPIRE_SECONDS";
    static final String ENV_RECORD_STATS = "SAGA_CACHE_RECORD_STATS";
    static final String ENV_KEY_MODE = "SAGA_CACHE_KEY_MODE";
    static final String ENV_RANDOM_SEED = "SAGA_RANDOM_SEED";

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    private final boolean cachingEnabled;
    private final long processedCacheMaxSize;
    private final long generationCacheMaxSize;
    private final long expireAfterAccessSeconds;
    private final boolean recordStats;
    private final ProcessedKeyMode processedKeyMode;
    private final String defaultEventType;
    private final Long randomSeed;

    private EngineConfig(Builder builder) {
        this.cachingEnabled = builder.cachingEnabled;
        this.processedCacheMaxSize = builder.processedCacheMaxSize;
        this.generationCacheMaxSize = builder.generationCacheMaxSize;
        this.expireAfterAccessSeconds = builder.expireAfterAccessSeconds;
        this.recordStats = builder.recordStats;
        this.processedKeyMode = builder.processedKeyMode;
        this.defaultEventType = builder.defaultEventType;
        this.randomSeed = builder.randomSeed;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Stats on and a fixed random seed, so random conditions and genre picks repeat.
     */
    public static EngineConfig forTesting() {
        return builder()
                .recordStats(true)
                .randomSeed(42L)
                .build();
    }

    /**
     * Defaults overridden by {@code SAGA_*} environment variables.
     */
    public static EngineConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static EngineConfig fromEnvironment(Function<String, String> environment) {
        return builder().applyEnvironment(environment).build();
    }

    /**
     * Load configuration from a properties file.
     *
     * <p>Searches the classpath root first, then the file system. Environment
     * variables override properties file values.
     *
     * <p><b>Example saga.properties:</b>
     * <pre>
     * saga.cache.enabled=true
     * saga.cache.processed.max.size=10000
     * saga.cache.generation.max.size=10000
     * saga.cache.expire.seconds=0
     * saga.cache.record.stats=true
     * saga.cache.key.mode=COARSE
     * saga.random.seed=7
     * </pre>
     */
    public static EngineConfig loadFromProperties(String propertiesPath) {
        return loadFromProperties(propertiesPath, System::getenv);
    }

    static EngineConfig loadFromProperties(String propertiesPath, Function<String, String> environment) {
        logger.info("Loading engine configuration from: " + propertiesPath);

        Properties props = new Properties();

        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (IOException e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (FileInputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (IOException e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        return builder()
                .applyProperties(props)
                .applyEnvironment(environment)
                .build();
    }

    public Random newRandom() {
        return randomSeed != null ? new Random(randomSeed) : new Random();
    }

    /**
     * @throws IllegalArgumentException on negative sizes or expiry
     */
    public void validate() {
        if (processedCacheMaxSize < 0) {
            throw new IllegalArgumentException("processedCacheMaxSize must be >= 0: " + processedCacheMaxSize);
        }
        if (generationCacheMaxSize < 0) {
            throw new IllegalArgumentException("generationCacheMaxSize must be >= 0: " + generationCacheMaxSize);
        }
        if (expireAfterAccessSeconds < 0) {
            throw new IllegalArgumentException("expireAfterAccessSeconds must be >= 0: " + expireAfterAccessSeconds);
        }
        if (processedKeyMode == null) {
            throw new IllegalArgumentException("processedKeyMode is required");
        }
        if (defaultEventType == null || defaultEventType.isBlank()) {
            throw new IllegalArgumentException("defaultEventType is required");
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public boolean isCachingEnabled() {
        return cachingEnabled;
    }

    public long getProcessedCacheMaxSize() {
        return processedCacheMaxSize;
    }

    public long getGenerationCacheMaxSize() {
        return generationCacheMaxSize;
    }

    public long getExpireAfterAccessSeconds() {
        return expireAfterAccessSeconds;
    }

    public boolean isRecordStats() {
        return recordStats;
    }

    public ProcessedKeyMode getProcessedKeyMode() {
        return processedKeyMode;
    }

    public String getDefaultEventType() {
        return defaultEventType;
    }

    public Optional<Long> getRandomSeed() {
        return Optional.ofNullable(randomSeed);
    }

    @Override
    public String toString() {
        return String.format(
                "EngineConfig{caching=%b, processedMax=%d, generationMax=%d, expire=%ds, stats=%b, keyMode=%s, seed=%s}",
                cachingEnabled, processedCacheMaxSize, generationCacheMaxSize, expireAfterAccessSeconds,
                recordStats, processedKeyMode, randomSeed);
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .cachingEnabled(cachingEnabled)
                .processedCacheMaxSize(processedCacheMaxSize)
                .generationCacheMaxSize(generationCacheMaxSize)
                .expireAfterAccessSeconds(expireAfterAccessSeconds)
                .recordStats(recordStats)
                .processedKeyMode(processedKeyMode)
                .defaultEventType(defaultEventType)
                .randomSeed(randomSeed);
    }

    public static final class Builder {

        private boolean cachingEnabled = true;
        private long processedCacheMaxSize = 10_000;
        private long generationCacheMaxSize = 10_000;
        private long expireAfterAccessSeconds = 0;
        private boolean recordStats = true;
        private ProcessedKeyMode processedKeyMode = ProcessedKeyMode.COARSE;
        private String defaultEventType = Event.DEFAULT_TYPE;
        private Long randomSeed;

        private Builder() {
        }

        public Builder cachingEnabled(boolean enabled) {
            this.cachingEnabled = enabled;
            return this;
        }

        public Builder processedCacheMaxSize(long size) {
            this.processedCacheMaxSize = size;
            return this;
        }

        public Builder generationCacheMaxSize(long size) {
            this.generationCacheMaxSize = size;
            return this;
        }

        /**
         * 0 disables expiry.
         */
        public Builder expireAfterAccessSeconds(long seconds) {
            this.expireAfterAccessSeconds = seconds;
            return this;
        }

        public Builder recordStats(boolean enable) {
            this.recordStats = enable;
            return this;
        }

        public Builder processedKeyMode(ProcessedKeyMode mode) {
            this.processedKeyMode = mode;
            return this;
        }

        public Builder defaultEventType(String type) {
            this.defaultEventType = type;
            return this;
        }

        public Builder randomSeed(Long seed) {
            this.randomSeed = seed;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }

        // ====================================================================
        // OVERRIDE SOURCES
        // ====================================================================

        Builder applyProperties(Properties props) {
            parseBoolean("saga.cache.enabled", props.getProperty("saga.cache.enabled"))
                    .ifPresent(val -> this.cachingEnabled = val);
            parseLong("saga.cache.processed.max.size", props.getProperty("saga.cache.processed.max.size"))
                    .ifPresent(val -> this.processedCacheMaxSize = val);
            parseLong("saga.cache.generation.max.size", props.getProperty("saga.cache.generation.max.size"))
                    .ifPresent(val -> this.generationCacheMaxSize = val);
            parseLong("saga.cache.expire.seconds", props.getProperty("saga.cache.expire.seconds"))
                    .ifPresent(val -> this.expireAfterAccessSeconds = val);
            parseBoolean("saga.cache.record.stats", props.getProperty("saga.cache.record.stats"))
                    .ifPresent(val -> this.recordStats = val);
            parseKeyMode("saga.cache.key.mode", props.getProperty("saga.cache.key.mode"))
                    .ifPresent(val -> this.processedKeyMode = val);
            parseLong("saga.random.seed", props.getProperty("saga.random.seed"))
                    .ifPresent(val -> this.randomSeed = val);
            return this;
        }

        Builder applyEnvironment(Function<String, String> environment) {
            parseBoolean(ENV_CACHE_ENABLED, environment.apply(ENV_CACHE_ENABLED))
                    .ifPresent(val -> this.cachingEnabled = val);
            parseLong(ENV_PROCESSED_MAX_SIZE, environment.apply(ENV_PROCESSED_MAX_SIZE))
                    .ifPresent(val -> this.processedCacheMaxSize = val);
            parseLong(ENV_GENERATION_MAX_SIZE, environment.apply(ENV_GENERATION_MAX_SIZE))
                    .ifPresent(val -> this.generationCacheMaxSize = val);
            parseLong(ENV_EXPIRE_SECONDS, environment.apply(ENV_EXPIRE_SECONDS))
                    .ifPresent(val -> this.expireAfterAccessSeconds = val);
            parseBoolean(ENV_RECORD_STATS, environment.apply(ENV_RECORD_STATS))
                    .ifPresent(val -> this.recordStats = val);
            parseKeyMode(ENV_KEY_MODE, environment.apply(ENV_KEY_MODE))
                    .ifPresent(val -> this.processedKeyMode = val);
            parseLong(ENV_RANDOM_SEED, environment.apply(ENV_RANDOM_SEED))
                    .ifPresent(val -> this.randomSeed = val);
            return this;
        }

        // ====================================================================
        // PARSING HELPERS
        // ====================================================================

        private static Optional<String> trimmed(String key, String value) {
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded config value: " + key + "=" + value.trim());
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Long> parseLong(String key, String value) {
            return trimmed(key, value).flatMap(val -> {
                try {
                    return Optional.of(Long.parseLong(val));
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                    return Optional.empty();
                }
            });
        }

        private static Optional<Boolean> parseBoolean(String key, String value) {
            return trimmed(key, value).flatMap(val -> {
                String lower = val.toLowerCase(Locale.ROOT);
                if (lower.equals("true") || lower.equals("false")) {
                    return Optional.of(Boolean.parseBoolean(lower));
                }
                logger.warning("Invalid boolean value for " + key + ": " + val);
                return Optional.empty();
            });
        }

        private static Optional<ProcessedKeyMode> parseKeyMode(String key, String value) {
            return trimmed(key, value).flatMap(val -> {
                try {
                    return Optional.of(ProcessedKeyMode.valueOf(val.toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    logger.warning("Invalid key mode for " + key + ": " + val);
                    return Optional.empty();
                }
            });
        }
    }
}
