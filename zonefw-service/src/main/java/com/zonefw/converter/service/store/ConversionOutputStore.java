/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.service.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Converted documents held for download, keyed by session id. Entries expire after a fixed
 * time since they were written.
 */
public class ConversionOutputStore {
    private static final Logger logger = Logger.getLogger(ConversionOutputStore.class.getName());

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    private static final long DEFAULT_MAX_ENTRIES = 1_000;

    private final Cache<String, byte[]> cache;

    public ConversionOutputStore() {
        this(DEFAULT_TTL, DEFAULT_MAX_ENTRIES);
    }

    public ConversionOutputStore(Duration ttl, long maxEntries) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .removalListener((String key, byte[] value, RemovalCause cause) ->
                        logger.fine(String.format("Output evicted: session=%s, cause=%s", key, cause)))
                .build();
        logger.info(String.format("ConversionOutputStore initialized: ttl=%s, maxEntries=%d", ttl, maxEntries));
    }

    /**
     * Stores a document under a fresh session id and returns that id.
     */
    public String put(byte[] document) {
        String sessionId = UUID.randomUUID().toString();
        cache.put(sessionId, document);
        return sessionId;
    }

    public Optional<byte[]> get(String sessionId) {
        return Optional.ofNullable(cache.getIfPresent(sessionId));
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public static String outputFilename(String sessionId) {
        return "cradlepoint_config_" + sessionId + ".json";
    }
}
