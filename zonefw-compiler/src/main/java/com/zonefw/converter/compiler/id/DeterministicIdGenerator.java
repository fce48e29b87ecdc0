/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.id;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Name-based (version 3) UUIDs derived from kind, name and how many times that pair was
 * requested before. The same input converted twice yields byte-identical output.
 * Not thread-safe; one instance per conversion.
 */
public final class DeterministicIdGenerator implements IdGenerator {

    private final String namespace;
    private final Map<String, Integer> occurrences = new HashMap<>();

    public DeterministicIdGenerator() {
        this("zonefw");
    }

    public DeterministicIdGenerator(String namespace) {
        this.namespace = namespace;
    }

    @Override
    public String nextId(String kind, String name) {
        String key = kind + '\u0000' + name;
        int occurrence = occurrences.merge(key, 1, Integer::sum);
        String seed = namespace + '\u0000' + key + '\u0000' + occurrence;
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
