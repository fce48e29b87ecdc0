/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.id;

import java.util.UUID;

/**
 * Random (version 4) UUIDs. Two runs over the same input produce different ids.
 */
public final class RandomIdGenerator implements IdGenerator {

    @Override
    public String nextId(String kind, String name) {
        return UUID.randomUUID().toString();
    }
}
