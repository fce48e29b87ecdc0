/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects {@code zone security NAME} declarations in source order.
 */
final class ZoneParser {

    static final String HEADER = "zone security ";

    private final Map<String, Integer> declarations = new LinkedHashMap<>();

    void parse(ConfigLines lines) {
        for (ConfigLine line : lines) {
            if (!line.isDirective() || !line.startsWith(HEADER)) continue;
            String name = BlockParser.firstToken(line.after(HEADER));
            if (!name.isEmpty()) {
                declarations.putIfAbsent(name, line.number());
            }
        }
    }

    /**
     * Zone names mapped to the line that declared them.
     */
    Map<String, Integer> declarations() {
        return declarations;
    }
}
