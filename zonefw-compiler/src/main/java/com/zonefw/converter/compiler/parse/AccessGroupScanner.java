/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Finds access lists applied outside class-maps: an {@code access-group NAME} token pair
 * anywhere in the file, or a {@code service-policy}/{@code zone-pair} line that names the list.
 * {@code match access-group name X} inside a class-map does not count.
 */
final class AccessGroupScanner {

    private AccessGroupScanner() {
    }

    static Set<String> appliedAccessLists(ConfigLines lines, Set<String> aclNames) {
        Set<String> applied = new LinkedHashSet<>();
        for (ConfigLine line : lines) {
            if (!line.isDirective()) continue;
            String[] tokens = line.tokens();
            boolean policyLine = false;
            for (int i = 0; i < tokens.length; i++) {
                String token = tokens[i];
                if ("access-group".equals(token) && i + 1 < tokens.length && !"name".equals(tokens[i + 1])) {
                    applied.add(tokens[i + 1]);
                }
                if ("service-policy".equals(token) || "zone-pair".equals(token)) {
                    policyLine = true;
                }
            }
            if (policyLine) {
                for (String token : tokens) {
                    if (aclNames.contains(token)) applied.add(token);
                }
            }
        }
        return applied;
    }
}
