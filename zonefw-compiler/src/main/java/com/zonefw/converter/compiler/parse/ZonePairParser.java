/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import com.zonefw.converter.api.model.Diagnostic;
import com.zonefw.converter.api.model.source.ZonePair;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Collects {@code zone-pair security} declarations and binds {@code service-policy type inspect}
 * directives to them.
 *
 * <p>Binding runs in two passes: the first records every declaration and directive with its
 * line number, the second attaches each directive to the nearest zone pair declared before it.
 */
final class ZonePairParser {
    private static final Logger logger = Logger.getLogger(ZonePairParser.class.getName());

    static final String HEADER = "zone-pair security ";
    static final String SERVICE_POLICY = "service-policy type inspect ";

    private final List<Diagnostic> diagnostics;
    private final Map<String, ZonePair> zonePairs = new LinkedHashMap<>();

    ZonePairParser(List<Diagnostic> diagnostics) {
        this.diagnostics = diagnostics;
    }

    private record Binding(ConfigLine line, String policyMap) {}

    void parse(ConfigLines lines) {
        List<ZonePair> declared = new ArrayList<>();
        List<Binding> bindings = new ArrayList<>();

        for (ConfigLine line : lines) {
            if (!line.isDirective()) continue;
            if (line.startsWith(HEADER)) {
                ZonePair pair = declaration(line);
                if (pair != null) declared.add(pair);
            } else if (line.startsWith(SERVICE_POLICY)) {
                String policyMap = BlockParser.firstToken(line.after(SERVICE_POLICY));
                if (!policyMap.isEmpty()) bindings.add(new Binding(line, policyMap));
            }
        }

        for (ZonePair pair : declared) {
            zonePairs.put(pair.name(), pair);
        }
        for (Binding binding : bindings) {
            ZonePair owner = nearestBefore(declared, binding.line().number());
            if (owner == null) {
                logger.warning("service-policy " + binding.policyMap() + " at line "
                        + binding.line().number() + " has no preceding zone-pair");
                diagnostics.add(Diagnostic.ignored(binding.line().number(), binding.line().text(),
                        "service-policy " + binding.policyMap() + " is not preceded by a zone-pair"));
                continue;
            }
            zonePairs.put(owner.name(), zonePairs.get(owner.name()).withPolicyMap(binding.policyMap()));
        }
    }

    private static ZonePair declaration(ConfigLine line) {
        String[] parts = line.tokens();
        // zone-pair security NAME source S destination D
        if (parts.length < 3) return null;
        String source = null;
        String destination = null;
        for (int i = 3; i + 1 < parts.length; i += 2) {
            if ("source".equals(parts[i])) source = parts[i + 1];
            else if ("destination".equals(parts[i])) destination = parts[i + 1];
        }
        if (source == null || destination == null) return null;
        return new ZonePair(parts[2], source, destination, Optional.empty(), line.number());
    }

    private static ZonePair nearestBefore(List<ZonePair> declared, int lineNumber) {
        ZonePair best = null;
        for (ZonePair pair : declared) {
            if (pair.lineNumber() < lineNumber && (best == null || pair.lineNumber() > best.lineNumber())) {
                best = pair;
            }
        }
        return best;
    }

    Map<String, ZonePair> zonePairs() {
        return zonePairs;
    }
}
