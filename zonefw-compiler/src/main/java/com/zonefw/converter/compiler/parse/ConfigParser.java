/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import com.zonefw.converter.api.model.Diagnostic;
import com.zonefw.converter.api.model.source.ParsedConfig;
import com.zonefw.converter.api.model.source.SecurityZone;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Runs every section parser over the same line sequence and assembles the {@link ParsedConfig}.
 * Sections are independent: each parser makes its own pass, so declaration order between
 * sections does not matter.
 */
public class ConfigParser {
    private static final Logger logger = Logger.getLogger(ConfigParser.class.getName());

    public ParsedConfig parse(ConfigLines lines) {
        List<Diagnostic> diagnostics = new ArrayList<>();

        ZoneParser zoneParser = new ZoneParser();
        zoneParser.parse(lines);

        InterfaceParser interfaceParser = new InterfaceParser(zoneParser.declarations().keySet(), diagnostics);
        interfaceParser.parse(lines);

        ObjectGroupParser objectGroupParser = new ObjectGroupParser(diagnostics);
        objectGroupParser.parse(lines);

        AccessListParser accessListParser = new AccessListParser(diagnostics);
        accessListParser.parse(lines);

        ClassMapParser classMapParser = new ClassMapParser(diagnostics);
        classMapParser.parse(lines);

        PolicyMapParser policyMapParser = new PolicyMapParser(diagnostics);
        policyMapParser.parse(lines);

        ZonePairParser zonePairParser = new ZonePairParser(diagnostics);
        zonePairParser.parse(lines);

        List<SecurityZone> zones = new ArrayList<>();
        for (Map.Entry<String, Integer> declaration : zoneParser.declarations().entrySet()) {
            zones.add(new SecurityZone(declaration.getKey(), declaration.getValue(),
                    interfaceParser.membersOf(declaration.getKey())));
        }

        ParsedConfig parsed = new ParsedConfig(
                zones,
                interfaceParser.interfaces(),
                objectGroupParser.groups(),
                accessListParser.accessLists(),
                classMapParser.classMaps(),
                policyMapParser.policyMaps(),
                zonePairParser.zonePairs(),
                AccessGroupScanner.appliedAccessLists(lines, accessListParser.accessLists().keySet()),
                diagnostics);

        logger.info(String.format("Parsed %d zones, %d interfaces, %d object-groups, %d ACLs, %d class-maps, "
                        + "%d policy-maps, %d zone-pairs from %d lines",
                zones.size(), parsed.interfaces().size(), parsed.objectGroups().size(),
                parsed.accessLists().size(), parsed.classMaps().size(), parsed.policyMaps().size(),
                parsed.zonePairs().size(), lines.size()));
        return parsed;
    }

    public ParsedConfig parse(String text) {
        return parse(ConfigLines.of(text));
    }
}
