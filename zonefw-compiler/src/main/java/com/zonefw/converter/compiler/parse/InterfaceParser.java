/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import com.zonefw.converter.api.model.Diagnostic;
import com.zonefw.converter.api.model.source.InterfaceConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Parses {@code interface} blocks. A {@code zone-member security} line records the
 * interface's zone and adds the interface to that zone's membership list.
 */
final class InterfaceParser extends BlockParser {
    private static final Logger logger = Logger.getLogger(InterfaceParser.class.getName());

    static final String HEADER = "interface ";
    private static final String ZONE_MEMBER = "zone-member security ";
    private static final String IP_ADDRESS = "ip address ";
    private static final String ACCESS_GROUP = "ip access-group ";

    private final Set<String> declaredZones;
    private final Map<String, InterfaceConfig> interfaces = new LinkedHashMap<>();
    private final Map<String, List<String>> zoneMembers = new LinkedHashMap<>();

    private String name;
    private String zone;
    private String ipAddress;
    private String subnetMask;
    private List<String> accessGroups;

    InterfaceParser(Set<String> declaredZones, List<Diagnostic> diagnostics) {
        super(diagnostics);
        this.declaredZones = declaredZones;
    }

    @Override
    protected boolean openBlock(ConfigLine header) {
        if (!header.startsWith(HEADER)) return false;
        name = header.after(HEADER);
        zone = null;
        ipAddress = null;
        subnetMask = null;
        accessGroups = new ArrayList<>();
        return !name.isEmpty();
    }

    @Override
    protected void onMember(ConfigLine line) {
        if (line.startsWith(ZONE_MEMBER)) {
            String zoneName = firstToken(line.after(ZONE_MEMBER));
            if (zoneName.isEmpty()) return;
            zone = zoneName;
            if (declaredZones.contains(zoneName)) {
                zoneMembers.computeIfAbsent(zoneName, z -> new ArrayList<>()).add(name);
            } else {
                logger.warning("Interface " + name + " joins undeclared zone " + zoneName);
                diagnostics.add(Diagnostic.ignored(line.number(), line.text(),
                        "Interface " + name + " is a member of undeclared zone " + zoneName));
            }
        } else if (line.startsWith(IP_ADDRESS)) {
            String[] parts = line.tokens();
            if (parts.length >= 3) {
                ipAddress = parts[2];
                if (parts.length >= 4) {
                    subnetMask = parts[3];
                }
            }
        } else if (line.startsWith(ACCESS_GROUP)) {
            String acl = firstToken(line.after(ACCESS_GROUP));
            if (!acl.isEmpty()) {
                accessGroups.add(acl);
            }
        }
    }

    @Override
    protected void closeBlock() {
        interfaces.put(name, new InterfaceConfig(name, Optional.ofNullable(zone), Optional.ofNullable(ipAddress),
                Optional.ofNullable(subnetMask), accessGroups));
    }

    @Override
    protected boolean acceptsUnindented(ConfigLine line) {
        return startsWithAny(line, ZONE_MEMBER, IP_ADDRESS, ACCESS_GROUP);
    }

    Map<String, InterfaceConfig> interfaces() {
        return interfaces;
    }

    /**
     * Interfaces that joined the zone, in source order.
     */
    List<String> membersOf(String zoneName) {
        return zoneMembers.getOrDefault(zoneName, List.of());
    }
}
