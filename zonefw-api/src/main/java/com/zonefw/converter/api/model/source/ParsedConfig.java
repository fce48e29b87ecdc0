/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.source;

import com.zonefw.converter.api.model.Diagnostic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The normalized source model produced by the section parsers.
 *
 * <p>Maps are keyed by name and keep declaration order. {@code appliedAccessLists}
 * holds the ACL names referenced outside class-maps (interface {@code access-group},
 * zone-pair or service-policy lines).
 */
public record ParsedConfig(
        List<SecurityZone> zones,
        Map<String, InterfaceConfig> interfaces,
        Map<String, ObjectGroup> objectGroups,
        Map<String, AccessList> accessLists,
        Map<String, ClassMap> classMaps,
        Map<String, PolicyMap> policyMaps,
        Map<String, ZonePair> zonePairs,
        Set<String> appliedAccessLists,
        List<Diagnostic> diagnostics
) {
    public ParsedConfig {
        zones = List.copyOf(zones);
        interfaces = copy(interfaces);
        objectGroups = copy(objectGroups);
        accessLists = copy(accessLists);
        classMaps = copy(classMaps);
        policyMaps = copy(policyMaps);
        zonePairs = copy(zonePairs);
        appliedAccessLists = Set.copyOf(appliedAccessLists);
        diagnostics = List.copyOf(diagnostics);
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * Number of rules in the named access list, or 0 if it is not declared.
     */
    public int aclRuleCount(String aclName) {
        AccessList acl = aclName == null ? null : accessLists.get(aclName);
        return acl == null ? 0 : acl.size();
    }
}
