/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.translate;

import com.zonefw.converter.api.model.source.AclEndpoint;
import com.zonefw.converter.api.model.source.AclRule;
import com.zonefw.converter.api.model.source.PortMatch;

/**
 * Display names for translated rules.
 */
public final class RuleNamer {

    private static final String[] GROUP_PREFIXES = {"NET-", "HOSTG-", "HOST-", "NETG-"};

    private RuleNamer() {
    }

    /**
     * {@code ACL_WEB_IN} becomes {@code WEB-IN}.
     */
    public static String cleanAclName(String aclName) {
        return aclName.replace("ACL_", "").replace("ACL-", "").replace('_', '-');
    }

    /**
     * @param aclName      owning access list, or null for rules outside one
     * @param ordinal      1-based position in the ACL, or 0 to leave the name unnumbered
     * @param aclRuleCount number of rules in the owning ACL
     */
    public static String name(AclRule rule, String destinationZone, String aclName, int ordinal, int aclRuleCount) {
        if (aclName != null) {
            String clean = cleanAclName(aclName);
            return aclRuleCount > 1 && ordinal > 0 ? clean + "-" + ordinal : clean;
        }
        String zone = destinationZone == null || destinationZone.isEmpty() ? "ANY" : destinationZone;
        return zone + " " + describeDestination(rule);
    }

    private static String describeDestination(AclRule rule) {
        if (rule.portMatch().isPresent()) {
            PortMatch port = rule.portMatch().get();
            if (port instanceof PortMatch.Eq eq) return eq.token();
            if (port instanceof PortMatch.Range range) return range.startToken() + "-" + range.endToken();
        }
        AclEndpoint destination = rule.destination();
        if (destination instanceof AclEndpoint.Group group) {
            return normalizeGroup(group.name());
        }
        if (destination instanceof AclEndpoint.Host host) {
            return normalizeGroup(host.ip().replace('.', '-'));
        }
        if (!rule.protocol().isAny()) {
            return rule.protocol().keyword().toUpperCase();
        }
        return "ANY";
    }

    private static String normalizeGroup(String name) {
        String result = name.replace("object-group", "").replace("service-group", "");
        for (String prefix : GROUP_PREFIXES) {
            result = result.replace(prefix, "");
        }
        result = result.strip();
        return result.isEmpty() ? "GROUP" : result.toUpperCase();
    }
}
