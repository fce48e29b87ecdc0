/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.target;

import java.util.List;
import java.util.Objects;

/**
 * A single allow/deny rule of a filter policy.
 *
 * @param protocols numeric protocol ids; empty matches any protocol
 */
public record FilterRule(
        RuleAction action,
        String ipVersion,
        String name,
        int priority,
        List<Integer> protocols,
        RuleEndpoint src,
        RuleEndpoint dst
) {
    public static final String IP4 = "ip4";

    public FilterRule {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(name, "name");
        protocols = List.copyOf(protocols);
        src = src == null ? RuleEndpoint.ANY : src;
        dst = dst == null ? RuleEndpoint.ANY : dst;
    }

    public static FilterRule ip4(RuleAction action, String name, int priority, List<Integer> protocols,
                                 RuleEndpoint src, RuleEndpoint dst) {
        return new FilterRule(action, IP4, name, priority, protocols, src, dst);
    }

    public FilterRule withName(String newName) {
        return new FilterRule(action, ipVersion, newName, priority, protocols, src, dst);
    }

    public FilterRule withEndpoints(RuleEndpoint newSrc, RuleEndpoint newDst) {
        return new FilterRule(action, ipVersion, name, priority, protocols, newSrc, newDst);
    }
}
