/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.target;

import java.util.List;

/**
 * A named, prioritized rule list with a default action, bound to zone forwardings.
 */
public record FilterPolicy(String id, String name, RuleAction defaultAction, List<FilterRule> rules) {

    public static final String ALLOW_ALL = "ALLOW ALL";
    public static final String DEFAULT_ALLOW_ALL = "Default Allow All";
    public static final String DEFAULT_DENY_ALL = "Default Deny All";

    public FilterPolicy {
        rules = List.copyOf(rules);
    }

    /**
     * True for the policies that the target device expects at index 0.
     */
    public boolean isAllowAll() {
        return ALLOW_ALL.equals(name) || DEFAULT_ALLOW_ALL.equals(name);
    }
}
