/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.source;

import java.util.List;

/**
 * An {@code ip access-list extended} block and its parsed rules, in source order.
 */
public record AccessList(String name, List<AclRule> rules) {

    public AccessList {
        rules = List.copyOf(rules);
    }

    public int size() {
        return rules.size();
    }
}
