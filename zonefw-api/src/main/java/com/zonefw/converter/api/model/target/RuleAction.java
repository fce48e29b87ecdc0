/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.target;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RuleAction {
    ALLOW("allow"),
    DENY("deny");

    private final String wireName;

    RuleAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
