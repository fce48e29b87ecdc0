/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.source;

import java.util.Optional;

/**
 * A directed {@code zone-pair security} declaration with the policy-map bound to it.
 */
public record ZonePair(String name, String sourceZone, String destinationZone,
                       Optional<String> policyMap, int lineNumber) {

    public ZonePair {
        policyMap = policyMap == null ? Optional.empty() : policyMap;
    }

    public ZonePair withPolicyMap(String policyMapName) {
        return new ZonePair(name, sourceZone, destinationZone, Optional.ofNullable(policyMapName), lineNumber);
    }
}
