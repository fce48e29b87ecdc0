/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.source;

import java.util.List;
import java.util.Optional;

public record InterfaceConfig(
        String name,
        Optional<String> zone,
        Optional<String> ipAddress,
        Optional<String> subnetMask,
        List<String> accessGroups
) {
    public InterfaceConfig {
        zone = zone == null ? Optional.empty() : zone;
        ipAddress = ipAddress == null ? Optional.empty() : ipAddress;
        subnetMask = subnetMask == null ? Optional.empty() : subnetMask;
        accessGroups = List.copyOf(accessGroups);
    }
}
