/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.target;

import java.util.ArrayList;
import java.util.List;

public record Zone(String id, String name, List<ZoneDevice> devices) {

    public Zone {
        devices = List.copyOf(devices);
    }

    public Zone withDevice(ZoneDevice device) {
        List<ZoneDevice> extended = new ArrayList<>(devices);
        extended.add(device);
        return new Zone(id, name, extended);
    }
}
