/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.source;

import java.util.List;

/**
 * A {@code zone security} declaration and the interfaces that joined it, in source order.
 */
public record SecurityZone(String name, int lineNumber, List<String> memberInterfaces) {

    public SecurityZone {
        memberInterfaces = List.copyOf(memberInterfaces);
    }
}
