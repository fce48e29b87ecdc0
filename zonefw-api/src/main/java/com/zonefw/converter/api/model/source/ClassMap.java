/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.source;

import java.util.List;

/**
 * An inspect class-map. Traffic belongs to the class when it matches any of the
 * referenced access lists or object groups.
 */
public record ClassMap(String name, String matchType, List<String> aclReferences, List<String> objectGroupReferences) {

    public ClassMap {
        aclReferences = List.copyOf(aclReferences);
        objectGroupReferences = List.copyOf(objectGroupReferences);
    }
}
