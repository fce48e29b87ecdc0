/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.id;

/**
 * Source of {@code _id_} values for zones, policies, forwardings and identities.
 */
public interface IdGenerator {

    /**
     * @param kind entity kind, e.g. {@code zone} or {@code ip-identity}
     * @param name the entity's display name
     * @return a UUID string, unique within one conversion
     */
    String nextId(String kind, String name);
}
