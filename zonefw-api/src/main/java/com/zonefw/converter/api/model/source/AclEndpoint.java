/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.source;

/**
 * Address side of an ACL rule. Exactly one form applies per side.
 */
public sealed interface AclEndpoint {

    Any ANY = new Any();

    record Any() implements AclEndpoint {}

    record Host(String ip) implements AclEndpoint {}

    record Group(String name) implements AclEndpoint {}
}
