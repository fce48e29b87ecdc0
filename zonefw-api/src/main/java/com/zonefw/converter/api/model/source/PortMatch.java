/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.source;

/**
 * Literal destination port qualifier of an ACL rule ({@code eq P} or {@code range P1 P2}).
 */
public sealed interface PortMatch {

    /** Token as written; a number, a well-known service name or a service group name. */
    record Eq(String token) implements PortMatch {}

    record Range(String startToken, String endToken) implements PortMatch {}
}
