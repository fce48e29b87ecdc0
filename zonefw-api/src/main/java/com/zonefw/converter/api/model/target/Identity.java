/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.target;

/**
 * A reusable, named set of addresses or ports referenced by id from filter rules.
 * Identities are immutable once created.
 */
public sealed interface Identity permits IpIdentity, PortIdentity {

    String id();

    String name();
}
