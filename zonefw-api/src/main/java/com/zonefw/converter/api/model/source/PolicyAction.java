/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.source;

/**
 * Action configured for a class inside an inspect policy-map.
 */
public sealed interface PolicyAction {

    /** {@code inspect [parameter-map]}; the parameter is empty when none is given. */
    record Inspect(String parameter) implements PolicyAction {}

    record Drop() implements PolicyAction {}

    record Pass() implements PolicyAction {}
}
