/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.target;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Zone membership: either a concrete interface or a device-type trigger predicate.
 */
public sealed interface ZoneDevice {

    record InterfaceDevice(
            @JsonProperty("_id_") String id,
            @JsonProperty("name") String name
    ) implements ZoneDevice {

        @JsonProperty("type")
        public String type() {
            return "interface";
        }
    }

    record DeviceTrigger(
            @JsonProperty("trigger_field") String field,
            @JsonProperty("trigger_group") String group,
            @JsonProperty("trigger_neg") boolean negated,
            @JsonProperty("trigger_predicate") String predicate,
            @JsonProperty("trigger_value") String value
    ) implements ZoneDevice {

        /** Matches every WAN-type device. */
        public static DeviceTrigger wan() {
            return new DeviceTrigger("type", "wan", false, "is", "");
        }
    }
}
