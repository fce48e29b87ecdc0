/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.zonefw.converter.api.model.target.ZfwConfiguration;

/**
 * Object counts of a converted configuration.
 */
public record ConversionSummary(
        @JsonProperty("zones") int zones,
        @JsonProperty("filter_policies") int filterPolicies,
        @JsonProperty("forwardings") int forwardings,
        @JsonProperty("ip_identities") int ipIdentities,
        @JsonProperty("mac_identities") int macIdentities,
        @JsonProperty("port_identities") int portIdentities
) {
    public static ConversionSummary of(ZfwConfiguration configuration) {
        return new ConversionSummary(
                configuration.zones().size(),
                configuration.filterPolicies().size(),
                configuration.forwardings().size(),
                configuration.ipIdentities().size(),
                0,
                configuration.portIdentities().size());
    }
}
