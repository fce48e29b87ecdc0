/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.target;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Directed binding of traffic from one zone to another through a filter policy.
 * Unresolved zone or policy references are empty strings.
 */
public record ZoneForwarding(
        @JsonProperty("_id_") String id,
        @JsonProperty("src_zone_id") String srcZoneId,
        @JsonProperty("dst_zone_id") String dstZoneId,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("filter_policy_id") String filterPolicyId
) {}
