/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.target;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Port identity: an ordered list of inclusive port spans.
 */
public record PortIdentity(
        @JsonProperty("_id_") String id,
        @JsonProperty("name") String name,
        @JsonProperty("members") List<PortSpan> members
) implements Identity {

    public PortIdentity {
        members = List.copyOf(members);
    }

    public record PortSpan(@JsonProperty("start") int start, @JsonProperty("end") int end)
            implements Comparable<PortSpan> {

        public static PortSpan single(int port) {
            return new PortSpan(port, port);
        }

        @Override
        public int compareTo(PortSpan other) {
            int byStart = Integer.compare(start, other.start);
            return byStart != 0 ? byStart : Integer.compare(end, other.end);
        }
    }
}
