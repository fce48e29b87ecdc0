/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.source;

import java.util.List;
import java.util.Objects;

/**
 * A named, reusable set of network or service literals declared by an
 * {@code object-group} block. Created once per block and read-only afterwards.
 */
public record ObjectGroup(String name, Kind kind, List<Member> members) {

    public enum Kind {
        NETWORK,
        SERVICE;

        /**
         * Maps the keyword following {@code object-group} to a kind.
         *
         * @return the kind, or null for kinds that are not modeled (protocol, icmp-type, ...)
         */
        public static Kind fromKeyword(String keyword) {
            if (keyword == null) return null;
            return switch (keyword.toLowerCase()) {
                case "network" -> NETWORK;
                case "service" -> SERVICE;
                default -> null;
            };
        }
    }

    public ObjectGroup {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        members = List.copyOf(members);
    }

    public boolean isService() {
        return kind == Kind.SERVICE;
    }

    public boolean isNetwork() {
        return kind == Kind.NETWORK;
    }
}
