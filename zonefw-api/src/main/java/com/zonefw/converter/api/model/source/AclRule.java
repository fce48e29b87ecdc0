/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.source;

import java.util.Objects;
import java.util.Optional;

/**
 * One parsed {@code permit|deny} line of an extended access list.
 *
 * @param serviceGroup  service object-group supplying the destination ports, if any
 * @param portMatch     literal destination port qualifier, if any
 * @param lineNumber    1-based line in the source configuration
 */
public record AclRule(
        Action action,
        Protocol protocol,
        AclEndpoint source,
        AclEndpoint destination,
        Optional<String> serviceGroup,
        Optional<PortMatch> portMatch,
        int lineNumber
) {
    public enum Action {
        ALLOW("allow"),
        DENY("deny");

        private final String wireName;

        Action(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Action fromKeyword(String keyword) {
            return "permit".equalsIgnoreCase(keyword) ? ALLOW : DENY;
        }
    }

    public AclRule {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        serviceGroup = serviceGroup == null ? Optional.empty() : serviceGroup;
        portMatch = portMatch == null ? Optional.empty() : portMatch;
    }
}
