/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.target;

import java.util.List;

/**
 * One side of a filter rule: identity ids for addresses, ports and MACs.
 * An empty list means "any".
 */
public record RuleEndpoint(List<String> ip, List<String> port, List<String> mac) {

    public static final RuleEndpoint ANY = new RuleEndpoint(List.of(), List.of(), List.of());

    public RuleEndpoint {
        ip = List.copyOf(ip);
        port = List.copyOf(port);
        mac = List.copyOf(mac);
    }

    public static RuleEndpoint of(List<String> ip, List<String> port) {
        return new RuleEndpoint(ip, port, List.of());
    }

    public RuleEndpoint withIp(List<String> newIp) {
        return new RuleEndpoint(newIp, port, mac);
    }

    public RuleEndpoint withPort(List<String> newPort) {
        return new RuleEndpoint(ip, newPort, mac);
    }
}
