/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.source;

/**
 * One entry of an object group. Network groups hold {@link Host}, {@link Network},
 * {@link Range} and {@link GroupRef}; service groups hold {@link Port},
 * {@link PortRange} and {@link GroupRef}.
 */
public sealed interface Member {

    /** Transport protocol keyword that prefixes a service entry. */
    enum ServiceProtocol {
        TCP, UDP, TCP_UDP;

        public static ServiceProtocol fromKeyword(String keyword) {
            if (keyword == null) return null;
            return switch (keyword.toLowerCase()) {
                case "tcp" -> TCP;
                case "udp" -> UDP;
                case "tcp-udp" -> TCP_UDP;
                default -> null;
            };
        }

        public boolean coversTcp() {
            return this == TCP || this == TCP_UDP;
        }

        public boolean coversUdp() {
            return this == UDP || this == TCP_UDP;
        }
    }

    record Host(String ip) implements Member {}

    record Network(String ip, String mask) implements Member {}

    record Range(String startIp, String endIp) implements Member {}

    /** A single port, kept as the raw token (number or service name) until identity building. */
    record Port(ServiceProtocol protocol, String token) implements Member {}

    record PortRange(ServiceProtocol protocol, String startToken, String endToken) implements Member {}

    record GroupRef(String name) implements Member {}
}
