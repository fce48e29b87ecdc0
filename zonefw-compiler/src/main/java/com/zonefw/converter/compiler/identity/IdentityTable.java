/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.identity;

import com.zonefw.converter.api.model.target.IpIdentity;
import com.zonefw.converter.api.model.target.PortIdentity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Identities derived from object groups, built once per conversion and read-only afterwards.
 *
 * <p>Port identities of a mixed TCP/UDP service group are reachable under
 * {@code <group>-TCP} and {@code <group>-UDP}; the bare group name resolves to the TCP one.
 */
public final class IdentityTable {

    public static final int TCP = 6;
    public static final int UDP = 17;
    private static final List<Integer> DEFAULT_PROTOCOLS = List.of(TCP);

    private final List<IpIdentity> ipIdentities;
    private final List<PortIdentity> portIdentities;
    private final Map<String, IpIdentity> ipByGroup;
    private final Map<String, PortIdentity> portByKey;
    private final Map<String, List<Integer>> serviceProtocols;

    IdentityTable(List<IpIdentity> ipIdentities,
                  List<PortIdentity> portIdentities,
                  Map<String, IpIdentity> ipByGroup,
                  Map<String, PortIdentity> portByKey,
                  Map<String, List<Integer>> serviceProtocols) {
        this.ipIdentities = List.copyOf(ipIdentities);
        this.portIdentities = List.copyOf(portIdentities);
        this.ipByGroup = Collections.unmodifiableMap(new LinkedHashMap<>(ipByGroup));
        this.portByKey = Collections.unmodifiableMap(new LinkedHashMap<>(portByKey));
        this.serviceProtocols = Collections.unmodifiableMap(new LinkedHashMap<>(serviceProtocols));
    }

    public static IdentityTable empty() {
        return new IdentityTable(List.of(), List.of(), Map.of(), Map.of(), Map.of());
    }

    public List<IpIdentity> ipIdentities() {
        return ipIdentities;
    }

    public List<PortIdentity> portIdentities() {
        return portIdentities;
    }

    public Optional<IpIdentity> ipIdentityForGroup(String group) {
        return Optional.ofNullable(ipByGroup.get(group));
    }

    /**
     * @param key a service group name, optionally suffixed with {@code -TCP} or {@code -UDP}
     */
    public Optional<PortIdentity> portIdentityFor(String key) {
        return Optional.ofNullable(portByKey.get(key));
    }

    /**
     * Port identity carrying the given protocol's spans of a service group.
     */
    public Optional<PortIdentity> portIdentityFor(String group, int protocol) {
        if (isMixed(group)) {
            return portIdentityFor(group + (protocol == UDP ? "-UDP" : "-TCP"));
        }
        return portIdentityFor(group);
    }

    public boolean isServiceGroup(String group) {
        return serviceProtocols.containsKey(group);
    }

    /**
     * Protocol ids carried by a service group: {@code [6]}, {@code [17]} or {@code [6, 17]}.
     * Unknown groups default to TCP.
     */
    public List<Integer> protocolsFor(String group) {
        return serviceProtocols.getOrDefault(group, DEFAULT_PROTOCOLS);
    }

    public boolean isMixed(String group) {
        return protocolsFor(group).size() > 1;
    }
}
