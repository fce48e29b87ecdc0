/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.target;

import java.util.List;
import java.util.Optional;

/**
 * The converted zone firewall model, in emission order.
 */
public record ZfwConfiguration(
        List<Zone> zones,
        List<FilterPolicy> filterPolicies,
        List<ZoneForwarding> forwardings,
        List<IpIdentity> ipIdentities,
        List<PortIdentity> portIdentities
) {
    public ZfwConfiguration {
        zones = List.copyOf(zones);
        filterPolicies = List.copyOf(filterPolicies);
        forwardings = List.copyOf(forwardings);
        ipIdentities = List.copyOf(ipIdentities);
        portIdentities = List.copyOf(portIdentities);
    }

    public Optional<FilterPolicy> policyNamed(String name) {
        return filterPolicies.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public Optional<Zone> zoneNamed(String name) {
        return zones.stream().filter(z -> z.name().equals(name)).findFirst();
    }

    public Optional<IpIdentity> ipIdentityNamed(String name) {
        return ipIdentities.stream().filter(i -> i.name().equals(name)).findFirst();
    }

    public Optional<PortIdentity> portIdentityNamed(String name) {
        return portIdentities.stream().filter(i -> i.name().equals(name)).findFirst();
    }
}
