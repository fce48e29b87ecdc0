/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.assembly;

import com.zonefw.converter.api.model.target.FilterPolicy;
import com.zonefw.converter.api.model.target.IpIdentity;
import com.zonefw.converter.api.model.target.PortIdentity;
import com.zonefw.converter.api.model.target.ZfwConfiguration;
import com.zonefw.converter.api.model.target.Zone;
import com.zonefw.converter.api.model.target.ZoneForwarding;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Working set of zones, policies and forwardings while the assemblers run.
 * Insertion order is emission order.
 */
public final class ZfwModelBuilder {

    private final List<Zone> zones = new ArrayList<>();
    private final List<FilterPolicy> policies = new ArrayList<>();
    private final List<ZoneForwarding> forwardings = new ArrayList<>();

    public ZfwModelBuilder addZone(Zone zone) {
        zones.add(zone);
        return this;
    }

    public ZfwModelBuilder addPolicy(FilterPolicy policy) {
        policies.add(policy);
        return this;
    }

    public ZfwModelBuilder addForwarding(ZoneForwarding forwarding) {
        forwardings.add(forwarding);
        return this;
    }

    public List<Zone> zones() {
        return zones;
    }

    public List<FilterPolicy> policies() {
        return policies;
    }

    public List<ZoneForwarding> forwardings() {
        return forwardings;
    }

    public Optional<Zone> zoneNamed(String name) {
        return zones.stream().filter(z -> z.name().equals(name)).findFirst();
    }

    public Optional<FilterPolicy> policyNamed(String name) {
        return policies.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public ZfwConfiguration build(List<IpIdentity> ipIdentities, List<PortIdentity> portIdentities) {
        return new ZfwConfiguration(zones, policies, forwardings, ipIdentities, portIdentities);
    }
}
