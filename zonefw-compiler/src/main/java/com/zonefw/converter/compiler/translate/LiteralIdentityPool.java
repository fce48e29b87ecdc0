/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.translate;

import com.zonefw.converter.api.model.target.IpIdentity;
import com.zonefw.converter.api.model.target.PortIdentity;
import com.zonefw.converter.api.model.target.PortIdentity.PortSpan;
import com.zonefw.converter.compiler.id.IdGenerator;
import com.zonefw.converter.compiler.identity.IpAddresses;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Identities for literal hosts and ports that appear directly in ACL rules.
 * Each distinct literal gets exactly one identity, created on first use:
 * {@code IP-10-0-0-1}, {@code PORT-443}, {@code PORT-1000-2000}.
 */
public final class LiteralIdentityPool {

    private final IdGenerator ids;
    private final Map<String, IpIdentity> ipByName = new LinkedHashMap<>();
    private final Map<String, PortIdentity> portByName = new LinkedHashMap<>();

    public LiteralIdentityPool(IdGenerator ids) {
        this.ids = ids;
    }

    /**
     * @return the identity for {@code ip}, or empty if it is not an IP literal
     */
    public Optional<IpIdentity> ip(String ip) {
        if (!IpAddresses.isValid(ip)) {
            return Optional.empty();
        }
        String name = "IP-" + ip.replace('.', '-');
        return Optional.of(ipByName.computeIfAbsent(name,
                n -> IpIdentity.of(ids.nextId("ip-identity", n), n, List.of(ip))));
    }

    public PortIdentity port(int port) {
        return port(port, port);
    }

    public PortIdentity port(int start, int end) {
        String name = start == end ? "PORT-" + start : "PORT-" + start + "-" + end;
        return portByName.computeIfAbsent(name,
                n -> new PortIdentity(ids.nextId("port-identity", n), n, List.of(new PortSpan(start, end))));
    }

    public List<IpIdentity> ipIdentities() {
        return new ArrayList<>(ipByName.values());
    }

    public List<PortIdentity> portIdentities() {
        return new ArrayList<>(portByName.values());
    }
}
