/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.assembly;

import com.zonefw.converter.api.model.source.ParsedConfig;
import com.zonefw.converter.api.model.source.SecurityZone;
import com.zonefw.converter.api.model.source.ZonePair;
import com.zonefw.converter.api.model.target.FilterPolicy;
import com.zonefw.converter.api.model.target.RuleAction;
import com.zonefw.converter.api.model.target.Zone;
import com.zonefw.converter.api.model.target.ZoneDevice;
import com.zonefw.converter.api.model.target.ZoneForwarding;
import com.zonefw.converter.compiler.id.IdGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds zones and the forwardings between them.
 */
public class ForwardingAssembler {
    private static final Logger logger = Logger.getLogger(ForwardingAssembler.class.getName());

    public void assembleZones(ParsedConfig parsed, IdGenerator ids, ZfwModelBuilder model) {
        for (SecurityZone zone : parsed.zones()) {
            List<ZoneDevice> devices = new ArrayList<>();
            for (String iface : zone.memberInterfaces()) {
                devices.add(new ZoneDevice.InterfaceDevice(ids.nextId("zone-device", iface), iface));
            }
            model.addZone(new Zone(ids.nextId("zone", zone.name()), zone.name(), devices));
        }
    }

    /**
     * One forwarding per zone pair. Unknown zones resolve to an empty id; an unbound or unknown
     * policy-map falls back to {@code Default Deny All} when that policy exists.
     */
    public void assembleForwardings(ParsedConfig parsed, IdGenerator ids, ZfwModelBuilder model) {
        String fallbackPolicy = model.policyNamed(FilterPolicy.DEFAULT_DENY_ALL).map(FilterPolicy::id).orElse("");
        for (ZonePair pair : parsed.zonePairs().values()) {
            String srcZoneId = model.zoneNamed(pair.sourceZone()).map(Zone::id).orElse("");
            String dstZoneId = model.zoneNamed(pair.destinationZone()).map(Zone::id).orElse("");
            if (srcZoneId.isEmpty() || dstZoneId.isEmpty()) {
                logger.warning("Zone-pair " + pair.name() + " references undeclared zone "
                        + (srcZoneId.isEmpty() ? pair.sourceZone() : pair.destinationZone()));
            }
            String policyId = pair.policyMap()
                    .flatMap(model::policyNamed)
                    .map(FilterPolicy::id)
                    .orElse(fallbackPolicy);
            model.addForwarding(new ZoneForwarding(ids.nextId("forwarding", pair.name()),
                    srcZoneId, dstZoneId, true, policyId));
        }
    }

    /**
     * Adds a zone matching every WAN device and forwards each pre-existing zone to it through an
     * allow-all policy, reusing {@code Default Allow All} or {@code ALLOW ALL} when present.
     */
    public void addInternetZone(String zoneName, IdGenerator ids, ZfwModelBuilder model) {
        List<Zone> existing = new ArrayList<>(model.zones());
        Zone internet = new Zone(ids.nextId("zone", zoneName), zoneName, List.of(ZoneDevice.DeviceTrigger.wan()));
        model.addZone(internet);

        FilterPolicy allow = model.policyNamed(FilterPolicy.DEFAULT_ALLOW_ALL)
                .or(() -> model.policyNamed(FilterPolicy.ALLOW_ALL))
                .orElse(null);
        if (allow == null) {
            allow = new FilterPolicy(ids.nextId("filter-policy", FilterPolicy.ALLOW_ALL), FilterPolicy.ALLOW_ALL,
                    RuleAction.ALLOW, List.of());
            model.addPolicy(allow);
        }

        for (Zone zone : existing) {
            model.addForwarding(new ZoneForwarding(ids.nextId("forwarding", zone.name() + "->" + zoneName),
                    zone.id(), internet.id(), true, allow.id()));
        }
        logger.info(String.format("Added internet zone %s with %d forwardings", zoneName, existing.size()));
    }
}
