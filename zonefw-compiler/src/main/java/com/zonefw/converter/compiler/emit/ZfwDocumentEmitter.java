/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.emit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zonefw.converter.api.model.target.FilterPolicy;
import com.zonefw.converter.api.model.target.FilterRule;
import com.zonefw.converter.api.model.target.FirmwareMetadata;
import com.zonefw.converter.api.model.target.IpIdentity;
import com.zonefw.converter.api.model.target.PortIdentity;
import com.zonefw.converter.api.model.target.RuleEndpoint;
import com.zonefw.converter.api.model.target.ZfwConfiguration;
import com.zonefw.converter.api.model.target.Zone;
import com.zonefw.converter.api.model.target.ZoneDevice;
import com.zonefw.converter.api.model.target.ZoneForwarding;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes a {@link ZfwConfiguration} into the exported document layout:
 *
 * <pre>
 * { "configuration": [ { "security": { "zfw": { zones, filter_policies, forwardings } },
 *                        "identities": { ip, port, mac } },
 *                      [ path ordering ] ],
 *   firmware_version, firmware_build_timestamp, firmware_multi_image,
 *   config_encryption_id, export_type }
 * </pre>
 *
 * Zones, policies and forwardings are objects keyed by id. Rules are keyed {@code "0".."n"}.
 * Identity reference lists and protocol lists become {@code {"0": {"identity": x}}}, or
 * {@code []} when empty. Allow-all policies are written before every other policy.
 */
public class ZfwDocumentEmitter {

    private static final String[][] PATH_ORDERING = {
            {"forwardings", "00000003-9532-3d3e-968c-e2f54a0cad18"},
            {"forwardings", "00000002-9532-3d3e-968c-e2f54a0cad18"},
            {"forwardings", "00000001-9532-3d3e-968c-e2f54a0cad18"},
            {"forwardings", "00000000-9532-3d3e-968c-e2f54a0cad18"},
            {"filter_policies", "00000001-77db-3b20-980e-2de482869073"},
            {"filter_policies", "00000000-77db-3b20-980e-2de482869073"},
            {"zones", "00000004-695c-3d87-95cb-d0ee2029d0b5"},
            {"zones", "00000003-695c-3d87-95cb-d0ee2029d0b5"},
            {"zones", "00000002-695c-3d87-95cb-d0ee2029d0b5"},
    };

    private final ObjectMapper mapper;

    public ZfwDocumentEmitter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode emit(ZfwConfiguration configuration, FirmwareMetadata firmware) {
        ObjectNode zfw = mapper.createObjectNode();
        zfw.set("zones", zones(configuration.zones()));
        zfw.set("filter_policies", policies(configuration.filterPolicies()));
        zfw.set("forwardings", forwardings(configuration.forwardings()));

        ObjectNode section = mapper.createObjectNode();
        section.putObject("security").set("zfw", zfw);
        section.set("identities", identities(configuration.ipIdentities(), configuration.portIdentities()));

        ObjectNode document = mapper.createObjectNode();
        ArrayNode wrapper = document.putArray("configuration");
        wrapper.add(section);
        wrapper.add(pathOrdering());
        document.put("firmware_version", firmware.firmwareVersion());
        document.put("firmware_build_timestamp", firmware.firmwareBuildTimestamp());
        document.put("firmware_multi_image", firmware.firmwareMultiImage());
        document.put("config_encryption_id", firmware.configEncryptionId());
        document.put("export_type", firmware.exportType());
        return document;
    }

    private ObjectNode zones(List<Zone> zones) {
        ObjectNode node = mapper.createObjectNode();
        for (Zone zone : zones) {
            ObjectNode z = node.putObject(zone.id());
            z.put("_id_", zone.id());
            z.put("name", zone.name());
            if (!zone.devices().isEmpty()) {
                ArrayNode devices = z.putArray("devices");
                for (ZoneDevice device : zone.devices()) {
                    devices.add(mapper.valueToTree(device));
                }
            }
        }
        return node;
    }

    /**
     * Allow-all policies first, then the rest, each group in insertion order.
     */
    static List<FilterPolicy> emissionOrder(List<FilterPolicy> policies) {
        List<FilterPolicy> ordered = new ArrayList<>(policies.size());
        for (FilterPolicy policy : policies) {
            if (policy.isAllowAll()) ordered.add(policy);
        }
        for (FilterPolicy policy : policies) {
            if (!policy.isAllowAll()) ordered.add(policy);
        }
        return ordered;
    }

    private ObjectNode policies(List<FilterPolicy> policies) {
        ObjectNode node = mapper.createObjectNode();
        for (FilterPolicy policy : emissionOrder(policies)) {
            ObjectNode p = node.putObject(policy.id());
            p.put("_id_", policy.id());
            p.put("name", policy.name());
            p.put("default_action", policy.defaultAction().wireName());
            if (policy.rules().isEmpty()) {
                p.putArray("rules");
            } else {
                ObjectNode rules = p.putObject("rules");
                for (int i = 0; i < policy.rules().size(); i++) {
                    rules.set(String.valueOf(i), rule(policy.rules().get(i)));
                }
            }
        }
        return node;
    }

    private ObjectNode rule(FilterRule rule) {
        ObjectNode node = mapper.createObjectNode();
        node.put("action", rule.action().wireName());
        node.put("ip_version", rule.ipVersion());
        node.put("name", rule.name());
        node.put("priority", rule.priority());
        node.putArray("app_sets");
        if (rule.protocols().isEmpty()) {
            node.putArray("protocols");
        } else {
            ObjectNode protocols = node.putObject("protocols");
            for (int i = 0; i < rule.protocols().size(); i++) {
                protocols.putObject(String.valueOf(i)).put("identity", rule.protocols().get(i));
            }
        }
        node.set("dst", endpoint(rule.dst()));
        node.set("src", endpoint(rule.src()));
        return node;
    }

    private ObjectNode endpoint(RuleEndpoint endpoint) {
        ObjectNode node = mapper.createObjectNode();
        node.set("ip", identityRefs(endpoint.ip()));
        node.set("port", identityRefs(endpoint.port()));
        node.set("mac", identityRefs(endpoint.mac()));
        return node;
    }

    private JsonNode identityRefs(List<String> ids) {
        if (ids.isEmpty()) {
            return mapper.createArrayNode();
        }
        ObjectNode refs = mapper.createObjectNode();
        for (int i = 0; i < ids.size(); i++) {
            refs.putObject(String.valueOf(i)).put("identity", ids.get(i));
        }
        return refs;
    }

    private ObjectNode forwardings(List<ZoneForwarding> forwardings) {
        ObjectNode node = mapper.createObjectNode();
        for (ZoneForwarding forwarding : forwardings) {
            node.set(forwarding.id(), mapper.valueToTree(forwarding));
        }
        return node;
    }

    private ObjectNode identities(List<IpIdentity> ip, List<PortIdentity> port) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode ipNode = node.putArray("ip");
        ip.forEach(identity -> ipNode.add(mapper.valueToTree(identity)));
        ArrayNode portNode = node.putArray("port");
        port.forEach(identity -> portNode.add(mapper.valueToTree(identity)));
        node.putArray("mac");
        return node;
    }

    private ArrayNode pathOrdering() {
        ArrayNode paths = mapper.createArrayNode();
        for (String[] entry : PATH_ORDERING) {
            paths.addArray().add("security").add("zfw").add(entry[0]).add(entry[1]);
        }
        return paths;
    }
}
