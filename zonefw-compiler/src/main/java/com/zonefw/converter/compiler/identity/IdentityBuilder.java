/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.identity;

import com.zonefw.converter.api.model.Diagnostic;
import com.zonefw.converter.api.model.source.Member;
import com.zonefw.converter.api.model.source.ObjectGroup;
import com.zonefw.converter.api.model.target.IpIdentity;
import com.zonefw.converter.api.model.target.PortIdentity;
import com.zonefw.converter.api.model.target.PortIdentity.PortSpan;
import com.zonefw.converter.compiler.id.IdGenerator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Turns object groups into IP and port identities.
 *
 * <p>Network groups become one {@link IpIdentity} each when at least one member is a valid
 * address. Service groups are split into TCP and UDP span sets; a group with both becomes two
 * {@link PortIdentity} records named {@code <group>-TCP} and {@code <group>-UDP}.
 * Nested group references are inlined; reference cycles are cut at the first repeat.
 */
public class IdentityBuilder {
    private static final Logger logger = Logger.getLogger(IdentityBuilder.class.getName());

    private final IdGenerator ids;
    private final List<Diagnostic> diagnostics;

    public IdentityBuilder(IdGenerator ids, List<Diagnostic> diagnostics) {
        this.ids = ids;
        this.diagnostics = diagnostics;
    }

    public IdentityTable build(Map<String, ObjectGroup> groups) {
        List<IpIdentity> ipIdentities = new ArrayList<>();
        List<PortIdentity> portIdentities = new ArrayList<>();
        Map<String, IpIdentity> ipByGroup = new LinkedHashMap<>();
        Map<String, PortIdentity> portByKey = new LinkedHashMap<>();
        Map<String, List<Integer>> serviceProtocols = new LinkedHashMap<>();

        for (ObjectGroup group : groups.values()) {
            if (!group.isNetwork()) continue;
            Set<String> addresses = new LinkedHashSet<>();
            collectAddresses(group, groups, addresses, new HashSet<>());
            if (addresses.isEmpty()) {
                logger.fine(() -> "Network group " + group.name() + " has no valid addresses; no identity created");
                continue;
            }
            IpIdentity identity = IpIdentity.of(ids.nextId("ip-identity", group.name()), group.name(),
                    new ArrayList<>(addresses));
            ipIdentities.add(identity);
            ipByGroup.put(group.name(), identity);
        }

        for (ObjectGroup group : groups.values()) {
            if (!group.isService()) continue;
            TreeSet<PortSpan> tcp = new TreeSet<>();
            TreeSet<PortSpan> udp = new TreeSet<>();
            collectSpans(group, groups, tcp, udp, new HashSet<>());

            if (!tcp.isEmpty() && !udp.isEmpty()) {
                PortIdentity tcpIdentity = portIdentity(group.name() + "-TCP", tcp);
                PortIdentity udpIdentity = portIdentity(group.name() + "-UDP", udp);
                portIdentities.add(tcpIdentity);
                portIdentities.add(udpIdentity);
                portByKey.put(tcpIdentity.name(), tcpIdentity);
                portByKey.put(udpIdentity.name(), udpIdentity);
                portByKey.put(group.name(), tcpIdentity);
                serviceProtocols.put(group.name(), List.of(IdentityTable.TCP, IdentityTable.UDP));
            } else if (!tcp.isEmpty() || !udp.isEmpty()) {
                boolean udpOnly = tcp.isEmpty();
                PortIdentity identity = portIdentity(group.name(), udpOnly ? udp : tcp);
                portIdentities.add(identity);
                portByKey.put(group.name(), identity);
                serviceProtocols.put(group.name(), List.of(udpOnly ? IdentityTable.UDP : IdentityTable.TCP));
            } else {
                logger.warning("Service group " + group.name() + " has no resolvable ports; no identity created");
                serviceProtocols.put(group.name(), List.of(IdentityTable.TCP));
            }
        }

        logger.info(String.format("Built %d IP identities and %d port identities from %d object groups",
                ipIdentities.size(), portIdentities.size(), groups.size()));
        return new IdentityTable(ipIdentities, portIdentities, ipByGroup, portByKey, serviceProtocols);
    }

    private PortIdentity portIdentity(String name, TreeSet<PortSpan> spans) {
        return new PortIdentity(ids.nextId("port-identity", name), name, new ArrayList<>(spans));
    }

    private void collectAddresses(ObjectGroup group, Map<String, ObjectGroup> groups,
                                  Set<String> addresses, Set<String> visiting) {
        if (!visiting.add(group.name())) {
            logger.warning("Object-group reference cycle through " + group.name());
            return;
        }
        for (Member member : group.members()) {
            if (member instanceof Member.Host host) {
                addIfValid(addresses, host.ip(), host.ip(), group);
            } else if (member instanceof Member.Network network) {
                addIfValid(addresses, network.ip(), IpAddresses.cidr(network.ip(), network.mask()), group);
            } else if (member instanceof Member.Range range) {
                if (IpAddresses.isValid(range.startIp()) && IpAddresses.isValid(range.endIp())) {
                    addresses.add(range.startIp());
                    addresses.add(range.endIp());
                } else {
                    logger.fine(() -> "Skipping invalid range " + range.startIp() + "-" + range.endIp()
                            + " in " + group.name());
                }
            } else if (member instanceof Member.GroupRef ref) {
                ObjectGroup nested = groups.get(ref.name());
                if (nested != null && nested.isNetwork()) {
                    collectAddresses(nested, groups, addresses, visiting);
                } else {
                    unresolved("Network group " + group.name() + " references unknown network group " + ref.name());
                }
            }
        }
        visiting.remove(group.name());
    }

    private static void addIfValid(Set<String> addresses, String ip, String address, ObjectGroup group) {
        if (IpAddresses.isValid(ip)) {
            addresses.add(address);
        } else {
            logger.fine(() -> "Skipping invalid address " + ip + " in " + group.name());
        }
    }

    private void collectSpans(ObjectGroup group, Map<String, ObjectGroup> groups,
                              Set<PortSpan> tcp, Set<PortSpan> udp, Set<String> visiting) {
        if (!visiting.add(group.name())) {
            logger.warning("Object-group reference cycle through " + group.name());
            return;
        }
        for (Member member : group.members()) {
            if (member instanceof Member.Port port) {
                OptionalInt number = PortNames.resolve(port.token());
                if (number.isEmpty()) {
                    logger.warning("Unknown port '" + port.token() + "' in service group " + group.name() + ", skipping");
                    continue;
                }
                addSpan(port.protocol(), PortSpan.single(number.getAsInt()), tcp, udp);
            } else if (member instanceof Member.PortRange range) {
                OptionalInt start = PortNames.resolve(range.startToken());
                OptionalInt end = PortNames.resolve(range.endToken());
                if (start.isEmpty() || end.isEmpty() || start.getAsInt() > end.getAsInt()) {
                    logger.warning("Invalid port range " + range.startToken() + "-" + range.endToken()
                            + " in service group " + group.name() + ", skipping");
                    continue;
                }
                addSpan(range.protocol(), new PortSpan(start.getAsInt(), end.getAsInt()), tcp, udp);
            } else if (member instanceof Member.GroupRef ref) {
                ObjectGroup nested = groups.get(ref.name());
                if (nested != null && nested.isService()) {
                    collectSpans(nested, groups, tcp, udp, visiting);
                } else {
                    unresolved("Service group " + group.name() + " references unknown service group " + ref.name());
                }
            }
        }
        visiting.remove(group.name());
    }

    private static void addSpan(Member.ServiceProtocol protocol, PortSpan span, Set<PortSpan> tcp, Set<PortSpan> udp) {
        if (protocol.coversTcp()) tcp.add(span);
        if (protocol.coversUdp()) udp.add(span);
    }

    private void unresolved(String message) {
        logger.warning(message);
        diagnostics.add(Diagnostic.unresolved(message));
    }
}
