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
import com.zonefw.converter.compiler.id.DeterministicIdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IdentityBuilderTest {

    private List<Diagnostic> diagnostics;
    private IdentityBuilder builder;

    @BeforeEach
    void setUp() {
        diagnostics = new ArrayList<>();
        builder = new IdentityBuilder(new DeterministicIdGenerator(), diagnostics);
    }

    private static Map<String, ObjectGroup> groups(ObjectGroup... groups) {
        Map<String, ObjectGroup> map = new LinkedHashMap<>();
        for (ObjectGroup group : groups) {
            map.put(group.name(), group);
        }
        return map;
    }

    private static ObjectGroup network(String name, Member... members) {
        return new ObjectGroup(name, ObjectGroup.Kind.NETWORK, List.of(members));
    }

    private static ObjectGroup service(String name, Member... members) {
        return new ObjectGroup(name, ObjectGroup.Kind.SERVICE, List.of(members));
    }

    @Nested
    @DisplayName("Network groups")
    class NetworkGroups {

        @Test
        @DisplayName("Hosts, networks and ranges become addresses")
        void addresses() {
            IdentityTable table = builder.build(groups(network("NET-A",
                    new Member.Host("10.0.0.1"),
                    new Member.Network("10.1.0.0", "0.0.255.255"),
                    new Member.Range("10.2.0.1", "10.2.0.9"))));

            IpIdentity identity = table.ipIdentityForGroup("NET-A").orElseThrow();
            assertThat(identity.addresses()).containsExactly("10.0.0.1", "10.1.0.0/16", "10.2.0.1", "10.2.0.9");
        }

        @Test
        @DisplayName("Nested groups are inlined and cycles are cut")
        void nestedAndCyclic() {
            IdentityTable table = builder.build(groups(
                    network("NET-OUTER", new Member.Host("10.0.0.1"), new Member.GroupRef("NET-INNER")),
                    network("NET-INNER", new Member.Host("10.0.0.2"), new Member.GroupRef("NET-OUTER"))));

            assertThat(table.ipIdentityForGroup("NET-OUTER").orElseThrow().addresses())
                    .containsExactly("10.0.0.1", "10.0.0.2");
            assertThat(diagnostics).isEmpty();
        }

        @Test
        @DisplayName("Invalid-only groups get no identity")
        void invalidOnly() {
            IdentityTable table = builder.build(groups(network("NET-BAD", new Member.Host("not-an-ip"))));

            assertThat(table.ipIdentityForGroup("NET-BAD")).isEmpty();
            assertThat(table.ipIdentities()).isEmpty();
        }

        @Test
        void unknownNestedReference() {
            builder.build(groups(network("NET-A", new Member.Host("10.0.0.1"), new Member.GroupRef("NET-MISSING"))));

            assertThat(diagnostics).singleElement()
                    .extracting(Diagnostic::kind)
                    .isEqualTo(Diagnostic.Kind.UNRESOLVED_REFERENCE);
        }
    }

    @Nested
    @DisplayName("Service groups")
    class ServiceGroups {

        @Test
        @DisplayName("TCP-only group gets one identity with sorted, deduplicated spans")
        void tcpOnly() {
            IdentityTable table = builder.build(groups(service("SVC-WEB",
                    new Member.Port(Member.ServiceProtocol.TCP, "https"),
                    new Member.Port(Member.ServiceProtocol.TCP, "80"),
                    new Member.Port(Member.ServiceProtocol.TCP, "www"))));

            PortIdentity identity = table.portIdentityFor("SVC-WEB").orElseThrow();
            assertThat(identity.name()).isEqualTo("SVC-WEB");
            assertThat(identity.members()).containsExactly(PortSpan.single(80), PortSpan.single(443));
            assertThat(table.protocolsFor("SVC-WEB")).containsExactly(IdentityTable.TCP);
            assertThat(table.isMixed("SVC-WEB")).isFalse();
        }

        @Test
        @DisplayName("Mixed group fans out into -TCP and -UDP identities")
        void mixedFanOut() {
            IdentityTable table = builder.build(groups(service("SVC-DNS",
                    new Member.Port(Member.ServiceProtocol.TCP, "53"),
                    new Member.Port(Member.ServiceProtocol.UDP, "domain"),
                    new Member.PortRange(Member.ServiceProtocol.UDP, "5000", "5010"))));

            assertThat(table.portIdentities()).extracting(PortIdentity::name)
                    .containsExactly("SVC-DNS-TCP", "SVC-DNS-UDP");
            assertThat(table.protocolsFor("SVC-DNS")).containsExactly(IdentityTable.TCP, IdentityTable.UDP);
            assertThat(table.portIdentityFor("SVC-DNS", IdentityTable.UDP).orElseThrow().members())
                    .containsExactly(PortSpan.single(53), new PortSpan(5000, 5010));
            assertThat(table.portIdentityFor("SVC-DNS", IdentityTable.TCP).orElseThrow().members())
                    .containsExactly(PortSpan.single(53));
            assertThat(table.portIdentityFor("SVC-DNS")).isEqualTo(table.portIdentityFor("SVC-DNS-TCP"));
        }

        @Test
        @DisplayName("tcp-udp members land in both protocols")
        void tcpUdpMember() {
            IdentityTable table = builder.build(groups(service("SVC-SIP",
                    new Member.Port(Member.ServiceProtocol.TCP_UDP, "5060"))));

            assertThat(table.isMixed("SVC-SIP")).isTrue();
        }

        @Test
        @DisplayName("UDP-only group is classified as UDP")
        void udpOnly() {
            IdentityTable table = builder.build(groups(service("SVC-NTP",
                    new Member.Port(Member.ServiceProtocol.UDP, "123"))));

            assertThat(table.protocolsFor("SVC-NTP")).containsExactly(IdentityTable.UDP);
            assertThat(table.portIdentityFor("SVC-NTP", IdentityTable.UDP)).isPresent();
        }

        @Test
        @DisplayName("Unknown port names and inverted ranges are skipped")
        void unresolvablePorts() {
            IdentityTable table = builder.build(groups(service("SVC-ODD",
                    new Member.Port(Member.ServiceProtocol.TCP, "no-such-port"),
                    new Member.PortRange(Member.ServiceProtocol.TCP, "900", "100"))));

            assertThat(table.portIdentityFor("SVC-ODD")).isEmpty();
            assertThat(table.isServiceGroup("SVC-ODD")).isTrue();
            assertThat(table.protocolsFor("SVC-ODD")).containsExactly(IdentityTable.TCP);
        }

        @Test
        void nestedServiceGroup() {
            IdentityTable table = builder.build(groups(
                    service("SVC-ALL", new Member.GroupRef("SVC-MAIL"), new Member.Port(Member.ServiceProtocol.TCP, "22")),
                    service("SVC-MAIL", new Member.Port(Member.ServiceProtocol.TCP, "smtp"))));

            assertThat(table.portIdentityFor("SVC-ALL").orElseThrow().members())
                    .containsExactly(PortSpan.single(22), PortSpan.single(25));
        }
    }

    @Test
    void unknownGroupDefaultsToTcp() {
        IdentityTable table = IdentityTable.empty();

        assertThat(table.isServiceGroup("SVC-NOPE")).isFalse();
        assertThat(table.protocolsFor("SVC-NOPE")).containsExactly(IdentityTable.TCP);
    }
}
