/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import com.zonefw.converter.api.model.Diagnostic;
import com.zonefw.converter.api.model.source.AclEndpoint;
import com.zonefw.converter.api.model.source.ClassMap;
import com.zonefw.converter.api.model.source.Member;
import com.zonefw.converter.api.model.source.ObjectGroup;
import com.zonefw.converter.api.model.source.ParsedConfig;
import com.zonefw.converter.api.model.source.PolicyMap;
import com.zonefw.converter.api.model.source.SecurityZone;
import com.zonefw.converter.api.model.source.ZonePair;
import com.zonefw.converter.compiler.TestConfigs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigParserTest {

    private ConfigParser parser;

    @BeforeEach
    void setUp() {
        parser = new ConfigParser();
    }

    @Nested
    @DisplayName("Branch router fixture")
    class BranchRouter {

        private ParsedConfig parsed;

        @BeforeEach
        void parseFixture() {
            parsed = parser.parse(TestConfigs.load(TestConfigs.BRANCH_ROUTER));
        }

        @Test
        @DisplayName("Zones carry their member interfaces")
        void zones() {
            assertThat(parsed.zones()).extracting(SecurityZone::name).containsExactly("INSIDE", "OUTSIDE");
            assertThat(parsed.zones().get(0).memberInterfaces()).containsExactly("GigabitEthernet0/0");
            assertThat(parsed.zones().get(1).memberInterfaces()).containsExactly("GigabitEthernet0/1");
        }

        @Test
        void objectGroups() {
            assertThat(parsed.objectGroups()).containsOnlyKeys("NET-SERVERS", "NET-CLIENTS", "SVC-WEB", "SVC-DNS");
            assertThat(parsed.objectGroups().get("NET-SERVERS").members()).containsExactly(
                    new Member.Host("10.0.0.10"),
                    new Member.Network("10.0.1.0", "255.255.255.0"));
            assertThat(parsed.objectGroups().get("SVC-DNS").members()).containsExactly(
                    new Member.Port(Member.ServiceProtocol.TCP, "53"),
                    new Member.Port(Member.ServiceProtocol.UDP, "domain"));
        }

        @Test
        @DisplayName("Remarks are skipped and rules keep their order")
        void accessLists() {
            assertThat(parsed.accessLists()).containsOnlyKeys("ACL_WEB_IN", "ACL_MGMT");
            assertThat(parsed.accessLists().get("ACL_MGMT").rules()).hasSize(3);
            assertThat(parsed.accessLists().get("ACL_WEB_IN").rules().get(1).serviceGroup()).contains("SVC-DNS");
        }

        @Test
        void classAndPolicyMaps() {
            ClassMap web = parsed.classMaps().get("CM-WEB");
            assertThat(web.matchType()).isEqualTo("match-any");
            assertThat(web.aclReferences()).containsExactly("ACL_WEB_IN");
            assertThat(parsed.classMaps().get("CM-SERVICES").objectGroupReferences()).containsExactly("SVC-WEB");

            PolicyMap policyMap = parsed.policyMaps().get("PM-IN-OUT");
            assertThat(policyMap.classActions()).extracting(PolicyMap.ClassAction::className)
                    .containsExactly("CM-WEB", "CM-SERVICES", "class-default");
            assertThat(policyMap.classActions().get(2).drops()).isTrue();
        }

        @Test
        void zonePairBinding() {
            ZonePair pair = parsed.zonePairs().get("ZP-IN-OUT");
            assertThat(pair.sourceZone()).isEqualTo("INSIDE");
            assertThat(pair.destinationZone()).isEqualTo("OUTSIDE");
            assertThat(pair.policyMap()).contains("PM-IN-OUT");
        }

        @Test
        @DisplayName("Only access lists applied outside class-maps count as applied")
        void appliedAccessLists() {
            assertThat(parsed.appliedAccessLists()).containsExactly("ACL_MGMT");
            assertThat(parsed.interfaces().get("GigabitEthernet0/1").accessGroups()).containsExactly("ACL_MGMT");
        }

        @Test
        void noDiagnostics() {
            assertThat(parsed.diagnostics()).isEmpty();
        }
    }

    @Test
    @DisplayName("Each service-policy binds to the nearest preceding zone-pair")
    void servicePolicyBindsToNearestZonePair() {
        ParsedConfig parsed = parser.parse("""
                zone security A
                zone security B
                policy-map type inspect PM-1
                 class class-default
                  drop
                policy-map type inspect PM-2
                 class class-default
                  pass
                zone-pair security ZP-1 source A destination B
                 service-policy type inspect PM-1
                zone-pair security ZP-2 source B destination A
                zone-pair security ZP-3 source A destination A
                 service-policy type inspect PM-2
                """);

        assertThat(parsed.zonePairs().get("ZP-1").policyMap()).contains("PM-1");
        assertThat(parsed.zonePairs().get("ZP-2").policyMap()).isEmpty();
        assertThat(parsed.zonePairs().get("ZP-3").policyMap()).contains("PM-2");
    }

    @Test
    @DisplayName("A service-policy before any zone-pair is reported")
    void unboundServicePolicy() {
        ParsedConfig parsed = parser.parse("""
                 service-policy type inspect PM-ORPHAN
                zone-pair security ZP-1 source A destination B
                """);

        assertThat(parsed.zonePairs().get("ZP-1").policyMap()).isEmpty();
        assertThat(parsed.diagnostics()).extracting(Diagnostic::kind)
                .containsExactly(Diagnostic.Kind.IGNORED_DIRECTIVE);
    }

    @Test
    @DisplayName("Undeclared zones and unmodeled group kinds are reported")
    void ignoredDirectives() {
        ParsedConfig parsed = parser.parse("""
                zone security INSIDE
                !
                interface Vlan10
                 zone-member security GUEST
                !
                object-group user STAFF
                 user alice
                """);

        assertThat(parsed.zones()).singleElement().satisfies(zone -> assertThat(zone.memberInterfaces()).isEmpty());
        assertThat(parsed.interfaces().get("Vlan10").zone()).contains("GUEST");
        assertThat(parsed.objectGroups()).isEmpty();
        assertThat(parsed.diagnostics()).hasSize(2)
                .allMatch(d -> d.kind() == Diagnostic.Kind.IGNORED_DIRECTIVE);
    }

    @Test
    @DisplayName("Unrecognized rule shapes become unparsed-line diagnostics")
    void unparsedAclLine() {
        ParsedConfig parsed = parser.parse("""
                ip access-list extended ACL_TEST
                 permit tcp any host
                 permit ip any any
                """);

        assertThat(parsed.accessLists().get("ACL_TEST").rules()).hasSize(1);
        assertThat(parsed.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(Diagnostic.Kind.UNPARSED_LINE);
            assertThat(d.lineNumber()).isEqualTo(2);
        });
    }

    @Test
    @DisplayName("Flat input and repeated headers are accepted")
    void flatInputAndRepeatedHeader() {
        ParsedConfig parsed = parser.parse("""
                object-group network NET-A
                host 10.0.0.1
                host 10.0.0.2
                ip access-list extended ACL_X
                permit ip object-group NET-A any
                ip access-list extended ACL_X
                deny ip any any
                """);

        ObjectGroup group = parsed.objectGroups().get("NET-A");
        assertThat(group.members()).hasSize(2);
        assertThat(parsed.accessLists().get("ACL_X").rules())
                .extracting(rule -> rule.source())
                .containsExactly(new AclEndpoint.Group("NET-A"), AclEndpoint.ANY);
    }

    @Test
    void emptyInput() {
        ParsedConfig parsed = parser.parse("");

        assertThat(parsed.zones()).isEmpty();
        assertThat(parsed.accessLists()).isEmpty();
        assertThat(parsed.diagnostics()).isEqualTo(List.of());
    }
}
