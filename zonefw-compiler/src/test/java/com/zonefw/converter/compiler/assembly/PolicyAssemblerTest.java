/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.assembly;

import com.zonefw.converter.api.ConversionOptions;
import com.zonefw.converter.api.model.source.ParsedConfig;
import com.zonefw.converter.api.model.target.FilterPolicy;
import com.zonefw.converter.api.model.target.FilterRule;
import com.zonefw.converter.api.model.target.RuleAction;
import com.zonefw.converter.compiler.ConversionSession;
import com.zonefw.converter.compiler.TestConfigs;
import com.zonefw.converter.compiler.id.DeterministicIdGenerator;
import com.zonefw.converter.compiler.identity.IdentityBuilder;
import com.zonefw.converter.compiler.identity.IdentityTable;
import com.zonefw.converter.compiler.parse.ConfigParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyAssemblerTest {

    private final PolicyAssembler assembler = new PolicyAssembler();

    private ZfwModelBuilder assemble(String config) {
        ParsedConfig parsed = new ConfigParser().parse(config);
        ConversionSession session = new ConversionSession(ConversionOptions.defaults(), new DeterministicIdGenerator());
        IdentityTable identities = new IdentityBuilder(session.ids(), session.diagnosticSink())
                .build(parsed.objectGroups());
        ZfwModelBuilder model = new ZfwModelBuilder();
        assembler.assemble(parsed, identities, session, model);
        return model;
    }

    @Test
    @DisplayName("Applied access lists and policy-maps become policies")
    void branchRouterPolicies() {
        ZfwModelBuilder model = assemble(TestConfigs.load(TestConfigs.BRANCH_ROUTER));

        assertThat(model.policies()).extracting(FilterPolicy::name).containsExactly("ACL_MGMT", "PM-IN-OUT");
        assertThat(model.policies()).allMatch(p -> p.defaultAction() == RuleAction.DENY);
    }

    @Test
    @DisplayName("Policy-map rules come from class ACLs, object groups and drop actions")
    void policyMapRules() {
        FilterPolicy policy = assemble(TestConfigs.load(TestConfigs.BRANCH_ROUTER)).policyNamed("PM-IN-OUT").orElseThrow();

        assertThat(policy.rules()).extracting(FilterRule::name)
                .containsExactly("WEB-IN", "WEB-IN-TCP", "WEB-IN-UDP", "OBJ-SVC-WEB", "DENY-class-default");
        assertThat(policy.rules()).extracting(FilterRule::priority).containsExactly(0, 10, 20, 30, 40);

        FilterRule drop = policy.rules().get(4);
        assertThat(drop.action()).isEqualTo(RuleAction.DENY);
        assertThat(drop.protocols()).containsExactly(IdentityTable.TCP);
        assertThat(drop.src().ip()).isEmpty();
        assertThat(drop.dst().ip()).isEmpty();
    }

    @Test
    @DisplayName("Orphan access list rules with the same destination are consolidated")
    void orphanAclConsolidated() {
        FilterPolicy policy = assemble(TestConfigs.load(TestConfigs.BRANCH_ROUTER)).policyNamed("ACL_MGMT").orElseThrow();

        assertThat(policy.rules()).extracting(FilterRule::name).containsExactly("MGMT-1", "MGMT-2");
        assertThat(policy.rules().get(0).src().ip()).hasSize(2);
        assertThat(policy.rules().get(1).action()).isEqualTo(RuleAction.DENY);
    }

    @Test
    @DisplayName("Access lists that are neither applied nor matched produce no policy")
    void unusedAclIgnored() {
        ZfwModelBuilder model = assemble("""
                ip access-list extended ACL_UNUSED
                 permit ip any any
                policy-map type inspect PM-EMPTY
                 class class-default
                  pass
                """);

        assertThat(model.policies()).extracting(FilterPolicy::name).containsExactly("PM-EMPTY");
        assertThat(model.policies().get(0).rules()).isEmpty();
    }

    @Test
    @DisplayName("Without any policy, allow-all and deny-all defaults are created")
    void defaultPolicies() {
        ZfwModelBuilder model = assemble("""
                zone security INSIDE
                zone security OUTSIDE
                """);

        assertThat(model.policies()).extracting(FilterPolicy::name)
                .containsExactly(FilterPolicy.DEFAULT_ALLOW_ALL, FilterPolicy.DEFAULT_DENY_ALL);
        FilterPolicy allow = model.policies().get(0);
        assertThat(allow.defaultAction()).isEqualTo(RuleAction.DENY);
        assertThat(allow.rules()).singleElement().satisfies(rule -> {
            assertThat(rule.name()).isEqualTo("Allow All");
            assertThat(rule.action()).isEqualTo(RuleAction.ALLOW);
            assertThat(rule.priority()).isEqualTo(10);
        });
        assertThat(model.policies().get(1).rules()).singleElement().satisfies(rule -> {
            assertThat(rule.name()).isEqualTo("Deny All");
            assertThat(rule.priority()).isEqualTo(20);
        });
    }

    @Test
    @DisplayName("Destination zone comes from the first zone-pair bound to the map")
    void destinationZone() {
        ParsedConfig parsed = new ConfigParser().parse("""
                policy-map type inspect PM-A
                zone-pair security ZP-1 source IN destination DMZ
                 service-policy type inspect PM-A
                """);

        assertThat(PolicyAssembler.destinationZone(parsed, "PM-A")).isEqualTo("DMZ");
        assertThat(PolicyAssembler.destinationZone(parsed, "PM-B")).isEqualTo(PolicyAssembler.FALLBACK_ZONE);
    }

    @Test
    @DisplayName("Consolidation keeps first-match order when allow and deny rules interleave")
    void interleavedDenyKeepsOrder() {
        FilterPolicy policy = assemble("""
                ip access-list extended ACL_T
                 permit tcp host 10.0.0.1 host 10.0.0.2 eq 80
                 deny tcp host 10.0.0.1 host 10.0.0.3
                 permit tcp host 10.0.0.1 host 10.0.0.3 eq 80
                interface GigabitEthernet0/1
                 ip access-group ACL_T in
                """).policyNamed("ACL_T").orElseThrow();

        assertThat(policy.rules()).extracting(FilterRule::action)
                .containsExactly(RuleAction.ALLOW, RuleAction.DENY, RuleAction.ALLOW);
        assertThat(policy.rules()).allSatisfy(rule -> assertThat(rule.dst().ip()).hasSize(1));
        assertThat(policy.rules().get(1).dst().ip()).isEqualTo(policy.rules().get(2).dst().ip());
    }
}
