/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.optimization;

import com.zonefw.converter.api.model.target.FilterRule;
import com.zonefw.converter.api.model.target.RuleAction;
import com.zonefw.converter.api.model.target.RuleEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleConsolidatorTest {

    private static final List<Integer> TCP = List.of(6);

    private RuleConsolidator consolidator;

    @BeforeEach
    void setUp() {
        consolidator = new RuleConsolidator();
    }

    private static FilterRule allow(String name, int priority, List<String> src, List<String> dst, List<String> ports) {
        return FilterRule.ip4(RuleAction.ALLOW, name, priority, TCP,
                RuleEndpoint.of(src, List.of()), RuleEndpoint.of(dst, ports));
    }

    @Test
    @DisplayName("Same source: destinations are unioned, then same destination: sources are unioned")
    void twoPassUnion() {
        List<FilterRule> result = consolidator.consolidate(List.of(
                allow("WEB", 10, List.of("A"), List.of("X"), List.of("P443")),
                allow("WEB", 20, List.of("A"), List.of("Y"), List.of("P443")),
                allow("WEB", 30, List.of("B"), List.of("X", "Y"), List.of("P443"))));

        assertThat(result).singleElement().satisfies(rule -> {
            assertThat(rule.src().ip()).containsExactly("A", "B");
            assertThat(rule.dst().ip()).containsExactly("X", "Y");
            assertThat(rule.priority()).isEqualTo(10);
            assertThat(rule.name()).isEqualTo("WEB");
        });
    }

    @Test
    @DisplayName("Unions never contain duplicate identity ids")
    void noDuplicateIds() {
        List<FilterRule> result = consolidator.consolidate(List.of(
                allow("R1", 10, List.of("A"), List.of("X"), List.of()),
                allow("R2", 20, List.of("A"), List.of("X", "Y"), List.of())));

        assertThat(result).singleElement()
                .satisfies(rule -> assertThat(rule.dst().ip()).containsExactly("X", "Y"));
    }

    @Test
    @DisplayName("A union with an unrestricted side stays unrestricted")
    void anyAbsorbs() {
        List<FilterRule> result = consolidator.consolidate(List.of(
                allow("R1", 10, List.of("A"), List.of("X"), List.of()),
                allow("R2", 20, List.of("A"), List.of(), List.of())));

        assertThat(result).singleElement()
                .satisfies(rule -> assertThat(rule.dst().ip()).isEmpty());
    }

    @Test
    @DisplayName("Rules differing in action, protocol or port stay separate")
    void distinctSignatures() {
        FilterRule base = allow("R", 10, List.of("A"), List.of("X"), List.of("P1"));
        List<FilterRule> result = consolidator.consolidate(List.of(
                base,
                allow("R", 20, List.of("A"), List.of("Y"), List.of("P2")),
                FilterRule.ip4(RuleAction.DENY, "R", 30, TCP, base.src(), RuleEndpoint.of(List.of("Y"), List.of("P1"))),
                FilterRule.ip4(RuleAction.ALLOW, "R", 40, List.of(17), base.src(),
                        RuleEndpoint.of(List.of("Y"), List.of("P1")))));

        assertThat(result).hasSize(4);
        assertThat(result).extracting(FilterRule::name).containsExactly("R-1", "R-2", "R-3", "R-4");
    }

    @Test
    @DisplayName("Names left colliding get occurrence suffixes that avoid existing names")
    void uniqueNamesAvoidTakenNames() {
        List<FilterRule> result = consolidator.consolidate(List.of(
                allow("R", 10, List.of("A"), List.of("X"), List.of("P1")),
                allow("R-1", 20, List.of("A"), List.of("X"), List.of("P2")),
                allow("R", 30, List.of("A"), List.of("X"), List.of("P3"))));

        assertThat(result).extracting(FilterRule::name).containsExactly("R-1-1", "R-1", "R-2");
    }

    @Test
    void singleRuleUnchanged() {
        FilterRule rule = allow("ONLY", 10, List.of("A"), List.of("X"), List.of());

        assertThat(consolidator.consolidate(List.of(rule))).containsExactly(rule);
    }

    private static FilterRule deny(String name, int priority, List<String> src, List<String> dst, List<String> ports) {
        return FilterRule.ip4(RuleAction.DENY, name, priority, TCP,
                RuleEndpoint.of(src, List.of()), RuleEndpoint.of(dst, ports));
    }

    @Test
    @DisplayName("An allow never moves ahead of a deny that precedes it")
    void denyBetweenAllowsBlocksMerge() {
        List<FilterRule> result = consolidator.consolidate(List.of(
                allow("T", 0, List.of("IP-10.0.0.1"), List.of("IP-10.0.0.2"), List.of("PORT-80")),
                deny("T", 10, List.of("IP-10.0.0.1"), List.of("IP-10.0.0.3"), List.of()),
                allow("T", 20, List.of("IP-10.0.0.1"), List.of("IP-10.0.0.3"), List.of("PORT-80"))));

        assertThat(result).extracting(FilterRule::action)
                .containsExactly(RuleAction.ALLOW, RuleAction.DENY, RuleAction.ALLOW);
        assertThat(result).extracting(rule -> rule.dst().ip()).containsExactly(
                List.of("IP-10.0.0.2"), List.of("IP-10.0.0.3"), List.of("IP-10.0.0.3"));
        assertThat(result).extracting(FilterRule::priority).containsExactly(0, 10, 20);
    }

    @Test
    @DisplayName("Same ports with different sources stay separate across a deny")
    void differentSourcesAcrossDenyStaySeparate() {
        List<FilterRule> result = consolidator.consolidate(List.of(
                allow("R", 10, List.of("A"), List.of("X"), List.of("P443")),
                deny("D", 20, List.of("B"), List.of(), List.of()),
                allow("R", 30, List.of("B"), List.of("X"), List.of("P443"))));

        assertThat(result).hasSize(3);
        assertThat(result.get(0).src().ip()).containsExactly("A");
        assertThat(result.get(2).src().ip()).containsExactly("B");
        assertThat(result).extracting(FilterRule::name).containsExactly("R-1", "D", "R-2");
    }

    @Test
    @DisplayName("Runs after a deny merge among themselves")
    void mergesWithinLaterRun() {
        List<FilterRule> result = consolidator.consolidate(List.of(
                deny("D", 10, List.of("A"), List.of(), List.of()),
                allow("R", 20, List.of("B"), List.of("X"), List.of("P443")),
                allow("R", 30, List.of("C"), List.of("X"), List.of("P443"))));

        assertThat(result).hasSize(2);
        assertThat(result.get(1).src().ip()).containsExactly("B", "C");
        assertThat(result.get(1).priority()).isEqualTo(20);
    }
}
