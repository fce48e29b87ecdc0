/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.optimization;

import com.zonefw.converter.api.model.target.FilterRule;
import com.zonefw.converter.api.model.target.RuleAction;
import com.zonefw.converter.api.model.target.RuleEndpoint;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Merges structurally equivalent rules of one policy.
 *
 * <p>Rules that share action, protocols and ports are merged in two passes:
 * <ol>
 *   <li>same source: destination addresses are unioned</li>
 *   <li>same destination: source addresses are unioned</li>
 * </ol>
 * A merge only ever varies one side, so the merged rule matches exactly the traffic its
 * members matched. An empty address list means "any"; a union involving "any" is "any".
 *
 * <p>Policies are first-match, so rules only merge within a run of consecutive rules of the
 * same action. A later rule never moves ahead of a rule with a different action.
 *
 * <p>For example, given
 * <pre>
 *   allow tcp src=[A] dst=[X] port=[443]
 *   allow tcp src=[A] dst=[Y] port=[443]
 *   allow tcp src=[B] dst=[X, Y] port=[443]
 * </pre>
 * pass 1 yields {@code src=[A] dst=[X, Y]} and pass 2 folds the third rule into
 * {@code src=[A, B] dst=[X, Y]}.
 *
 * <p>Merged rules take the first member's name, priority and position. Names left colliding
 * afterwards are suffixed with their 1-based occurrence.
 */
public class RuleConsolidator {
    private static final Logger logger = Logger.getLogger(RuleConsolidator.class.getName());

    /**
     * Grouping key of a pass: everything except the side being unioned.
     */
    private record Signature(RuleAction action, Set<Integer> protocols, Set<String> dstPorts,
                             Set<String> srcPorts, Set<String> fixedSide) {
    }

    public List<FilterRule> consolidate(List<FilterRule> rules) {
        if (rules.size() <= 1) {
            return new ArrayList<>(rules);
        }
        List<FilterRule> bySource = mergePass(rules, r -> r.src().ip(), true);
        List<FilterRule> byDestination = mergePass(bySource, r -> r.dst().ip(), false);
        List<FilterRule> named = uniqueNames(byDestination);
        if (named.size() < rules.size()) {
            logger.fine(() -> "Consolidated " + rules.size() + " rules into " + named.size());
        }
        return named;
    }

    /**
     * @param fixed       the address side that must match for rules to merge
     * @param unionDst    true to union destination addresses, false to union source addresses
     */
    private List<FilterRule> mergePass(List<FilterRule> rules, Function<FilterRule, List<String>> fixed,
                                       boolean unionDst) {
        List<List<FilterRule>> groups = new ArrayList<>();
        Map<Signature, List<FilterRule>> open = new HashMap<>();
        RuleAction runAction = null;
        for (FilterRule rule : rules) {
            if (rule.action() != runAction) {
                // a rule of another action closes every group of the previous run
                open.clear();
                runAction = rule.action();
            }
            Signature signature = new Signature(rule.action(), new TreeSet<>(rule.protocols()),
                    new TreeSet<>(rule.dst().port()), new TreeSet<>(rule.src().port()),
                    new TreeSet<>(fixed.apply(rule)));
            List<FilterRule> group = open.get(signature);
            if (group == null) {
                group = new ArrayList<>();
                open.put(signature, group);
                groups.add(group);
            }
            group.add(rule);
        }

        List<FilterRule> merged = new ArrayList<>(groups.size());
        for (List<FilterRule> group : groups) {
            merged.add(group.size() == 1 ? group.get(0) : merge(group, unionDst));
        }
        return merged;
    }

    private FilterRule merge(List<FilterRule> group, boolean unionDst) {
        FilterRule base = group.get(0);
        Set<String> union = new LinkedHashSet<>();
        boolean any = false;
        for (FilterRule rule : group) {
            List<String> side = unionDst ? rule.dst().ip() : rule.src().ip();
            if (side.isEmpty()) {
                any = true;
                break;
            }
            union.addAll(side);
        }
        List<String> addresses = any ? List.of() : new ArrayList<>(union);
        RuleEndpoint src = unionDst ? base.src() : base.src().withIp(addresses);
        RuleEndpoint dst = unionDst ? base.dst().withIp(addresses) : base.dst();
        return base.withEndpoints(src, dst);
    }

    private List<FilterRule> uniqueNames(List<FilterRule> rules) {
        Map<String, Integer> counts = new HashMap<>();
        for (FilterRule rule : rules) {
            counts.merge(rule.name(), 1, Integer::sum);
        }
        Set<String> taken = new HashSet<>(counts.keySet());
        Map<String, Integer> seen = new HashMap<>();

        List<FilterRule> result = new ArrayList<>(rules.size());
        for (FilterRule rule : rules) {
            if (counts.get(rule.name()) == 1) {
                result.add(rule);
                continue;
            }
            int position = seen.merge(rule.name(), 1, Integer::sum);
            String candidate = rule.name() + "-" + position;
            while (taken.contains(candidate)) {
                candidate = candidate + "-" + position;
            }
            taken.add(candidate);
            result.add(rule.withName(candidate));
        }
        return result;
    }
}
