/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.assembly;

import com.zonefw.converter.api.model.source.AccessList;
import com.zonefw.converter.api.model.source.AclRule;
import com.zonefw.converter.api.model.source.ClassMap;
import com.zonefw.converter.api.model.source.ObjectGroup;
import com.zonefw.converter.api.model.source.ParsedConfig;
import com.zonefw.converter.api.model.source.PolicyMap;
import com.zonefw.converter.api.model.source.ZonePair;
import com.zonefw.converter.api.model.target.FilterPolicy;
import com.zonefw.converter.api.model.target.FilterRule;
import com.zonefw.converter.api.model.target.IpIdentity;
import com.zonefw.converter.api.model.target.PortIdentity;
import com.zonefw.converter.api.model.target.RuleAction;
import com.zonefw.converter.api.model.target.RuleEndpoint;
import com.zonefw.converter.compiler.ConversionSession;
import com.zonefw.converter.compiler.identity.IdentityTable;
import com.zonefw.converter.compiler.optimization.RuleConsolidator;
import com.zonefw.converter.compiler.translate.RuleTranslator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Builds filter policies from access lists and inspect policy-maps.
 *
 * <ul>
 *   <li>An access list that no class-map references but that is applied elsewhere becomes a
 *       policy of its own, provided it yields at least one rule.</li>
 *   <li>Every policy-map becomes a policy. Its classes contribute the rules of their access
 *       lists, one {@code OBJ-<group>} rule per matched object group and a {@code DENY-<class>}
 *       rule for {@code drop}.</li>
 *   <li>When nothing produced a policy, {@code Default Allow All} and {@code Default Deny All}
 *       are created.</li>
 * </ul>
 */
public class PolicyAssembler {
    private static final Logger logger = Logger.getLogger(PolicyAssembler.class.getName());

    static final String FALLBACK_ZONE = "WAN";

    private final RuleConsolidator consolidator;

    public PolicyAssembler() {
        this(new RuleConsolidator());
    }

    public PolicyAssembler(RuleConsolidator consolidator) {
        this.consolidator = consolidator;
    }

    public void assemble(ParsedConfig parsed, IdentityTable identities, ConversionSession session,
                         ZfwModelBuilder model) {
        RuleTranslator translator = new RuleTranslator(identities, parsed, session);

        Set<String> classMapAcls = new HashSet<>();
        for (ClassMap classMap : parsed.classMaps().values()) {
            classMapAcls.addAll(classMap.aclReferences());
        }

        for (AccessList acl : parsed.accessLists().values()) {
            if (classMapAcls.contains(acl.name()) || !parsed.appliedAccessLists().contains(acl.name())) {
                continue;
            }
            List<FilterRule> rules = new ArrayList<>();
            int index = 0;
            for (AclRule rule : acl.rules()) {
                List<FilterRule> translated = translator.translate(rule, index, null, acl.name());
                rules.addAll(translated);
                index += translated.size();
            }
            if (rules.isEmpty()) {
                logger.fine(() -> "Access list " + acl.name() + " produced no rules; no policy created");
                continue;
            }
            model.addPolicy(new FilterPolicy(session.ids().nextId("filter-policy", acl.name()), acl.name(),
                    RuleAction.DENY, consolidator.consolidate(rules)));
        }

        for (PolicyMap policyMap : parsed.policyMaps().values()) {
            String destinationZone = destinationZone(parsed, policyMap.name());
            List<FilterRule> rules = new ArrayList<>();
            int index = 0;
            for (PolicyMap.ClassAction entry : policyMap.classActions()) {
                ClassMap classMap = parsed.classMaps().get(entry.className());
                if (classMap != null) {
                    for (String aclName : classMap.aclReferences()) {
                        AccessList acl = parsed.accessLists().get(aclName);
                        if (acl == null) {
                            session.unresolved("Class-map " + classMap.name() + " references unknown access list "
                                    + aclName);
                            continue;
                        }
                        for (AclRule rule : acl.rules()) {
                            List<FilterRule> translated = translator.translate(rule, index, destinationZone, aclName);
                            rules.addAll(translated);
                            index += translated.size();
                        }
                    }
                    for (String groupName : classMap.objectGroupReferences()) {
                        List<FilterRule> objectRules = objectGroupRules(groupName, index, parsed, identities, session);
                        rules.addAll(objectRules);
                        index += objectRules.size();
                    }
                } else if (!"class-default".equals(entry.className())) {
                    logger.warning("Policy-map " + policyMap.name() + " uses undeclared class " + entry.className());
                }
                if (entry.drops()) {
                    rules.add(FilterRule.ip4(RuleAction.DENY, "DENY-" + entry.className(), index * 10,
                            List.of(IdentityTable.TCP), RuleEndpoint.ANY, RuleEndpoint.ANY));
                    index++;
                }
            }
            model.addPolicy(new FilterPolicy(session.ids().nextId("filter-policy", policyMap.name()),
                    policyMap.name(), RuleAction.DENY, consolidator.consolidate(rules)));
        }

        if (model.policies().isEmpty()) {
            logger.info("No policies found; creating default allow and deny policies");
            model.addPolicy(new FilterPolicy(session.ids().nextId("filter-policy", FilterPolicy.DEFAULT_ALLOW_ALL),
                    FilterPolicy.DEFAULT_ALLOW_ALL, RuleAction.DENY,
                    List.of(FilterRule.ip4(RuleAction.ALLOW, "Allow All", 10, List.of(IdentityTable.TCP),
                            RuleEndpoint.ANY, RuleEndpoint.ANY))));
            model.addPolicy(new FilterPolicy(session.ids().nextId("filter-policy", FilterPolicy.DEFAULT_DENY_ALL),
                    FilterPolicy.DEFAULT_DENY_ALL, RuleAction.DENY,
                    List.of(FilterRule.ip4(RuleAction.DENY, "Deny All", 20, List.of(IdentityTable.TCP),
                            RuleEndpoint.ANY, RuleEndpoint.ANY))));
        }
    }

    /**
     * Destination zone of the first zone pair bound to the map, or {@value #FALLBACK_ZONE}.
     */
    static String destinationZone(ParsedConfig parsed, String policyMapName) {
        for (ZonePair pair : parsed.zonePairs().values()) {
            if (pair.policyMap().filter(policyMapName::equals).isPresent()) {
                return pair.destinationZone();
            }
        }
        return FALLBACK_ZONE;
    }

    /**
     * Allow rules for an object group matched directly by a class-map. Network groups match on
     * destination address with any protocol; service groups match on destination port with the
     * group's protocols, one rule per protocol.
     */
    private List<FilterRule> objectGroupRules(String groupName, int index, ParsedConfig parsed,
                                              IdentityTable identities, ConversionSession session) {
        String name = "OBJ-" + groupName;
        ObjectGroup group = parsed.objectGroups().get(groupName);
        if (group != null && group.isNetwork()) {
            Optional<IpIdentity> identity = identities.ipIdentityForGroup(groupName);
            if (identity.isPresent()) {
                return List.of(FilterRule.ip4(RuleAction.ALLOW, name, index * 10, List.of(), RuleEndpoint.ANY,
                        RuleEndpoint.of(List.of(identity.get().id()), List.of())));
            }
        } else if (group != null && group.isService()) {
            List<Integer> protocols = identities.protocolsFor(groupName);
            List<FilterRule> rules = new ArrayList<>();
            for (int protocol : protocols) {
                Optional<PortIdentity> identity = identities.portIdentityFor(groupName, protocol);
                if (identity.isEmpty()) continue;
                String ruleName = protocols.size() > 1
                        ? name + (protocol == IdentityTable.UDP ? "-UDP" : "-TCP")
                        : name;
                rules.add(FilterRule.ip4(RuleAction.ALLOW, ruleName, (index + rules.size()) * 10,
                        List.of(protocol), RuleEndpoint.ANY,
                        RuleEndpoint.of(List.of(), List.of(identity.get().id()))));
            }
            if (!rules.isEmpty()) return rules;
        }
        session.unresolved("Class-map object-group " + groupName + " has no identity");
        return List.of();
    }
}
