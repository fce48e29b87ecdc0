/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.translate;

import com.zonefw.converter.api.model.source.AccessList;
import com.zonefw.converter.api.model.source.AclEndpoint;
import com.zonefw.converter.api.model.source.AclRule;
import com.zonefw.converter.api.model.source.ParsedConfig;
import com.zonefw.converter.api.model.source.PortMatch;
import com.zonefw.converter.api.model.target.FilterRule;
import com.zonefw.converter.api.model.target.IpIdentity;
import com.zonefw.converter.api.model.target.PortIdentity;
import com.zonefw.converter.api.model.target.RuleAction;
import com.zonefw.converter.api.model.target.RuleEndpoint;
import com.zonefw.converter.compiler.ConversionSession;
import com.zonefw.converter.compiler.identity.IdentityTable;
import com.zonefw.converter.compiler.identity.PortNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Translates parsed ACL rules into filter rules.
 *
 * <p>A rule bound to a service group that carries both TCP and UDP ports fans out into one
 * rule per protocol, named {@code <base>-TCP} and {@code <base>-UDP}, each carrying only its
 * own protocol's port identity. References that cannot be resolved are dropped from their
 * side and reported; the rule itself is always emitted.
 */
public class RuleTranslator {

    private final IdentityTable identities;
    private final ParsedConfig parsed;
    private final ConversionSession session;

    public RuleTranslator(IdentityTable identities, ParsedConfig parsed, ConversionSession session) {
        this.identities = identities;
        this.parsed = parsed;
        this.session = session;
    }

    /**
     * @param baseIndex       running index used for priorities ({@code index * 10})
     * @param destinationZone zone the owning policy forwards into, used for unnamed rules
     * @param aclName         owning access list, or null
     */
    public List<FilterRule> translate(AclRule rule, int baseIndex, String destinationZone, String aclName) {
        List<String> srcIp = resolveAddress(rule.source(), "source");
        List<String> dstIp = new ArrayList<>();
        String serviceGroup = rule.serviceGroup().orElse(null);

        if (rule.destination() instanceof AclEndpoint.Group group && isPortReference(group.name())) {
            if (serviceGroup == null) {
                serviceGroup = group.name();
            }
        } else {
            dstIp = resolveAddress(rule.destination(), "destination");
        }

        String baseName = RuleNamer.name(rule, destinationZone, aclName, ordinalIn(rule, aclName),
                parsed.aclRuleCount(aclName));
        RuleAction action = rule.action() == AclRule.Action.ALLOW ? RuleAction.ALLOW : RuleAction.DENY;
        RuleEndpoint src = RuleEndpoint.of(srcIp, List.of());

        List<FilterRule> rules = new ArrayList<>();
        if (serviceGroup == null) {
            List<String> dstPort = literalPorts(rule, 0);
            List<Integer> protocols = rule.protocol().isAny() ? List.of() : List.of(rule.protocol().id());
            rules.add(FilterRule.ip4(action, baseName, baseIndex * 10, protocols, src,
                    RuleEndpoint.of(dstIp, dstPort)));
            return rules;
        }

        if (!identities.isServiceGroup(serviceGroup)) {
            session.unresolved("Service group " + serviceGroup + " referenced at line " + rule.lineNumber()
                    + " has no port identity");
        }
        List<Integer> protocols = identities.protocolsFor(serviceGroup);
        boolean mixed = protocols.size() > 1;
        for (int i = 0; i < protocols.size(); i++) {
            int protocol = protocols.get(i);
            List<String> dstPort = new ArrayList<>();
            identities.portIdentityFor(serviceGroup, protocol).ifPresent(p -> dstPort.add(p.id()));
            for (String literal : literalPorts(rule, protocol)) {
                if (!dstPort.contains(literal)) dstPort.add(literal);
            }
            String name = mixed ? baseName + "-" + protocolName(protocol) : baseName;
            rules.add(FilterRule.ip4(action, name, (baseIndex + i) * 10, List.of(protocol), src,
                    RuleEndpoint.of(dstIp, dstPort)));
        }
        return rules;
    }

    private boolean isPortReference(String groupName) {
        return groupName.startsWith("SVC-") || groupName.startsWith("SVCG-") || identities.isServiceGroup(groupName);
    }

    private int ordinalIn(AclRule rule, String aclName) {
        if (aclName == null || !session.options().numberAclRules()) return 0;
        AccessList acl = parsed.accessLists().get(aclName);
        return acl == null ? 0 : acl.rules().indexOf(rule) + 1;
    }

    private List<String> resolveAddress(AclEndpoint endpoint, String side) {
        if (endpoint instanceof AclEndpoint.Host host) {
            Optional<IpIdentity> identity = session.literals().ip(host.ip());
            if (identity.isPresent()) return List.of(identity.get().id());
            session.unresolved("Invalid " + side + " host address " + host.ip());
        } else if (endpoint instanceof AclEndpoint.Group group) {
            Optional<IpIdentity> identity = identities.ipIdentityForGroup(group.name());
            if (identity.isPresent()) return List.of(identity.get().id());
            session.unresolved("Unknown " + side + " network group " + group.name());
        }
        return List.of();
    }

    /**
     * Literal destination port of the rule. A token naming a service group resolves to that
     * group's identity for {@code protocol}.
     */
    private List<String> literalPorts(AclRule rule, int protocol) {
        if (rule.portMatch().isEmpty()) return List.of();
        PortMatch match = rule.portMatch().get();
        if (match instanceof PortMatch.Eq eq) {
            String token = eq.token();
            if (identities.isServiceGroup(token)) {
                Optional<PortIdentity> group = protocol == 0
                        ? identities.portIdentityFor(token)
                        : identities.portIdentityFor(token, protocol);
                if (group.isPresent()) return List.of(group.get().id());
            }
            OptionalInt port = PortNames.resolve(token);
            if (port.isPresent()) return List.of(session.literals().port(port.getAsInt()).id());
            session.unresolved("Unknown destination port '" + token + "' at line " + rule.lineNumber());
        } else if (match instanceof PortMatch.Range range) {
            OptionalInt start = PortNames.resolve(range.startToken());
            OptionalInt end = PortNames.resolve(range.endToken());
            if (start.isPresent() && end.isPresent() && start.getAsInt() <= end.getAsInt()) {
                return List.of(session.literals().port(start.getAsInt(), end.getAsInt()).id());
            }
            session.unresolved("Invalid destination port range " + range.startToken() + "-" + range.endToken()
                    + " at line " + rule.lineNumber());
        }
        return List.of();
    }

    static String protocolName(int protocol) {
        switch (protocol) {
            case IdentityTable.TCP:
                return "TCP";
            case IdentityTable.UDP:
                return "UDP";
            case 1:
                return "ICMP";
            default:
                return "PROTO-" + protocol;
        }
    }
}
