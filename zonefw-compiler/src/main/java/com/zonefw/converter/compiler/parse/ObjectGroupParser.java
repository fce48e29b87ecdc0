/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import com.zonefw.converter.api.model.Diagnostic;
import com.zonefw.converter.api.model.source.Member;
import com.zonefw.converter.api.model.source.ObjectGroup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses {@code object-group network|service NAME} blocks.
 *
 * <p>Network members: {@code host X}, {@code network X Y}, {@code range X Y},
 * {@code group-object NAME}, and the legacy shorthands bare {@code X Y} (network)
 * and bare {@code X} (host).
 * Service members: {@code tcp|udp|tcp-udp eq P}, {@code tcp|udp|tcp-udp range P1 P2}
 * and {@code object-group|group-object NAME}.
 */
final class ObjectGroupParser extends BlockParser {

    static final String HEADER = "object-group ";

    private static final String[] MEMBER_PREFIXES = {
            "host ", "network ", "range ", "group-object ", "description ",
            "tcp ", "udp ", "tcp-udp "
    };

    private final Map<String, ObjectGroup> groups = new LinkedHashMap<>();

    private String name;
    private ObjectGroup.Kind kind;
    private List<Member> members;

    ObjectGroupParser(List<Diagnostic> diagnostics) {
        super(diagnostics);
    }

    @Override
    protected boolean openBlock(ConfigLine header) {
        if (!header.startsWith(HEADER)) return false;
        String[] parts = header.tokens();
        if (parts.length < 3) return false;
        kind = ObjectGroup.Kind.fromKeyword(parts[1]);
        if (kind == null) {
            diagnostics.add(Diagnostic.ignored(header.number(), header.text(),
                    "Object-group kind '" + parts[1] + "' is not modeled"));
            return false;
        }
        name = parts[2];
        members = new ArrayList<>();
        return true;
    }

    @Override
    protected void onMember(ConfigLine line) {
        if (line.startsWith("description ")) return;
        Member member = kind == ObjectGroup.Kind.NETWORK ? networkMember(line) : serviceMember(line);
        if (member != null) {
            members.add(member);
        }
    }

    private Member networkMember(ConfigLine line) {
        String[] parts = line.tokens();
        switch (parts[0]) {
            case "host":
                return parts.length >= 2 ? new Member.Host(parts[1]) : null;
            case "network":
                return parts.length >= 3 ? new Member.Network(parts[1], parts[2]) : null;
            case "range":
                return parts.length >= 3 ? new Member.Range(parts[1], parts[2]) : null;
            case "group-object":
            case "object-group":
                return parts.length >= 2 ? new Member.GroupRef(parts[1]) : null;
            default:
                // Legacy shorthand: "X Y" is a network, a lone "X" is a host.
                if (parts.length >= 2) {
                    return new Member.Network(parts[0], parts[1]);
                }
                return new Member.Host(parts[0]);
        }
    }

    private Member serviceMember(ConfigLine line) {
        String[] parts = line.tokens();
        if (("object-group".equals(parts[0]) || "group-object".equals(parts[0])) && parts.length >= 2) {
            return new Member.GroupRef(parts[1]);
        }
        Member.ServiceProtocol protocol = Member.ServiceProtocol.fromKeyword(parts[0]);
        if (protocol == null || parts.length < 3) {
            return null;
        }
        if ("eq".equals(parts[1])) {
            return new Member.Port(protocol, parts[2]);
        }
        if ("range".equals(parts[1]) && parts.length >= 4) {
            return new Member.PortRange(protocol, parts[2], parts[3]);
        }
        return null;
    }

    @Override
    protected void closeBlock() {
        groups.put(name, new ObjectGroup(name, kind, members));
    }

    @Override
    protected boolean acceptsUnindented(ConfigLine line) {
        return startsWithAny(line, MEMBER_PREFIXES);
    }

    Map<String, ObjectGroup> groups() {
        return groups;
    }
}
