/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import com.zonefw.converter.api.model.Diagnostic;
import com.zonefw.converter.api.model.source.AclEndpoint;
import com.zonefw.converter.api.model.source.AclRule;
import com.zonefw.converter.api.model.source.PortMatch;
import com.zonefw.converter.api.model.source.Protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Tokenizes {@code [seq] permit|deny [protocol] <source> <destination> [port-spec]}.
 *
 * <p>The operands after the protocol are matched against these shapes, first match wins:
 * <ol>
 *   <li>{@code object-group SVC object-group SRC object-group DST}</li>
 *   <li>{@code object-group SVC-x object-group SRC [DST]}, service group named {@code SVC-}/{@code SVCG-}</li>
 *   <li>{@code object-group SRC object-group DST [eq P | range P1 P2]}</li>
 *   <li>{@code object-group SRC host IP [eq P | range P1 P2]}</li>
 *   <li>two endpoint expressions, optionally followed by a port spec</li>
 *   <li>one endpoint expression; destination is {@code any}</li>
 * </ol>
 * The form {@code object-group SRC object-group DST eq P} is covered by the third shape.
 */
public final class AclRuleParser {

    private static final String OBJECT_GROUP = "object-group";
    private static final String HOST = "host";
    private static final String ANY = "any";

    private final List<Diagnostic> diagnostics;

    public AclRuleParser(List<Diagnostic> diagnostics) {
        this.diagnostics = diagnostics;
    }

    public AclParseResult parse(ConfigLine line) {
        return parse(line.number(), line.text());
    }

    public AclParseResult parse(int lineNumber, String text) {
        List<String> tokens = new ArrayList<>(Arrays.asList(text.strip().split("\\s+")));
        if (!tokens.isEmpty() && isNumber(tokens.get(0))) {
            tokens.remove(0);
        }
        if (tokens.isEmpty() || !("permit".equals(tokens.get(0)) || "deny".equals(tokens.get(0)))) {
            return new AclParseResult.Unparsed(lineNumber, text, "not a permit/deny rule");
        }
        while (tokens.size() > 1) {
            String last = tokens.get(tokens.size() - 1);
            if (!"log".equals(last) && !"log-input".equals(last)) break;
            tokens.remove(tokens.size() - 1);
        }

        AclRule.Action action = AclRule.Action.fromKeyword(tokens.get(0));
        Protocol protocol = tokens.size() > 1 ? Protocol.fromKeyword(tokens.get(1)) : null;
        List<String> r;
        if (protocol != null) {
            r = tokens.subList(2, tokens.size());
        } else {
            protocol = Protocol.IP;
            r = tokens.subList(1, tokens.size());
        }

        Shape shape = match(lineNumber, text, r);
        if (shape == null) {
            return new AclParseResult.Unparsed(lineNumber, text, "unrecognized operand shape: " + String.join(" ", r));
        }
        return new AclParseResult.Parsed(new AclRule(action, protocol, shape.source, shape.destination,
                Optional.ofNullable(shape.serviceGroup), Optional.ofNullable(shape.portMatch), lineNumber));
    }

    private Shape match(int lineNumber, String text, List<String> r) {
        int n = r.size();
        if (n >= 6 && isKeyword(r, 0, OBJECT_GROUP) && isKeyword(r, 2, OBJECT_GROUP) && isKeyword(r, 4, OBJECT_GROUP)) {
            return new Shape(new AclEndpoint.Group(r.get(3)), new AclEndpoint.Group(r.get(5)), r.get(1), null);
        }
        if (n >= 4 && isKeyword(r, 0, OBJECT_GROUP) && isKeyword(r, 2, OBJECT_GROUP)) {
            String first = r.get(1);
            if (isServiceGroupName(first)) {
                AclEndpoint destination = AclEndpoint.ANY;
                if (n > 4) {
                    List<AclEndpoint> rest = endpoints(r.subList(4, n));
                    if (rest == null || rest.size() != 1) return null;
                    destination = rest.get(0);
                }
                return new Shape(new AclEndpoint.Group(r.get(3)), destination, first, null);
            }
            return new Shape(new AclEndpoint.Group(first), new AclEndpoint.Group(r.get(3)), null,
                    portSpec(lineNumber, text, r, 4));
        }
        if (n >= 4 && isKeyword(r, 0, OBJECT_GROUP) && isKeyword(r, 2, HOST)) {
            return new Shape(new AclEndpoint.Group(r.get(1)), new AclEndpoint.Host(r.get(3)), null,
                    portSpec(lineNumber, text, r, 4));
        }

        int portAt = indexOfPortOperator(r);
        List<AclEndpoint> endpoints = endpoints(portAt < 0 ? r : r.subList(0, portAt));
        if (endpoints == null) return null;
        PortMatch port = portAt < 0 ? null : portSpec(lineNumber, text, r, portAt);
        if (endpoints.size() == 2) {
            return new Shape(endpoints.get(0), endpoints.get(1), null, port);
        }
        if (endpoints.size() == 1 && portAt < 0) {
            return new Shape(endpoints.get(0), AclEndpoint.ANY, null, null);
        }
        return null;
    }

    /**
     * Parses {@code eq P} or {@code range P1 P2} at {@code at}. Other qualifiers are noted and dropped.
     */
    private PortMatch portSpec(int lineNumber, String text, List<String> r, int at) {
        if (r.size() <= at + 1) return null;
        String operator = r.get(at);
        if ("eq".equals(operator)) {
            return new PortMatch.Eq(r.get(at + 1));
        }
        if ("range".equals(operator) && r.size() > at + 2) {
            return new PortMatch.Range(r.get(at + 1), r.get(at + 2));
        }
        if ("lt".equals(operator) || "gt".equals(operator) || "neq".equals(operator)) {
            diagnostics.add(Diagnostic.ignored(lineNumber, text,
                    "Port qualifier '" + operator + "' is not supported; rule matches any port"));
        }
        return null;
    }

    private static int indexOfPortOperator(List<String> r) {
        for (int i = 0; i < r.size(); i++) {
            String token = r.get(i);
            if ("eq".equals(token) || "range".equals(token) || "lt".equals(token)
                    || "gt".equals(token) || "neq".equals(token)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Reads endpoint expressions: {@code any}, {@code host IP}, {@code object-group NAME} or a bare group name.
     *
     * @return the expressions, or null when a keyword is missing its operand
     */
    private static List<AclEndpoint> endpoints(List<String> tokens) {
        List<AclEndpoint> result = new ArrayList<>();
        int i = 0;
        while (i < tokens.size()) {
            String token = tokens.get(i);
            if (ANY.equals(token)) {
                result.add(AclEndpoint.ANY);
                i++;
            } else if (HOST.equals(token) || OBJECT_GROUP.equals(token)) {
                if (i + 1 >= tokens.size()) return null;
                String operand = tokens.get(i + 1);
                result.add(HOST.equals(token) ? new AclEndpoint.Host(operand) : new AclEndpoint.Group(operand));
                i += 2;
            } else {
                result.add(new AclEndpoint.Group(token));
                i++;
            }
        }
        return result;
    }

    static boolean isServiceGroupName(String name) {
        return name.startsWith("SVC-") || name.startsWith("SVCG-");
    }

    private static boolean isKeyword(List<String> r, int index, String keyword) {
        return r.size() > index && keyword.equals(r.get(index));
    }

    private static boolean isNumber(String token) {
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return !token.isEmpty();
    }

    private record Shape(AclEndpoint source, AclEndpoint destination, String serviceGroup, PortMatch portMatch) {}
}
