/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import com.zonefw.converter.api.model.Diagnostic;
import com.zonefw.converter.api.model.source.ClassMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses {@code class-map type inspect match-any|match-all NAME} blocks.
 */
final class ClassMapParser extends BlockParser {

    static final String HEADER = "class-map type inspect ";
    private static final String MATCH_ACL = "match access-group name ";
    private static final String MATCH_GROUP = "match object-group ";

    private final Map<String, ClassMap> classMaps = new LinkedHashMap<>();

    private String name;
    private String matchType;
    private List<String> acls;
    private List<String> groups;

    ClassMapParser(List<Diagnostic> diagnostics) {
        super(diagnostics);
    }

    @Override
    protected boolean openBlock(ConfigLine header) {
        if (!header.startsWith(HEADER)) return false;
        String[] parts = header.after(HEADER).split("\\s+");
        if (parts.length >= 2 && parts[0].startsWith("match-")) {
            matchType = parts[0];
            name = parts[1];
        } else if (parts.length == 1 && !parts[0].isEmpty()) {
            matchType = "match-all";
            name = parts[0];
        } else {
            return false;
        }
        acls = new ArrayList<>();
        groups = new ArrayList<>();
        return true;
    }

    @Override
    protected void onMember(ConfigLine line) {
        if (line.startsWith(MATCH_ACL)) {
            String acl = firstToken(line.after(MATCH_ACL));
            if (!acl.isEmpty()) acls.add(acl);
        } else if (line.startsWith(MATCH_GROUP)) {
            String group = firstToken(line.after(MATCH_GROUP));
            if (!group.isEmpty()) groups.add(group);
        }
    }

    @Override
    protected void closeBlock() {
        classMaps.put(name, new ClassMap(name, matchType, acls, groups));
    }

    @Override
    protected boolean acceptsUnindented(ConfigLine line) {
        return line.startsWith("match ");
    }

    Map<String, ClassMap> classMaps() {
        return classMaps;
    }
}
