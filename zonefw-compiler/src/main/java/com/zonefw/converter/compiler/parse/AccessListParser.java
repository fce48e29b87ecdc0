/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import com.zonefw.converter.api.model.Diagnostic;
import com.zonefw.converter.api.model.source.AccessList;
import com.zonefw.converter.api.model.source.AclRule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Parses {@code ip access-list extended NAME} blocks into {@link AccessList}s.
 */
final class AccessListParser extends BlockParser {
    private static final Logger logger = Logger.getLogger(AccessListParser.class.getName());

    static final String HEADER = "ip access-list extended ";
    private static final Pattern RULE_LINE = Pattern.compile("^(\\d+\\s+)?(permit|deny)\\s.*");

    private final AclRuleParser ruleParser;
    private final Map<String, AccessList> accessLists = new LinkedHashMap<>();

    private String name;
    private List<AclRule> rules;

    AccessListParser(List<Diagnostic> diagnostics) {
        super(diagnostics);
        this.ruleParser = new AclRuleParser(diagnostics);
    }

    @Override
    protected boolean openBlock(ConfigLine header) {
        if (!header.startsWith(HEADER)) return false;
        name = firstToken(header.after(HEADER));
        rules = new ArrayList<>();
        return !name.isEmpty();
    }

    @Override
    protected void onMember(ConfigLine line) {
        if (line.startsWith("remark") || !RULE_LINE.matcher(line.text()).matches()) return;
        AclParseResult result = ruleParser.parse(line);
        if (result instanceof AclParseResult.Parsed parsed) {
            rules.add(parsed.rule());
        } else if (result instanceof AclParseResult.Unparsed unparsed) {
            logger.fine(() -> "Dropping ACL line " + unparsed.lineNumber() + ": " + unparsed.reason());
            diagnostics.add(Diagnostic.unparsed(unparsed.lineNumber(), unparsed.line(), unparsed.reason()));
        }
    }

    @Override
    protected void closeBlock() {
        // A repeated header appends to the existing list.
        AccessList existing = accessLists.get(name);
        if (existing != null) {
            List<AclRule> merged = new ArrayList<>(existing.rules());
            merged.addAll(rules);
            rules = merged;
        }
        accessLists.put(name, new AccessList(name, rules));
    }

    @Override
    protected boolean acceptsUnindented(ConfigLine line) {
        return RULE_LINE.matcher(line.text()).matches();
    }

    Map<String, AccessList> accessLists() {
        return accessLists;
    }
}
