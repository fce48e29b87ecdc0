/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import com.zonefw.converter.api.model.Diagnostic;
import com.zonefw.converter.api.model.source.PolicyAction;
import com.zonefw.converter.api.model.source.PolicyMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses {@code policy-map type inspect NAME} blocks. Each {@code class type inspect CLASS}
 * line opens a class entry; {@code inspect}, {@code drop} and {@code pass} lines append
 * actions to the entry opened last. {@code class class-default} is tracked like any other class.
 */
final class PolicyMapParser extends BlockParser {

    static final String HEADER = "policy-map type inspect ";
    private static final String CLASS_INSPECT = "class type inspect ";
    private static final String CLASS = "class ";

    private final Map<String, PolicyMap> policyMaps = new LinkedHashMap<>();

    private String name;
    private List<PolicyMap.ClassAction> entries;
    private String currentClass;
    private List<PolicyAction> currentActions;

    PolicyMapParser(List<Diagnostic> diagnostics) {
        super(diagnostics);
    }

    @Override
    protected boolean openBlock(ConfigLine header) {
        if (!header.startsWith(HEADER)) return false;
        name = firstToken(header.after(HEADER));
        entries = new ArrayList<>();
        currentClass = null;
        currentActions = null;
        return !name.isEmpty();
    }

    @Override
    protected void onMember(ConfigLine line) {
        if (line.startsWith(CLASS)) {
            flushClass();
            String className = line.startsWith(CLASS_INSPECT)
                    ? firstToken(line.after(CLASS_INSPECT))
                    : firstToken(line.after(CLASS));
            if (!className.isEmpty()) {
                currentClass = className;
                currentActions = new ArrayList<>();
            }
            return;
        }
        if (currentClass == null) return;
        String[] parts = line.tokens();
        switch (parts[0]) {
            case "inspect" -> currentActions.add(new PolicyAction.Inspect(parts.length > 1 ? parts[1] : ""));
            case "drop" -> currentActions.add(new PolicyAction.Drop());
            case "pass" -> currentActions.add(new PolicyAction.Pass());
            default -> { }
        }
    }

    private void flushClass() {
        if (currentClass != null) {
            entries.add(new PolicyMap.ClassAction(currentClass, currentActions));
        }
        currentClass = null;
        currentActions = null;
    }

    @Override
    protected void closeBlock() {
        flushClass();
        policyMaps.put(name, new PolicyMap(name, entries));
    }

    @Override
    protected boolean acceptsUnindented(ConfigLine line) {
        return startsWithAny(line, CLASS, "inspect", "drop", "pass");
    }

    Map<String, PolicyMap> policyMaps() {
        return policyMaps;
    }
}
