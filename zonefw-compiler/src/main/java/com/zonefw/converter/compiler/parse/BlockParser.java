/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import com.zonefw.converter.api.model.Diagnostic;

import java.util.List;

/**
 * Single forward pass over the line sequence with a {@code None -> InBlock -> None}
 * state machine.
 *
 * <p>A block opens on a header line accepted by {@link #openBlock(ConfigLine)} and
 * closes on a boundary line (blank, comment, {@code end}) or on an unindented directive
 * that the block does not claim through {@link #acceptsUnindented(ConfigLine)}.
 * Lines inside a block that match no member shape are ignored.
 */
abstract class BlockParser {

    protected final List<Diagnostic> diagnostics;

    protected BlockParser(List<Diagnostic> diagnostics) {
        this.diagnostics = diagnostics;
    }

    public final void parse(ConfigLines lines) {
        boolean inBlock = false;
        for (ConfigLine line : lines) {
            if (inBlock && endsBlock(line)) {
                closeBlock();
                inBlock = false;
            }
            if (!inBlock) {
                if (line.isDirective()) {
                    inBlock = openBlock(line);
                }
                continue;
            }
            onMember(line);
        }
        if (inBlock) {
            closeBlock();
        }
    }

    private boolean endsBlock(ConfigLine line) {
        if (line.isBoundary()) {
            return true;
        }
        return !line.indented() && !acceptsUnindented(line);
    }

    /**
     * @return true if the line is this parser's block header and a block was started
     */
    protected abstract boolean openBlock(ConfigLine header);

    protected abstract void onMember(ConfigLine line);

    protected abstract void closeBlock();

    /**
     * Lets flat (unindented) input keep a block open for lines that can only be members.
     */
    protected boolean acceptsUnindented(ConfigLine line) {
        return false;
    }

    protected static boolean startsWithAny(ConfigLine line, String... prefixes) {
        for (String prefix : prefixes) {
            if (line.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    protected static String firstToken(String text) {
        if (text == null || text.isBlank()) return "";
        String[] parts = text.strip().split("\\s+");
        return parts[0];
    }
}
