/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import java.util.Arrays;
import java.util.List;

/**
 * One physical line of a configuration file.
 *
 * @param number   1-based line number
 * @param text     the line with surrounding whitespace removed
 * @param indented whether the raw line started with whitespace
 */
public record ConfigLine(int number, String text, boolean indented, Kind kind) {

    public enum Kind {
        BLANK,
        COMMENT,
        DIRECTIVE
    }

    private static final String[] NO_TOKENS = new String[0];

    static ConfigLine classify(int number, String raw) {
        String text = raw.strip();
        boolean indented = !raw.isEmpty() && Character.isWhitespace(raw.charAt(0));
        Kind kind;
        if (text.isEmpty()) {
            kind = Kind.BLANK;
        } else if (text.startsWith("!")) {
            kind = Kind.COMMENT;
        } else {
            kind = Kind.DIRECTIVE;
        }
        return new ConfigLine(number, text, indented, kind);
    }

    public boolean isDirective() {
        return kind == Kind.DIRECTIVE;
    }

    /**
     * Blank lines, comments and the {@code end} terminator close any open block.
     */
    public boolean isBoundary() {
        return kind != Kind.DIRECTIVE || "end".equals(text);
    }

    public boolean startsWith(String prefix) {
        return text.startsWith(prefix);
    }

    /**
     * Text after {@code prefix}, stripped; empty when the line does not start with it.
     */
    public String after(String prefix) {
        return startsWith(prefix) ? text.substring(prefix.length()).strip() : "";
    }

    public String[] tokens() {
        return text.isEmpty() ? NO_TOKENS : text.split("\\s+");
    }

    public List<String> tokenList() {
        return Arrays.asList(tokens());
    }
}
