/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model;

/**
 * A non-fatal finding raised while converting. Diagnostics never abort a conversion;
 * they let operators audit what was skipped.
 *
 * @param lineNumber 1-based source line, or 0 when the finding is not tied to a line
 */
public record Diagnostic(Kind kind, int lineNumber, String line, String message) {

    public enum Kind {
        /** A line inside a modeled block whose shape is not recognized. */
        UNPARSED_LINE,
        /** An object-group, address or port that could not become an identity. */
        UNRESOLVED_REFERENCE,
        /** A directive that was understood but could not be applied. */
        IGNORED_DIRECTIVE
    }

    public static Diagnostic unparsed(int lineNumber, String line, String reason) {
        return new Diagnostic(Kind.UNPARSED_LINE, lineNumber, line, reason);
    }

    public static Diagnostic unresolved(String message) {
        return new Diagnostic(Kind.UNRESOLVED_REFERENCE, 0, null, message);
    }

    public static Diagnostic ignored(int lineNumber, String line, String message) {
        return new Diagnostic(Kind.IGNORED_DIRECTIVE, lineNumber, line, message);
    }

    @Override
    public String toString() {
        return lineNumber > 0
                ? String.format("%s line %d: %s [%s]", kind, lineNumber, message, line)
                : String.format("%s: %s", kind, message);
    }
}
