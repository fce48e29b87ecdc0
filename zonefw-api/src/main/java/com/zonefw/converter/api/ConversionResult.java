/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zonefw.converter.api.model.Diagnostic;
import com.zonefw.converter.api.model.target.ZfwConfiguration;

import java.util.List;

/**
 * Everything a conversion run produces.
 *
 * @param document          the serialized target document
 * @param configuration     the typed model the document was emitted from
 * @param validationErrors  advisory structural problems found in {@code document}
 * @param diagnostics       lines and references that were skipped
 */
public record ConversionResult(
        ObjectNode document,
        ZfwConfiguration configuration,
        List<String> validationErrors,
        List<Diagnostic> diagnostics
) {
    public ConversionResult {
        validationErrors = List.copyOf(validationErrors);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isValid() {
        return validationErrors.isEmpty();
    }

    public ConversionSummary summary() {
        return ConversionSummary.of(configuration);
    }
}
