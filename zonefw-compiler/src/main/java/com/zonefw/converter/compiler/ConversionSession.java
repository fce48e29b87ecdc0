/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler;

import com.zonefw.converter.api.ConversionOptions;
import com.zonefw.converter.api.model.Diagnostic;
import com.zonefw.converter.compiler.id.DeterministicIdGenerator;
import com.zonefw.converter.compiler.id.IdGenerator;
import com.zonefw.converter.compiler.id.RandomIdGenerator;
import com.zonefw.converter.compiler.translate.LiteralIdentityPool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Mutable state of a single conversion run: options, id source, literal identities and
 * collected diagnostics. Created per run and never shared between threads.
 */
public final class ConversionSession {
    private static final Logger logger = Logger.getLogger(ConversionSession.class.getName());

    private final ConversionOptions options;
    private final IdGenerator ids;
    private final LiteralIdentityPool literals;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public ConversionSession(ConversionOptions options) {
        this(options, options.idStrategy() == ConversionOptions.IdStrategy.DETERMINISTIC
                ? new DeterministicIdGenerator()
                : new RandomIdGenerator());
    }

    public ConversionSession(ConversionOptions options, IdGenerator ids) {
        this.options = options;
        this.ids = ids;
        this.literals = new LiteralIdentityPool(ids);
    }

    public ConversionOptions options() {
        return options;
    }

    public IdGenerator ids() {
        return ids;
    }

    public LiteralIdentityPool literals() {
        return literals;
    }

    public void addDiagnostics(Collection<Diagnostic> found) {
        diagnostics.addAll(found);
    }

    /**
     * Records a reference that could not become an identity. The rule that carried it is kept.
     */
    public void unresolved(String message) {
        logger.warning(message);
        diagnostics.add(Diagnostic.unresolved(message));
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Live view used by builders that append while they run.
     */
    public List<Diagnostic> diagnosticSink() {
        return diagnostics;
    }
}
