/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api;

import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for converting router zone-firewall configuration text into a zone firewall document.
 */
public interface IConfigConverter {

    /**
     * Converts a configuration file.
     *
     * @param configPath path to a UTF-8 configuration file
     * @throws IOException if the file cannot be read or decoded
     */
    ConversionResult convert(Path configPath, ConversionOptions options) throws IOException;

    /**
     * Converts configuration text already held in memory.
     */
    ConversionResult convert(String configText, ConversionOptions options);

    default ConversionResult convert(Path configPath) throws IOException {
        return convert(configPath, ConversionOptions.defaults());
    }

    /**
     * Sets the tracer for observability.
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a listener for tracking conversion progress (null to disable).
     */
    default void setConversionListener(ConversionListener listener) {
    }
}
