/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.exceptions;

/**
 * Thrown when a conversion cannot proceed: invalid options or a document that
 * cannot be serialized. I/O failures reading the input surface as {@link java.io.IOException}.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
