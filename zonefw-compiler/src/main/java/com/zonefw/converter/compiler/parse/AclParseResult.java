/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import com.zonefw.converter.api.model.source.AclRule;

/**
 * Outcome of parsing one {@code permit|deny} line.
 */
public sealed interface AclParseResult {

    record Parsed(AclRule rule) implements AclParseResult {}

    record Unparsed(int lineNumber, String line, String reason) implements AclParseResult {}
}
