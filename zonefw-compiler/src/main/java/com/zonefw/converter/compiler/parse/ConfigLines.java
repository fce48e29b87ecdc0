/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.parse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The classified, ordered line sequence shared by every section parser.
 * Blank and comment lines are kept as block boundaries but never carry content.
 */
public final class ConfigLines implements Iterable<ConfigLine> {

    private final List<ConfigLine> lines;

    private ConfigLines(List<ConfigLine> lines) {
        this.lines = Collections.unmodifiableList(lines);
    }

    public static ConfigLines of(List<String> rawLines) {
        List<ConfigLine> classified = new ArrayList<>(rawLines.size());
        int number = 1;
        for (String raw : rawLines) {
            classified.add(ConfigLine.classify(number++, raw));
        }
        return new ConfigLines(classified);
    }

    public static ConfigLines of(String text) {
        return of(text.lines().toList());
    }

    /**
     * Reads a UTF-8 file. Malformed input fails with a
     * {@link java.nio.charset.CharacterCodingException}.
     */
    public static ConfigLines read(Path path) throws IOException {
        return of(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    public List<ConfigLine> all() {
        return lines;
    }

    public int size() {
        return lines.size();
    }

    @Override
    public Iterator<ConfigLine> iterator() {
        return lines.iterator();
    }
}
