/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.service;

import com.zonefw.converter.api.ConversionOptions;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Parsed command line. Either a conversion of {@code configFile} or, with {@code serve}, the
 * HTTP service on {@code port}.
 */
record CommandLineArguments(
        Path configFile,
        Optional<Path> output,
        ConversionOptions options,
        boolean serve,
        int port
) {
    static final String USAGE = """
            Usage: zonefw-convert <config-file> [--add-internet-zone] [--internet-zone-name NAME]
                                  [--number-acl-rules] [--deterministic-ids] [--output PATH]
                   zonefw-convert --serve [--port N]
            """;

    static CommandLineArguments parse(String[] args) {
        Path configFile = null;
        Path output = null;
        boolean serve = false;
        int port = Integer.parseInt(System.getProperty("server.port", "8080"));
        ConversionOptions.Builder options = ConversionOptions.builder();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--add-internet-zone" -> options.addInternetZone(true);
                case "--internet-zone-name" -> options.internetZoneName(value(args, ++i, arg));
                case "--number-acl-rules" -> options.numberAclRules(true);
                case "--deterministic-ids" -> options.idStrategy(ConversionOptions.IdStrategy.DETERMINISTIC);
                case "--output", "-o" -> output = Path.of(value(args, ++i, arg));
                case "--serve" -> serve = true;
                case "--port" -> {
                    String value = value(args, ++i, arg);
                    try {
                        port = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid port: " + value, e);
                    }
                }
                default -> {
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (configFile != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
                    configFile = Path.of(arg);
                }
            }
        }

        if (!serve && configFile == null) {
            throw new IllegalArgumentException("Missing configuration file");
        }
        return new CommandLineArguments(configFile, Optional.ofNullable(output), options.build(), serve, port);
    }

    /**
     * Explicit output path, or {@code <base>_cradlepoint.json} next to the input with a
     * trailing {@code .txt} removed.
     */
    Path outputPath() {
        return output.orElseGet(() -> defaultOutputPath(configFile));
    }

    static Path defaultOutputPath(Path configFile) {
        String fileName = configFile.getFileName().toString();
        String base = fileName.endsWith(".txt") ? fileName.substring(0, fileName.length() - 4) : fileName;
        return configFile.resolveSibling(base + "_cradlepoint.json");
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Option " + option + " requires a value");
        }
        return args[index];
    }
}
