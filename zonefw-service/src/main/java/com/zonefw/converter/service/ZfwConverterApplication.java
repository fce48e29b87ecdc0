/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zonefw.converter.api.ConversionResult;
import com.zonefw.converter.api.ConversionSummary;
import com.zonefw.converter.api.exceptions.ConversionException;
import com.zonefw.converter.api.model.Diagnostic;
import com.zonefw.converter.compiler.ConfigConverter;
import com.zonefw.converter.service.server.ConverterHttpServer;
import com.zonefw.converter.service.store.ConversionOutputStore;
import com.zonefw.converter.service.telemetry.TracingService;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Date;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Command line entry point: converts one configuration file, or runs the HTTP service with
 * {@code --serve}.
 */
public class ZfwConverterApplication {
    private static final Logger logger = Logger.getLogger(ZfwConverterApplication.class.getName());

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PrintStream out;

    private ConverterHttpServer httpServer;
    private TracingService tracingService;

    ZfwConverterApplication(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        configureLogging();
        CommandLineArguments arguments;
        try {
            arguments = CommandLineArguments.parse(args);
        } catch (IllegalArgumentException | ConversionException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.print(CommandLineArguments.USAGE);
            System.exit(1);
            return;
        }

        ZfwConverterApplication app = new ZfwConverterApplication(System.out);
        if (!arguments.serve()) {
            int exitCode = app.convert(arguments);
            TracingService.getInstance().shutdown();
            System.exit(exitCode);
        }
        try {
            app.serve(arguments.port());
            Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown));
            Thread.currentThread().join();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Service failed to start: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Converts the configured file and writes the document.
     *
     * @return the process exit code
     */
    int convert(CommandLineArguments arguments) {
        try {
            ConfigConverter converter = new ConfigConverter(TracingService.getInstance().getTracer(), objectMapper);
            ConversionResult result = converter.convert(arguments.configFile(), arguments.options());

            Path outputPath = arguments.outputPath();
            try {
                Files.write(outputPath, objectMapper.writerWithDefaultPrettyPrinter()
                        .writeValueAsBytes(result.document()));
            } catch (JsonProcessingException e) {
                throw new ConversionException("Failed to serialize configuration", e);
            }
            printSummary(result, outputPath);
            return 0;
        } catch (IOException | RuntimeException e) {
            logger.log(Level.SEVERE, "Conversion failed: " + e.getMessage(), e);
            out.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void printSummary(ConversionResult result, Path outputPath) {
        ConversionSummary summary = result.summary();
        out.println("Configuration written to " + outputPath);
        out.println("  Zones:            " + summary.zones());
        out.println("  Filter policies:  " + summary.filterPolicies());
        out.println("  Forwardings:      " + summary.forwardings());
        out.println("  IP identities:    " + summary.ipIdentities());
        out.println("  Port identities:  " + summary.portIdentities());
        if (!result.diagnostics().isEmpty()) {
            out.println("  Skipped:          " + result.diagnostics().size());
            for (Diagnostic diagnostic : result.diagnostics()) {
                logger.fine(diagnostic::toString);
            }
        }
        if (!result.isValid()) {
            out.println("  Validation:       " + String.join("; ", result.validationErrors()));
        }
    }

    void serve(int port) throws IOException {
        logger.info("Starting zone firewall converter service");
        tracingService = TracingService.getInstance();
        ConfigConverter converter = new ConfigConverter(tracingService.getTracer(), objectMapper);
        httpServer = new ConverterHttpServer(port, converter, new ConversionOutputStore(), tracingService.getTracer());
        httpServer.start();
        logger.info("Converter service is ready to serve requests on port " + httpServer.getPort());
    }

    void shutdown() {
        if (httpServer != null) httpServer.stop();
        if (tracingService != null) tracingService.shutdown();
        logger.info("Converter service shutdown complete");
    }

    /**
     * Applies {@code logging.properties} from the classpath, or a console handler with the same
     * format when the file is absent.
     */
    private static void configureLogging() {
        try (InputStream config = ZfwConverterApplication.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
                return;
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
        LogManager.getLogManager().reset();
        Logger rootLogger = Logger.getLogger("");
        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.INFO);
        consoleHandler.setFormatter(new SimpleFormatter() {
            @Override
            public String format(LogRecord record) {
                return String.format("[%1$tF %1$tT.%1$tL] [%2$-7s] %3$s - %4$s%n",
                        new Date(record.getMillis()), record.getLevel(),
                        record.getLoggerName(), record.getMessage());
            }
        });
        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(Level.INFO);
    }
}
