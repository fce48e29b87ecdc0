/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.service.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zonefw.converter.api.ConversionOptions;
import com.zonefw.converter.api.ConversionResult;
import com.zonefw.converter.api.IConfigConverter;
import com.zonefw.converter.service.store.ConversionOutputStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP front end for the converter.
 *
 * <ul>
 *   <li>{@code POST /api/convert} returns the document inline.</li>
 *   <li>{@code POST /upload} stores the document and returns a session id and summary.</li>
 *   <li>{@code GET /download/{session_id}} returns a stored document as an attachment.</li>
 *   <li>{@code GET /health}</li>
 * </ul>
 *
 * The request body is the configuration text. Query parameters {@code add_internet_zone}
 * ({@code on} or {@code true}) and {@code internet_zone_name} select the options.
 */
public class ConverterHttpServer {
    private static final Logger logger = Logger.getLogger(ConverterHttpServer.class.getName());

    static final String SERVICE_NAME = "zonefw-converter";

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final IConfigConverter converter;
    private final ConversionOutputStore store;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Tracer tracer;

    public ConverterHttpServer(int port, IConfigConverter converter, ConversionOutputStore store, Tracer tracer)
            throws IOException {
        this.converter = converter;
        this.store = store;
        this.tracer = tracer;
        this.executor = Executors.newFixedThreadPool(Runtime.getRuntime().availableProcessors() * 2);
        this.server = com.sun.net.httpserver.HttpServer.create(new InetSocketAddress(port), 100);
        server.createContext("/api/convert", new ConvertHandler());
        server.createContext("/upload", new UploadHandler());
        server.createContext("/download/", new DownloadHandler());
        server.createContext("/health", new HealthHandler());
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        logger.info("HTTP server listening on port " + getPort());
    }

    public void stop() {
        server.stop(0);
        executor.shutdown();
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    private class ConvertHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            Span span = tracer.spanBuilder("POST /api/convert").startSpan();
            try (Scope scope = span.makeCurrent()) {
                if (!"POST".equals(exchange.getRequestMethod())) {
                    sendResponse(exchange, 405, Map.of("error", "Method not allowed"));
                    return;
                }
                ConversionResult result = convert(exchange, span);
                Map<String, Object> response = new LinkedHashMap<>();
                response.put("success", true);
                response.put("configuration", result.document());
                sendResponse(exchange, 200, response);
            } catch (Exception e) {
                span.recordException(e);
                logger.log(Level.SEVERE, "Conversion request failed", e);
                sendError(exchange, e);
            } finally {
                span.end();
            }
        }
    }

    private class UploadHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            Span span = tracer.spanBuilder("POST /upload").startSpan();
            try (Scope scope = span.makeCurrent()) {
                if (!"POST".equals(exchange.getRequestMethod())) {
                    sendResponse(exchange, 405, Map.of("error", "Method not allowed"));
                    return;
                }
                ConversionResult result = convert(exchange, span);
                String sessionId = store.put(objectMapper.writerWithDefaultPrettyPrinter()
                        .writeValueAsBytes(result.document()));
                span.setAttribute("sessionId", sessionId);

                Map<String, Object> response = new LinkedHashMap<>();
                response.put("success", true);
                response.put("session_id", sessionId);
                response.put("output_filename", ConversionOutputStore.outputFilename(sessionId));
                response.put("config_summary", result.summary());
                sendResponse(exchange, 200, response);
            } catch (Exception e) {
                span.recordException(e);
                logger.log(Level.SEVERE, "Upload request failed", e);
                sendError(exchange, e);
            } finally {
                span.end();
            }
        }
    }

    private class DownloadHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            Span span = tracer.spanBuilder("GET /download").startSpan();
            try (Scope scope = span.makeCurrent()) {
                if (!"GET".equals(exchange.getRequestMethod())) {
                    sendResponse(exchange, 405, Map.of("error", "Method not allowed"));
                    return;
                }
                String sessionId = exchange.getRequestURI().getPath().substring("/download/".length());
                span.setAttribute("sessionId", sessionId);
                Optional<byte[]> document = store.get(sessionId);
                if (document.isEmpty()) {
                    sendResponse(exchange, 404, Map.of("success", false, "error", "File not found"));
                    return;
                }
                byte[] bytes = document.get();
                exchange.getResponseHeaders().set("Content-Type", "application/json");
                exchange.getResponseHeaders().set("Content-Disposition",
                        "attachment; filename=\"" + ConversionOutputStore.outputFilename(sessionId) + "\"");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            } catch (Exception e) {
                span.recordException(e);
                sendError(exchange, e);
            } finally {
                span.end();
            }
        }
    }

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, Map.of("error", "Method not allowed"));
                return;
            }
            sendResponse(exchange, 200, Map.of("status", "healthy", "service", SERVICE_NAME));
        }
    }

    private ConversionResult convert(HttpExchange exchange, Span span) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("No configuration provided");
        }
        ConversionOptions options = optionsFrom(parseQuery(exchange.getRequestURI().getRawQuery()));
        span.setAttribute("bodyLength", body.length());
        span.setAttribute("addInternetZone", options.addInternetZone());
        return converter.convert(body, options);
    }

    static ConversionOptions optionsFrom(Map<String, String> query) {
        String flag = query.getOrDefault("add_internet_zone", "");
        String zoneName = query.get("internet_zone_name");
        return ConversionOptions.builder()
                .addInternetZone("on".equalsIgnoreCase(flag) || "true".equalsIgnoreCase(flag))
                .internetZoneName(zoneName == null || zoneName.isEmpty()
                        ? ConversionOptions.DEFAULT_INTERNET_ZONE_NAME : zoneName)
                .build();
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private void sendError(HttpExchange exchange, Exception e) throws IOException {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        sendResponse(exchange, 400, Map.of("success", false, "error", message));
    }

    private void sendResponse(HttpExchange exchange, int statusCode, Object response) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(response);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
