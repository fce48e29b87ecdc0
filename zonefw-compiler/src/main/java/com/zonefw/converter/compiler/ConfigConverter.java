/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zonefw.converter.api.ConversionListener;
import com.zonefw.converter.api.ConversionOptions;
import com.zonefw.converter.api.ConversionResult;
import com.zonefw.converter.api.IConfigConverter;
import com.zonefw.converter.api.model.source.ParsedConfig;
import com.zonefw.converter.api.model.target.IpIdentity;
import com.zonefw.converter.api.model.target.PortIdentity;
import com.zonefw.converter.api.model.target.ZfwConfiguration;
import com.zonefw.converter.compiler.assembly.ForwardingAssembler;
import com.zonefw.converter.compiler.assembly.PolicyAssembler;
import com.zonefw.converter.compiler.assembly.ZfwModelBuilder;
import com.zonefw.converter.compiler.emit.ZfwDocumentEmitter;
import com.zonefw.converter.compiler.emit.ZfwDocumentValidator;
import com.zonefw.converter.compiler.identity.IdentityBuilder;
import com.zonefw.converter.compiler.identity.IdentityTable;
import com.zonefw.converter.compiler.parse.ConfigLines;
import com.zonefw.converter.compiler.parse.ConfigParser;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Runs the conversion pipeline: parse, build identities, assemble policies, assemble zones and
 * forwardings, emit, validate. Each stage runs in its own span and is reported to the
 * {@link ConversionListener} if one is set.
 *
 * <p>Instances hold no per-run state and may be reused; every call creates a fresh
 * {@link ConversionSession}.
 */
public class ConfigConverter implements IConfigConverter {
    private static final Logger logger = Logger.getLogger(ConfigConverter.class.getName());
    private static final int TOTAL_STAGES = 6;

    private final ConfigParser parser = new ConfigParser();
    private final PolicyAssembler policyAssembler = new PolicyAssembler();
    private final ForwardingAssembler forwardingAssembler = new ForwardingAssembler();
    private final ZfwDocumentEmitter emitter;
    private final ZfwDocumentValidator validator = new ZfwDocumentValidator();

    private Tracer tracer;
    private ConversionListener listener;

    public ConfigConverter() {
        this(OpenTelemetry.noop().getTracer("zonefw-converter"));
    }

    public ConfigConverter(Tracer tracer) {
        this(tracer, new ObjectMapper());
    }

    public ConfigConverter(Tracer tracer, ObjectMapper objectMapper) {
        this.tracer = tracer;
        this.emitter = new ZfwDocumentEmitter(objectMapper);
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setConversionListener(ConversionListener listener) {
        this.listener = listener;
    }

    @Override
    public ConversionResult convert(Path configPath, ConversionOptions options) throws IOException {
        Span span = tracer.spanBuilder("read-config").startSpan();
        ConfigLines lines;
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("configPath", configPath.toString());
            lines = ConfigLines.read(configPath);
            span.setAttribute("lineCount", lines.size());
        } catch (IOException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to read configuration");
            throw e;
        } finally {
            span.end();
        }
        logger.info("Read " + lines.size() + " lines from " + configPath);
        return convert(lines, options);
    }

    @Override
    public ConversionResult convert(String configText, ConversionOptions options) {
        return convert(ConfigLines.of(configText), options);
    }

    public ConversionResult convert(ConfigLines lines, ConversionOptions options) {
        Span span = tracer.spanBuilder("convert-config").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            ConversionSession session = new ConversionSession(options);

            ParsedConfig parsed = stage("parse-config", "PARSING", 1,
                    () -> parser.parse(lines),
                    p -> Map.of("lines", lines.size(), "accessLists", p.accessLists().size(),
                            "objectGroups", p.objectGroups().size(), "zonePairs", p.zonePairs().size()));
            session.addDiagnostics(parsed.diagnostics());

            IdentityTable identities = stage("build-identities", "IDENTITY_BUILDING", 2,
                    () -> new IdentityBuilder(session.ids(), session.diagnosticSink()).build(parsed.objectGroups()),
                    t -> Map.of("ipIdentities", t.ipIdentities().size(), "portIdentities", t.portIdentities().size()));

            ZfwModelBuilder model = new ZfwModelBuilder();
            stage("assemble-policies", "POLICY_ASSEMBLY", 3, () -> {
                policyAssembler.assemble(parsed, identities, session, model);
                return model;
            }, m -> Map.of("filterPolicies", m.policies().size(),
                    "ruleCount", m.policies().stream().mapToInt(p -> p.rules().size()).sum()));

            stage("assemble-forwardings", "FORWARDING_ASSEMBLY", 4, () -> {
                forwardingAssembler.assembleZones(parsed, session.ids(), model);
                forwardingAssembler.assembleForwardings(parsed, session.ids(), model);
                if (options.addInternetZone()) {
                    forwardingAssembler.addInternetZone(options.internetZoneName(), session.ids(), model);
                }
                return model;
            }, m -> Map.of("zones", m.zones().size(), "forwardings", m.forwardings().size()));

            List<IpIdentity> ipIdentities = new ArrayList<>(identities.ipIdentities());
            ipIdentities.addAll(session.literals().ipIdentities());
            List<PortIdentity> portIdentities = new ArrayList<>(identities.portIdentities());
            portIdentities.addAll(session.literals().portIdentities());
            ZfwConfiguration configuration = model.build(ipIdentities, portIdentities);

            ObjectNode document = stage("emit-document", "EMISSION", 5,
                    () -> emitter.emit(configuration, options.firmware()),
                    d -> Map.of("ipIdentities", ipIdentities.size(), "portIdentities", portIdentities.size()));

            List<String> errors = stage("validate-document", "VALIDATION", 6,
                    () -> validator.validate(document),
                    e -> Map.of("validationErrors", e.size()));

            long elapsed = System.nanoTime() - startTime;
            span.setAttribute("conversionTimeMs", TimeUnit.NANOSECONDS.toMillis(elapsed));
            span.setAttribute("zoneCount", configuration.zones().size());
            span.setAttribute("filterPolicyCount", configuration.filterPolicies().size());
            span.setAttribute("forwardingCount", configuration.forwardings().size());
            span.setAttribute("diagnosticCount", session.diagnostics().size());

            logger.info(String.format("Converted configuration in %d ms: %d zones, %d filter policies, "
                            + "%d forwardings, %d ip identities, %d port identities, %d diagnostics",
                    TimeUnit.NANOSECONDS.toMillis(elapsed), configuration.zones().size(),
                    configuration.filterPolicies().size(), configuration.forwardings().size(),
                    ipIdentities.size(), portIdentities.size(), session.diagnostics().size()));

            return new ConversionResult(document, configuration, errors, session.diagnostics());
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Conversion failed");
            throw e;
        } finally {
            span.end();
        }
    }

    private <T> T stage(String spanName, String stageName, int stageNumber, Supplier<T> work,
                        Function<T, Map<String, Object>> metrics) {
        if (listener != null) {
            listener.onStageStart(stageName, stageNumber, TOTAL_STAGES);
        }
        Span span = tracer.spanBuilder(spanName).startSpan();
        try (Scope scope = span.makeCurrent()) {
            long start = System.nanoTime();
            T result = work.get();
            long duration = System.nanoTime() - start;
            Map<String, Object> stageMetrics = metrics.apply(result);
            stageMetrics.forEach((key, value) -> span.setAttribute(key, String.valueOf(value)));
            if (listener != null) {
                listener.onStageComplete(stageName,
                        new ConversionListener.StageResult(stageName, duration, stageMetrics));
            }
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }
}
