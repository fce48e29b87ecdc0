/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.zonefw.converter.api.ConversionListener;
import com.zonefw.converter.api.ConversionOptions;
import com.zonefw.converter.api.ConversionResult;
import com.zonefw.converter.api.ConversionSummary;
import com.zonefw.converter.api.exceptions.ConversionException;
import com.zonefw.converter.api.model.target.FilterPolicy;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigConverterTest {

    private static final ConversionOptions DETERMINISTIC = ConversionOptions.builder()
            .idStrategy(ConversionOptions.IdStrategy.DETERMINISTIC)
            .build();

    private ConfigConverter converter;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        converter = new ConfigConverter(OpenTelemetry.noop().getTracer("test"));
    }

    @Test
    @DisplayName("Branch router converts into a valid document")
    void endToEnd() {
        ConversionResult result = converter.convert(TestConfigs.load(TestConfigs.BRANCH_ROUTER), DETERMINISTIC);

        assertThat(result.isValid()).isTrue();
        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.summary()).isEqualTo(new ConversionSummary(2, 2, 1, 4, 0, 5));

        JsonNode identities = result.document().path("configuration").get(0).path("identities");
        List<String> portNames = new ArrayList<>();
        identities.path("port").forEach(p -> portNames.add(p.path("name").asText()));
        assertThat(portNames).containsExactly("SVC-WEB", "SVC-DNS-TCP", "SVC-DNS-UDP", "PORT-22", "PORT-443");
    }

    @Test
    @DisplayName("Deterministic ids give byte-identical documents")
    void deterministicOutput() {
        String config = TestConfigs.load(TestConfigs.BRANCH_ROUTER);

        ConversionResult first = converter.convert(config, DETERMINISTIC);
        ConversionResult second = new ConfigConverter().convert(config, DETERMINISTIC);

        assertThat(first.document().toString()).isEqualTo(second.document().toString());
    }

    @Test
    void randomIdsDiffer() {
        String config = TestConfigs.load(TestConfigs.BRANCH_ROUTER);

        String first = converter.convert(config, ConversionOptions.defaults()).document().toString();
        String second = converter.convert(config, ConversionOptions.defaults()).document().toString();

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("Internet zone adds one zone, an allow-all policy and a forwarding per zone")
    void internetZone() {
        ConversionResult result = converter.convert(TestConfigs.load(TestConfigs.BRANCH_ROUTER),
                ConversionOptions.builder().addInternetZone(true).internetZoneName("ISP").build());

        assertThat(result.configuration().zoneNamed("ISP")).isPresent();
        assertThat(result.summary().forwardings()).isEqualTo(3);
        assertThat(result.configuration().policyNamed(FilterPolicy.ALLOW_ALL)).isPresent();

        JsonNode policies = result.document().path("configuration").get(0).path("security").path("zfw")
                .path("filter_policies");
        assertThat(policies.fields().next().getValue().path("name").asText()).isEqualTo(FilterPolicy.ALLOW_ALL);
    }

    @Test
    @DisplayName("Empty input produces the default policies and no forwardings")
    void emptyInput() {
        ConversionResult result = converter.convert("", DETERMINISTIC);

        assertThat(result.configuration().filterPolicies()).extracting(FilterPolicy::name)
                .containsExactly(FilterPolicy.DEFAULT_ALLOW_ALL, FilterPolicy.DEFAULT_DENY_ALL);
        assertThat(result.configuration().forwardings()).isEmpty();
        assertThat(result.validationErrors()).contains("No zones found", "No zone forwardings found");
    }

    @Test
    @DisplayName("Listener sees every stage in order")
    void listenerStages() {
        List<String> started = new ArrayList<>();
        List<String> completed = new ArrayList<>();
        converter.setConversionListener(new ConversionListener() {
            @Override
            public void onStageStart(String stageName, int stageNumber, int totalStages) {
                started.add(stageNumber + "/" + totalStages + " " + stageName);
            }

            @Override
            public void onStageComplete(String stageName, StageResult result) {
                completed.add(stageName);
            }

            @Override
            public void onError(String stageName, Exception error) {
            }
        });

        converter.convert(TestConfigs.load(TestConfigs.BRANCH_ROUTER), DETERMINISTIC);

        assertThat(started).containsExactly("1/6 PARSING", "2/6 IDENTITY_BUILDING", "3/6 POLICY_ASSEMBLY",
                "4/6 FORWARDING_ASSEMBLY", "5/6 EMISSION", "6/6 VALIDATION");
        assertThat(completed).hasSize(6);
    }

    @Test
    void convertsFile() throws IOException {
        Path config = tempDir.resolve("router.txt");
        Files.writeString(config, TestConfigs.load(TestConfigs.BRANCH_ROUTER));

        assertThat(converter.convert(config, DETERMINISTIC).isValid()).isTrue();
    }

    @Test
    @DisplayName("Malformed UTF-8 input fails with a decoding error")
    void malformedInput() throws IOException {
        Path config = tempDir.resolve("broken.txt");
        Files.write(config, new byte[]{'z', 'o', 'n', 'e', ' ', (byte) 0xC3, (byte) 0x28});

        assertThatThrownBy(() -> converter.convert(config, DETERMINISTIC))
                .isInstanceOf(CharacterCodingException.class);
    }

    @Test
    void missingFile() {
        assertThatThrownBy(() -> converter.convert(tempDir.resolve("absent.txt"), DETERMINISTIC))
                .isInstanceOf(IOException.class);
    }

    @Test
    void blankInternetZoneName() {
        assertThatThrownBy(() -> ConversionOptions.builder().addInternetZone(true).internetZoneName(" ").build())
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("Internet zone name");
    }
}
