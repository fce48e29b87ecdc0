/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class IdGeneratorTest {

    @Test
    @DisplayName("Deterministic ids repeat across generators for the same sequence of requests")
    void deterministicIsStable() {
        DeterministicIdGenerator first = new DeterministicIdGenerator();
        DeterministicIdGenerator second = new DeterministicIdGenerator();

        assertThat(first.nextId("zone", "INSIDE")).isEqualTo(second.nextId("zone", "INSIDE"));
        assertThat(first.nextId("zone", "INSIDE")).isEqualTo(second.nextId("zone", "INSIDE"));
    }

    @Test
    @DisplayName("Repeated, differently-kinded and differently-namespaced requests get distinct ids")
    void deterministicDistinguishes() {
        DeterministicIdGenerator ids = new DeterministicIdGenerator();

        String first = ids.nextId("zone", "INSIDE");
        assertThat(ids.nextId("zone", "INSIDE")).isNotEqualTo(first);
        assertThat(ids.nextId("filter-policy", "INSIDE")).isNotEqualTo(first);
        assertThat(new DeterministicIdGenerator("other").nextId("zone", "INSIDE")).isNotEqualTo(first);
    }

    @Test
    void randomIdsAreVersion4Uuids() {
        RandomIdGenerator ids = new RandomIdGenerator();

        UUID id = UUID.fromString(ids.nextId("zone", "INSIDE"));
        assertThat(id.version()).isEqualTo(4);
        assertThat(ids.nextId("zone", "INSIDE")).isNotEqualTo(id.toString());
    }
}
