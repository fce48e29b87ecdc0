/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api;

import com.zonefw.converter.api.exceptions.ConversionException;
import com.zonefw.converter.api.model.target.FirmwareMetadata;

/**
 * Caller-supplied switches for one conversion run.
 *
 * @param addInternetZone  add a WAN-triggered zone and forward every other zone to it
 * @param internetZoneName name of that zone
 * @param numberAclRules   suffix rule names with their ACL-local ordinal when the ACL has several rules
 * @param idStrategy       how object ids are generated
 * @param firmware         top-level metadata written into the document
 */
public record ConversionOptions(
        boolean addInternetZone,
        String internetZoneName,
        boolean numberAclRules,
        IdStrategy idStrategy,
        FirmwareMetadata firmware
) {
    public static final String DEFAULT_INTERNET_ZONE_NAME = "EXT-Internet";

    public enum IdStrategy {
        /** Random UUIDs, different on every run. */
        RANDOM,
        /** Name-based UUIDs, identical across runs on the same input. */
        DETERMINISTIC
    }

    public ConversionOptions {
        if (internetZoneName == null) {
            internetZoneName = DEFAULT_INTERNET_ZONE_NAME;
        }
        if (addInternetZone && internetZoneName.isBlank()) {
            throw new ConversionException("Internet zone name cannot be blank");
        }
        idStrategy = idStrategy == null ? IdStrategy.RANDOM : idStrategy;
        firmware = firmware == null ? FirmwareMetadata.DEFAULT : firmware;
    }

    public static ConversionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean addInternetZone;
        private String internetZoneName = DEFAULT_INTERNET_ZONE_NAME;
        private boolean numberAclRules;
        private IdStrategy idStrategy = IdStrategy.RANDOM;
        private FirmwareMetadata firmware = FirmwareMetadata.DEFAULT;

        public Builder addInternetZone(boolean addInternetZone) {
            this.addInternetZone = addInternetZone;
            return this;
        }

        public Builder internetZoneName(String internetZoneName) {
            this.internetZoneName = internetZoneName;
            return this;
        }

        public Builder numberAclRules(boolean numberAclRules) {
            this.numberAclRules = numberAclRules;
            return this;
        }

        public Builder idStrategy(IdStrategy idStrategy) {
            this.idStrategy = idStrategy;
            return this;
        }

        public Builder firmware(FirmwareMetadata firmware) {
            this.firmware = firmware;
            return this;
        }

        public ConversionOptions build() {
            return new ConversionOptions(addInternetZone, internetZoneName, numberAclRules, idStrategy, firmware);
        }
    }
}
