/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.target;

/**
 * Static top-level fields of an exported configuration document.
 */
public record FirmwareMetadata(
        String firmwareVersion,
        String firmwareBuildTimestamp,
        boolean firmwareMultiImage,
        String configEncryptionId,
        String exportType
) {
    public static final FirmwareMetadata DEFAULT =
            new FirmwareMetadata("7.25.10", "2025-05-12T17:01:24+00:00", false, null, "group");
}
