/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api;

import java.util.Map;

/**
 * Callback interface for conversion stage events.
 *
 * <p>The pipeline runs these stages in order:
 * <ol>
 *   <li>PARSING - classify lines and run the section parsers</li>
 *   <li>IDENTITY_BUILDING - turn object groups into ip and port identities</li>
 *   <li>POLICY_ASSEMBLY - translate and consolidate rules into filter policies</li>
 *   <li>FORWARDING_ASSEMBLY - build zones and zone forwardings</li>
 *   <li>EMISSION - serialize the document</li>
 *   <li>VALIDATION - structural checks on the document</li>
 * </ol>
 */
public interface ConversionListener {

    /**
     * Called when a stage starts.
     *
     * @param stageName   name of the stage (e.g., "PARSING")
     * @param stageNumber current stage number (1-based)
     * @param totalStages total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a stage completes successfully.
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a stage fails. The exception is rethrown to the caller afterwards.
     */
    void onError(String stageName, Exception error);

    /**
     * @param metrics stage-specific counts (e.g., "accessLists", "ruleCount")
     */
    record StageResult(String stageName, long durationNanos, Map<String, Object> metrics) {

        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
