/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.emit;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Advisory structural checks on an emitted document. Problems are logged and returned;
 * they never stop a conversion.
 */
public class ZfwDocumentValidator {
    private static final Logger logger = Logger.getLogger(ZfwDocumentValidator.class.getName());

    public List<String> validate(JsonNode document) {
        List<String> errors = new ArrayList<>();
        JsonNode configuration = document.path("configuration");
        if (!configuration.isArray() || configuration.isEmpty()) {
            errors.add("No configuration section found");
            report(errors);
            return errors;
        }

        JsonNode zfw = configuration.get(0).path("security").path("zfw");
        JsonNode zones = zfw.path("zones");
        JsonNode policies = zfw.path("filter_policies");
        JsonNode forwardings = zfw.path("forwardings");

        if (zones.isEmpty()) {
            errors.add("No zones found");
        }
        if (policies.isEmpty()) {
            errors.add("No filter policies found");
        }
        if (forwardings.isEmpty()) {
            errors.add("No zone forwardings found");
        }

        Iterator<Map.Entry<String, JsonNode>> entries = forwardings.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String policyId = entry.getValue().path("filter_policy_id").asText("");
            if (!policyId.isEmpty() && !policies.has(policyId)) {
                errors.add("Forwarding " + entry.getKey() + " references invalid filter_policy_id: " + policyId);
            }
        }

        report(errors);
        return errors;
    }

    private static void report(List<String> errors) {
        if (errors.isEmpty()) {
            logger.info("Configuration validation passed");
        } else {
            errors.forEach(error -> logger.warning("Validation: " + error));
        }
    }
}
