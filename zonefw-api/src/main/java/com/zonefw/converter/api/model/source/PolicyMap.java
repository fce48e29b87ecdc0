/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.source;

import java.util.List;

/**
 * An inspect policy-map: ordered class entries, each with its actions.
 */
public record PolicyMap(String name, List<ClassAction> classActions) {

    public PolicyMap {
        classActions = List.copyOf(classActions);
    }

    public record ClassAction(String className, List<PolicyAction> actions) {
        public ClassAction {
            actions = List.copyOf(actions);
        }

        public boolean drops() {
            return actions.stream().anyMatch(PolicyAction.Drop.class::isInstance);
        }
    }
}
