/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.service;

public final class SampleConfigs {

    public static final String TWO_ZONES = """
            zone security INSIDE
            zone security OUTSIDE
            !
            object-group network NET-LAN
             192.168.10.0 255.255.255.0
            !
            ip access-list extended ACL_OUT
             permit tcp object-group NET-LAN any eq https
            !
            class-map type inspect match-any CM-OUT
             match access-group name ACL_OUT
            !
            policy-map type inspect PM-OUT
             class type inspect CM-OUT
              inspect
            !
            zone-pair security ZP-OUT source INSIDE destination OUTSIDE
             service-policy type inspect PM-OUT
            !
            interface GigabitEthernet0/0
             zone-member security INSIDE
            !
            interface GigabitEthernet0/1
             zone-member security OUTSIDE
            """;

    private SampleConfigs() {
    }
}
