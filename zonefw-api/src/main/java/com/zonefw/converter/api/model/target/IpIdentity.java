/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.target;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Address identity. Each member is a host address or a CIDR block.
 */
public record IpIdentity(
        @JsonProperty("_id_") String id,
        @JsonProperty("name") String name,
        @JsonProperty("members") List<Member> members
) implements Identity {

    public IpIdentity {
        members = List.copyOf(members);
    }

    public static IpIdentity of(String id, String name, List<String> addresses) {
        return new IpIdentity(id, name, addresses.stream().map(Member::new).toList());
    }

    @JsonProperty("friendly_name")
    public String friendlyName() {
        return "";
    }

    public List<String> addresses() {
        return members.stream().map(Member::address).toList();
    }

    public record Member(@JsonProperty("address") String address) {}
}
