/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.api.model.source;

/**
 * IP protocols recognized in the protocol position of an ACL rule.
 * {@link #IP} matches any protocol and is emitted as an empty protocol list.
 */
public enum Protocol {
    IP("ip", 0),
    ICMP("icmp", 1),
    TCP("tcp", 6),
    UDP("udp", 17),
    GRE("gre", 47),
    ESP("esp", 50),
    AH("ah", 51),
    ICMPV6("icmpv6", 58),
    OSPF("ospf", 89),
    SCTP("sctp", 132);

    private final String keyword;
    private final int id;

    Protocol(String keyword, int id) {
        this.keyword = keyword;
        this.id = id;
    }

    public String keyword() {
        return keyword;
    }

    public int id() {
        return id;
    }

    public boolean isAny() {
        return this == IP;
    }

    /**
     * @return the protocol for a keyword, or null if the token is not a protocol keyword
     */
    public static Protocol fromKeyword(String token) {
        if (token == null) return null;
        String lower = token.toLowerCase();
        for (Protocol protocol : values()) {
            if (protocol.keyword.equals(lower)) {
                return protocol;
            }
        }
        return null;
    }
}
