/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.identity;

/**
 * IP literal checks and mask conversion. Never performs name resolution.
 */
public final class IpAddresses {

    private IpAddresses() {
    }

    public static boolean isValid(String ip) {
        return isIpv4(ip) || isIpv6(ip);
    }

    public static boolean isIpv4(String ip) {
        return ipv4Value(ip) >= 0;
    }

    /**
     * Loose IPv6 syntax check: hex groups separated by colons, at most one {@code ::},
     * optionally ending in a dotted IPv4 tail.
     */
    public static boolean isIpv6(String ip) {
        if (ip == null || ip.indexOf(':') < 0 || ip.length() > 45) return false;
        int compressions = 0;
        for (int i = ip.indexOf("::"); i >= 0; i = ip.indexOf("::", i + 1)) {
            compressions++;
        }
        if (compressions > 1 || ip.contains(":::")) return false;

        String[] groups = ip.split(":", -1);
        int counted = 0;
        for (int i = 0; i < groups.length; i++) {
            String group = groups[i];
            if (group.isEmpty()) continue;
            if (i == groups.length - 1 && group.indexOf('.') >= 0) {
                if (!isIpv4(group)) return false;
                counted += 2;
                continue;
            }
            if (group.length() > 4) return false;
            for (int c = 0; c < group.length(); c++) {
                if (Character.digit(group.charAt(c), 16) < 0) return false;
            }
            counted++;
        }
        return compressions == 1 ? counted < 8 : counted == 8;
    }

    /**
     * Converts a dotted netmask ({@code 255.255.255.0}), a Cisco wildcard mask
     * ({@code 0.0.0.255}) or a prefix length ({@code 24} or {@code /24}) to a prefix length.
     *
     * @return the prefix length, or 32 when the mask cannot be interpreted
     */
    public static int prefixLength(String mask) {
        if (mask == null || mask.isBlank()) return 32;
        String m = mask.strip();
        if (m.startsWith("/")) m = m.substring(1);
        if (m.indexOf('.') < 0) {
            try {
                int prefix = Integer.parseInt(m);
                return prefix >= 0 && prefix <= 32 ? prefix : 32;
            } catch (NumberFormatException e) {
                return 32;
            }
        }
        long value = ipv4Value(m);
        if (value < 0) return 32;
        long inverted = ~value & 0xFFFFFFFFL;
        if ((inverted & (inverted + 1)) == 0) {
            return Long.bitCount(value);
        }
        if ((value & (value + 1)) == 0) {
            return 32 - Long.bitCount(value);
        }
        return 32;
    }

    public static String cidr(String ip, String mask) {
        return ip + "/" + prefixLength(mask);
    }

    private static long ipv4Value(String ip) {
        if (ip == null) return -1;
        String[] octets = ip.split("\\.", -1);
        if (octets.length != 4) return -1;
        long value = 0;
        for (String octet : octets) {
            if (octet.isEmpty() || octet.length() > 3) return -1;
            for (int i = 0; i < octet.length(); i++) {
                char c = octet.charAt(i);
                if (c < '0' || c > '9') return -1;
            }
            int n = Integer.parseInt(octet);
            if (n > 255) return -1;
            value = (value << 8) | n;
        }
        return value;
    }
}
