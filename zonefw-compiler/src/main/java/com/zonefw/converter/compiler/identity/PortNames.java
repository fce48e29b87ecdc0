/*
 * Copyright (c) 2025 ZoneFW Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.zonefw.converter.compiler.identity;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Well-known service names accepted in place of port numbers.
 */
public final class PortNames {

    private static final Map<String, Integer> PORTS = new HashMap<>();

    static {
        register(7, "echo");
        register(9, "discard");
        register(11, "systat");
        register(13, "daytime");
        register(19, "chargen");
        register(20, "ftp-data");
        register(21, "ftp");
        register(22, "ssh");
        register(23, "telnet");
        register(25, "smtp");
        register(37, "time");
        register(42, "nameserver");
        register(43, "whois");
        register(49, "tacacs");
        register(53, "dns", "domain");
        register(67, "dhcp", "bootps");
        register(68, "bootpc");
        register(69, "tftp");
        register(70, "gopher");
        register(77, "rje");
        register(79, "finger");
        register(80, "http", "www");
        register(88, "kerberos");
        register(101, "hostname");
        register(102, "iso-tsap");
        register(104, "acr-nema");
        register(105, "csnet-ns");
        register(107, "rtelnet");
        register(109, "pop-2", "pop2");
        register(110, "pop3", "pop-3");
        register(111, "sunrpc");
        register(113, "ident", "auth");
        register(115, "sftp");
        register(117, "uucp-path");
        register(119, "nntp");
        register(123, "ntp");
        register(129, "pwdgen");
        register(135, "msrpc", "loc-srv");
        register(137, "netbios-ns");
        register(138, "netbios-dgm");
        register(139, "netbios-ssn", "netbios-ss");
        register(143, "imap", "imap2", "imap4");
        register(144, "news");
        register(161, "snmp");
        register(162, "snmptrap");
        register(179, "bgp");
        register(389, "ldap");
        register(443, "https");
        register(445, "smb", "microsoft-ds");
        register(464, "kpasswd");
        register(500, "isakmp");
        register(514, "cmd", "syslog");
        register(515, "lpd");
        register(636, "ldaps");
        register(1494, "citrix", "citrix-ica", "citrix-xenapp");
        register(3306, "mysql");
        register(3389, "rdp");
        register(4500, "non500-isakmp");
        register(8443, "https-alt");
    }

    private PortNames() {
    }

    private static void register(int port, String... names) {
        for (String name : names) {
            PORTS.put(name, port);
        }
    }

    /**
     * Resolves a numeric token (0-65535) or a well-known service name.
     */
    public static OptionalInt resolve(String token) {
        if (token == null || token.isEmpty()) return OptionalInt.empty();
        if (isAsciiNumber(token)) {
            try {
                int port = Integer.parseInt(token);
                return port <= 65535 ? OptionalInt.of(port) : OptionalInt.empty();
            } catch (NumberFormatException e) {
                return OptionalInt.empty();
            }
        }
        Integer port = PORTS.get(token.toLowerCase());
        return port == null ? OptionalInt.empty() : OptionalInt.of(port);
    }

    public static boolean isKnownName(String token) {
        return token != null && PORTS.containsKey(token.toLowerCase());
    }

    /**
     * ASCII digits only; {@link Integer#parseInt} would also accept other Unicode digits.
     */
    private static boolean isAsciiNumber(String token) {
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }
}
