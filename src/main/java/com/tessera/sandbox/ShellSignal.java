package com.tessera.sandbox;

import java.util.Locale;

/**
 * Signals a client can send to what runs in a sandbox shell.
 */
public enum ShellSignal {
    INT,
    TERM,
    KILL,
    HUP;

    /**
     * Accepts {@code INT}, {@code SIGINT}, {@code int} and so on. Blank or unknown
     * names mean INT, the Ctrl-C of a terminal.
     */
    public static ShellSignal parse(String name) {
        if (name == null || name.isBlank()) {
            return INT;
        }
        String n = name.strip().toUpperCase(Locale.ROOT);
        if (n.startsWith("SIG")) {
            n = n.substring(3);
        }
        for (ShellSignal signal : values()) {
            if (signal.name().equals(n)) {
                return signal;
            }
        }
        return INT;
    }
}
