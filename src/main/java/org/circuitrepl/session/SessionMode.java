package org.circuitrepl.session;

import java.util.Locale;

public enum SessionMode {
    /** Host shell with CLI-style commands. Bare shell words are commands. */
    SHELL("mu2> "),
    /** Interactive interpreter prompt. */
    DEVICE_REPL(">>> ");

    private final String prompt;

    SessionMode(final String prompt) {
        this.prompt = prompt;
    }

    public String prompt() {
        return prompt;
    }

    /**
     * Parses {@code shell} or {@code device-repl}, case-insensitively.
     */
    public static SessionMode parse(final String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
