package org.circuitrepl.session;

/**
 * Builds the terminal text of a session: prompts, colored results, banners and the progress bar.
 */
public final class SessionRenderer {

    static final String RESET = "\u001b[0m";
    static final String RED = "\u001b[31m";
    static final String GREEN = "\u001b[32m";
    static final String YELLOW = "\u001b[33m";
    static final String DIM = "\u001b[2m";
    static final String OUTPUT_COLOR = "\u001b[38;2;210;117;55m";
    static final String CLEAR_SCREEN = "\u001b[2J\u001b[H";
    static final String CLEAR_LINE = "\r\u001b[K";
    static final String NEWLINE = "\r\n";

    static final String AWAITING_PROMPT = "Awaiting runtime... ";
    static final String CONTINUATION_PROMPT = "... ";
    static final String ERROR_PROMPT = "!!! ";
    static final String PASTE_BANNER = "paste mode; Ctrl-C to cancel, Ctrl-D to finish";
    static final int PROGRESS_CELLS = 40;

    public String prompt(final SessionState state, final SessionMode mode) {
        return switch (state) {
            case AWAITING_RUNTIME -> DIM + AWAITING_PROMPT + RESET;
            case EXECUTING -> CONTINUATION_PROMPT;
            case ERROR -> RED + ERROR_PROMPT + RESET;
            case IDLE -> mode.prompt();
        };
    }

    /**
     * Redraws the prompt line with the given input.
     */
    public String promptLine(final SessionState state, final SessionMode mode, final String input) {
        return CLEAR_LINE + prompt(state, mode) + input;
    }

    public String output(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        final String body = toTerminalNewlines(text);
        return OUTPUT_COLOR + body + RESET + (body.endsWith(NEWLINE) ? "" : NEWLINE);
    }

    public String error(final String message) {
        return RED + "✗" + RESET + " " + toTerminalNewlines(stripTrailingNewline(message)) + NEWLINE;
    }

    public String success(final String message) {
        return GREEN + "✓" + RESET + " " + toTerminalNewlines(stripTrailingNewline(message)) + NEWLINE;
    }

    public String notice(final String message) {
        return YELLOW + message + RESET + NEWLINE;
    }

    public String result(final CommandResult result) {
        final StringBuilder text = new StringBuilder(output(result.output()));
        if (!result.success() || result.error() != null) {
            text.append(error(result.error() == null ? "Command failed" : result.error()));
        }
        return text.toString();
    }

    /**
     * A {@value #PROGRESS_CELLS}-cell bar followed by the percentage and message, drawn over
     * the current line.
     */
    public String progress(final int percent, final String message) {
        final int clamped = Math.max(0, Math.min(100, percent));
        final int filled = clamped * PROGRESS_CELLS / 100;
        return CLEAR_LINE + "[" + "█".repeat(filled) + "░".repeat(PROGRESS_CELLS - filled) + "] "
                + clamped + "% " + (message == null ? "" : message);
    }

    public String interruptEcho() {
        return "^C" + NEWLINE + "KeyboardInterrupt" + NEWLINE;
    }

    public String restartEcho() {
        return NEWLINE + notice("soft reboot");
    }

    public String pasteBanner() {
        return NEWLINE + notice(PASTE_BANNER) + "=== ";
    }

    public String pasteContinuation() {
        return NEWLINE + "=== ";
    }

    public String clearScreen() {
        return CLEAR_SCREEN;
    }

    public String backspace() {
        return "\b \b";
    }

    private static String toTerminalNewlines(final String text) {
        return text.replace("\r\n", "\n").replace("\n", NEWLINE);
    }

    private static String stripTrailingNewline(final String text) {
        String result = text == null ? "" : text;
        while (result.endsWith("\n") || result.endsWith("\r")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
