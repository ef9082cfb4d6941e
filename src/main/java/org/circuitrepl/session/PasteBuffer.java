package org.circuitrepl.session;

/**
 * Multi-line buffer of paste mode. Text accumulates until the mode is finished or cancelled.
 */
public final class PasteBuffer {

    private final StringBuilder text = new StringBuilder();
    private boolean active;

    public void enter() {
        active = true;
        text.setLength(0);
    }

    public boolean isActive() {
        return active;
    }

    public void append(final CharSequence chunk) {
        text.append(chunk);
    }

    public void newLine() {
        text.append('\n');
    }

    /**
     * Removes the last character of the current line.
     *
     * @return true if a character was removed.
     */
    public boolean backspace() {
        final int length = text.length();
        if (length == 0 || text.charAt(length - 1) == '\n') {
            return false;
        }
        text.setLength(length - 1);
        return true;
    }

    /**
     * Leaves paste mode.
     *
     * @return the buffered text.
     */
    public String finish() {
        active = false;
        final String content = text.toString();
        text.setLength(0);
        return content;
    }

    public void cancel() {
        active = false;
        text.setLength(0);
    }
}
