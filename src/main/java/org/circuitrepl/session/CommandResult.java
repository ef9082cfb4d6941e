package org.circuitrepl.session;

/**
 * Outcome of a submitted line, ready for rendering.
 *
 * @param success Whether the command succeeded.
 * @param output  Normal output, may be empty.
 * @param error   Error text, null on success.
 */
public record CommandResult(boolean success, String output, String error) {

    public static CommandResult ok(final String output) {
        return new CommandResult(true, output, null);
    }

    public static CommandResult failed(final String error) {
        return new CommandResult(false, "", error);
    }
}
