package org.circuitrepl.protocol;

/**
 * Rejects a pending command discarded by a user interrupt.
 */
public class CommandInterruptedException extends SessionException {

    public CommandInterruptedException(String message) {
        super(message);
    }

    public CommandInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
