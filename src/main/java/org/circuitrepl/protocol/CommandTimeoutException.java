package org.circuitrepl.protocol;

/**
 * Rejects a pending command whose deadline passed before a response arrived.
 */
public class CommandTimeoutException extends SessionException {

    public CommandTimeoutException(String message) {
        super(message);
    }

    public CommandTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
