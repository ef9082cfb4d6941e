package org.circuitrepl.protocol;

/**
 * Base class of all unchecked failures raised by a REPL session and its runtime worker.
 */
public class SessionException extends RuntimeException {

    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
