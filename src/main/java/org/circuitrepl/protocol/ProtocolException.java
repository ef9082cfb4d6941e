package org.circuitrepl.protocol;

/**
 * Raised for malformed or unexpected protocol frames.
 */
public class ProtocolException extends SessionException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
