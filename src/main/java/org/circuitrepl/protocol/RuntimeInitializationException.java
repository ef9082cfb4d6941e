package org.circuitrepl.protocol;

/**
 * Raised when the embedded interpreter cannot be initialized.
 */
public class RuntimeInitializationException extends SessionException {

    public RuntimeInitializationException(String message) {
        super(message);
    }

    public RuntimeInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
