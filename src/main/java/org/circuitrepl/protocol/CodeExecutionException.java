package org.circuitrepl.protocol;

/**
 * Raised when user code fails inside the worker.
 */
public class CodeExecutionException extends SessionException {

    public CodeExecutionException(String message) {
        super(message);
    }

    public CodeExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
