package org.circuitrepl.worker.interpreter;

/**
 * Raised when the embedded interpreter itself fails, as opposed to user code raising an error.
 */
public class InterpreterException extends Exception {

    public InterpreterException(String message) {
        super(message);
    }

    public InterpreterException(String message, Throwable cause) {
        super(message, cause);
    }
}
