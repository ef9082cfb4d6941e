package org.circuitrepl.protocol;

/**
 * Result of an {@code execute} request. {@code output} and {@code error} hold the captured
 * standard output and standard error of the interpreter.
 */
public record ExecuteResult(String output, String error, ExecutionMode mode) {
}
