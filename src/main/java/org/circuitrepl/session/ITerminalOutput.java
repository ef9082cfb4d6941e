package org.circuitrepl.session;

/**
 * Where the session writes terminal text, ANSI sequences included.
 */
@FunctionalInterface
public interface ITerminalOutput {

    void write(String text);
}
