package org.circuitrepl.session;

/**
 * An externally managed terminal process that receives raw keystrokes in pass-through mode.
 * Its output is fed back through {@link SessionController#onPassThroughOutput(String)}.
 */
public interface IPassThroughTarget extends AutoCloseable {

    void write(String rawInput);

    @Override
    void close();
}
