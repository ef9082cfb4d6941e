package org.circuitrepl.protocol;

/**
 * Raised when the channel to the runtime worker is closed or the worker went away.
 */
public class ChannelClosedException extends SessionException {

    public ChannelClosedException(String message) {
        super(message);
    }

    public ChannelClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
