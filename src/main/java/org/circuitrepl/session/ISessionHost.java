package org.circuitrepl.session;

import org.circuitrepl.protocol.ControlSignal;

/**
 * Callbacks from a session to the host that opened it. All methods are called on the session
 * reactor and default to doing nothing.
 */
public interface ISessionHost {

    default void onControlSignal(final ControlSignal signal) {
    }

    /**
     * Called once when the runtime fails to initialize.
     */
    default void onInitializationFailure(final String message) {
    }

    default void onClosed() {
    }
}
