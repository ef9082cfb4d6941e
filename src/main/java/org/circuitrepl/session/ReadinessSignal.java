package org.circuitrepl.session;

/**
 * Readiness event from the host. Carries the transport the session must use.
 *
 * @param ready     Whether the runtime came up.
 * @param transport The transport to select. Required when {@code ready}; when not ready it
 *                  may still be given so that the session can restart its runtime.
 * @param message   Failure description when not ready.
 */
public record ReadinessSignal(boolean ready, Transport transport, String message) {

    public static ReadinessSignal ready(final Transport transport) {
        return new ReadinessSignal(true, transport, null);
    }

    public static ReadinessSignal failed(final Transport transport, final String message) {
        return new ReadinessSignal(false, transport, message);
    }
}
