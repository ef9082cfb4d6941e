package org.circuitrepl.session;

/**
 * How a session talks to its runtime. Chosen once, from the readiness signal, and never changed.
 */
public sealed interface Transport {

    /**
     * Structured, correlated commands exchanged with a runtime worker.
     */
    record Direct(RuntimeClient client) implements Transport {
    }

    /**
     * Raw keystrokes forwarded to an externally managed terminal process.
     */
    record PassThrough(IPassThroughTarget target) implements Transport {
    }
}
