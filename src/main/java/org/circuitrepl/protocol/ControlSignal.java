package org.circuitrepl.protocol;

/**
 * A session control signal. Carries no business payload, only its own correlation id
 * and the time it was raised.
 */
public record ControlSignal(String id, ControlSignalType type, long timestamp) {
}
