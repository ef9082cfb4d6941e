package org.circuitrepl.hardware;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable copy of the worker's hardware state, attached to responses.
 *
 * @param pins      Pins keyed by pin number.
 * @param sensors   Sensors keyed by id.
 * @param timestamp Epoch milliseconds of the last state change or query.
 */
public record HardwareSnapshot(Map<Integer, PinState> pins, Map<String, SensorState> sensors, long timestamp) {

    public HardwareSnapshot {
        // Pins stay in numeric order and sensors in insertion order on the wire.
        pins = pins == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(pins));
        sensors = sensors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sensors));
    }
}
