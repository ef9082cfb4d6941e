package org.circuitrepl.hardware;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Mutable simulated hardware owned by a single runtime worker.
 * <p>
 * Not thread-safe; only the worker's dispatch thread touches it. The timestamp never moves
 * backwards, even if the supplied clock does.
 */
public final class HardwareState {

    public static final int DEFAULT_PIN_COUNT = 20;
    public static final String DEFAULT_TEMPERATURE_SENSOR = "temp_sensor";
    public static final String DEFAULT_LIGHT_SENSOR = "light_sensor";

    private final Map<Integer, PinState> pins = new TreeMap<>();
    private final Map<String, SensorState> sensors = new LinkedHashMap<>();
    private long timestamp;

    /**
     * Creates a state populated with the default board.
     */
    public static HardwareState withDefaults(final long now) {
        final HardwareState state = new HardwareState();
        state.resetToDefaults(now);
        return state;
    }

    /**
     * Replaces all pins and sensors with the defaults: {@value #DEFAULT_PIN_COUNT} input pins
     * driven low, one temperature sensor and one light sensor.
     */
    public void resetToDefaults(final long now) {
        pins.clear();
        sensors.clear();
        for (int pin = 0; pin < DEFAULT_PIN_COUNT; pin++) {
            pins.put(pin, PinState.defaultFor(pin, now));
        }
        putSensor(new SensorState(DEFAULT_TEMPERATURE_SENSOR, SensorState.TEMPERATURE, 22.5,
                new SensorRange(-40, 85), now, true));
        putSensor(new SensorState(DEFAULT_LIGHT_SENSOR, SensorState.LIGHT, 500,
                new SensorRange(0, 10000), now, true));
        touch(now);
    }

    public Optional<PinState> pin(final int pin) {
        return Optional.ofNullable(pins.get(pin));
    }

    public Optional<SensorState> sensor(final String id) {
        return Optional.ofNullable(sensors.get(id));
    }

    public void putPin(final PinState state) {
        pins.put(state.pin(), state);
    }

    public void putSensor(final SensorState state) {
        sensors.put(state.id(), state);
    }

    public Collection<PinState> pins() {
        return Collections.unmodifiableCollection(pins.values());
    }

    public Collection<SensorState> sensors() {
        return Collections.unmodifiableCollection(sensors.values());
    }

    public long timestamp() {
        return timestamp;
    }

    /**
     * Advances the timestamp to {@code now} unless that would move it backwards.
     */
    public void touch(final long now) {
        timestamp = Math.max(timestamp, now);
    }

    public HardwareSnapshot snapshot() {
        return new HardwareSnapshot(pins, sensors, timestamp);
    }
}
