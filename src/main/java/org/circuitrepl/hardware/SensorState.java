package org.circuitrepl.hardware;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * State of one simulated sensor. {@code value} always lies within {@code range}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SensorState(String id,
                          String type,
                          double value,
                          SensorRange range,
                          long lastReading,
                          @JsonProperty("isActive") boolean isActive) {

    public static final String TEMPERATURE = "temperature";
    public static final String LIGHT = "light";

    public SensorState {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Sensor id must not be blank");
        }
        if (range == null) {
            range = new SensorRange(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
        }
        value = range.clamp(value);
    }

    /**
     * Returns a copy with the reading replaced, clamped into the sensor range.
     */
    public SensorState withValue(double newValue, long now) {
        return new SensorState(id, type, range.clamp(newValue), range, now, isActive);
    }
}
