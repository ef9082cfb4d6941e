package org.circuitrepl.hardware;

/**
 * Closed value range [min, max] of a sensor.
 */
public record SensorRange(double min, double max) {

    public SensorRange {
        if (min > max) {
            throw new IllegalArgumentException("Sensor range min " + min + " exceeds max " + max);
        }
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
