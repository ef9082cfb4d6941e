package org.circuitrepl.protocol;

public record ConfigureResult(String status, BoardProfile boardProfile, int sensorCount, int gpioCount) {
}
