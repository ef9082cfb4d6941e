package org.circuitrepl.protocol;

public record HardwareSetResult(String status, int changesApplied) {
}
