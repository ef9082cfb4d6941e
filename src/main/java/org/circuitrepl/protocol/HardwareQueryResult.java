package org.circuitrepl.protocol;

import org.circuitrepl.hardware.HardwareSnapshot;

public record HardwareQueryResult(String queryType, HardwareSnapshot state) {
}
