package org.circuitrepl.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.circuitrepl.hardware.PinState;
import org.circuitrepl.hardware.SensorState;

import java.util.List;

/**
 * Payload of a {@code configure} request. Absent lists mean "nothing to configure".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfigurePayload(BoardProfile boardProfile, List<SensorState> sensors, List<PinState> gpios) {

    public List<SensorState> sensorsOrEmpty() {
        return sensors == null ? List.of() : sensors;
    }

    public List<PinState> gpiosOrEmpty() {
        return gpios == null ? List.of() : gpios;
    }
}
