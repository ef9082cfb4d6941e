package org.circuitrepl.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.circuitrepl.hardware.PinMode;

import java.util.List;

/**
 * Payload of a {@code hardware_set} request. Entries naming pins or sensors that do not
 * exist are ignored by the worker.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HardwareSetPayload(List<PinUpdate> pins, List<SensorUpdate> sensors) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PinUpdate(int pin, boolean value, PinMode mode) {
    }

    public record SensorUpdate(String id, double value) {
    }

    public List<PinUpdate> pinsOrEmpty() {
        return pins == null ? List.of() : pins;
    }

    public List<SensorUpdate> sensorsOrEmpty() {
        return sensors == null ? List.of() : sensors;
    }
}
