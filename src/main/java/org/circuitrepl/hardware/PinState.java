package org.circuitrepl.hardware;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * State of one simulated GPIO pin.
 *
 * @param pin         Pin number, 0-based.
 * @param mode        Direction of the pin.
 * @param value       Logic level.
 * @param pullup      Whether the internal pull-up is enabled.
 * @param pulldown    Whether the internal pull-down is enabled.
 * @param lastChanged Epoch milliseconds of the last change.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PinState(int pin, PinMode mode, boolean value, boolean pullup, boolean pulldown, long lastChanged) {

    public PinState {
        if (mode == null) {
            mode = PinMode.INPUT;
        }
    }

    public static PinState defaultFor(int pin, long now) {
        return new PinState(pin, PinMode.INPUT, false, false, false, now);
    }

    public PinState withValue(boolean newValue, long now) {
        return new PinState(pin, mode, newValue, pullup, pulldown, now);
    }

    public PinState withMode(PinMode newMode, long now) {
        return new PinState(pin, newMode, value, pullup, pulldown, now);
    }

    public PinState toggled(long now) {
        return withValue(!value, now);
    }
}
