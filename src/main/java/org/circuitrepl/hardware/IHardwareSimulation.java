package org.circuitrepl.hardware;

/**
 * Derives hardware side effects from executed source text.
 * <p>
 * Implementations mutate and return the given state. They must keep every sensor value
 * within its range and must not add or remove pins or sensors.
 */
@FunctionalInterface
public interface IHardwareSimulation {

    HardwareState simulate(String sourceText, HardwareState hardwareState);

    /**
     * A simulation that leaves the state untouched.
     */
    static IHardwareSimulation none() {
        return (sourceText, hardwareState) -> hardwareState;
    }
}
