package org.circuitrepl.hardware;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalInt;
import java.util.function.LongSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword based hardware simulation.
 * <p>
 * When the source uses {@code digitalio}, every {@code board.<NAME>} reference toggles the
 * mapped pin, once per occurrence and in source order. Mentions of temperature or light
 * (lower case, as written) nudge the matching sensors by a random delta, clamped into their range.
 */
public final class PatternHardwareSimulation implements IHardwareSimulation {

    private static final Logger log = LoggerFactory.getLogger(PatternHardwareSimulation.class);

    private static final Pattern BOARD_REFERENCE = Pattern.compile("board\\.(\\w+)");
    private static final double TEMPERATURE_SPREAD = 2.0;
    private static final double LIGHT_SPREAD = 100.0;

    private final IRandomProvider random;
    private final LongSupplier clock;

    public PatternHardwareSimulation(final IRandomProvider random, final LongSupplier clock) {
        this.random = random;
        this.clock = clock;
    }

    @Override
    public HardwareState simulate(final String sourceText, final HardwareState hardwareState) {
        if (sourceText == null || sourceText.isEmpty()) {
            return hardwareState;
        }
        final long now = clock.getAsLong();
        if (sourceText.contains("digitalio") || sourceText.contains("DigitalInOut")) {
            togglePins(sourceText, hardwareState, now);
        }

        // Keywords are case sensitive: "Temp" or "LIGHT" leave the sensors alone.
        if (sourceText.contains("temperature") || sourceText.contains("temp")) {
            nudgeSensors(hardwareState, SensorState.TEMPERATURE, TEMPERATURE_SPREAD, now);
        }
        if (sourceText.contains("light")) {
            nudgeSensors(hardwareState, SensorState.LIGHT, LIGHT_SPREAD, now);
        }
        hardwareState.touch(now);
        return hardwareState;
    }

    private void togglePins(final String sourceText, final HardwareState state, final long now) {
        final Matcher matcher = BOARD_REFERENCE.matcher(sourceText);
        while (matcher.find()) {
            final OptionalInt pin = PinNameMapper.toPinNumber(matcher.group(1));
            if (pin.isEmpty()) {
                continue;
            }
            state.pin(pin.getAsInt()).ifPresent(current -> {
                state.putPin(current.toggled(now));
                log.debug("Simulated toggle of pin {} ({})", current.pin(), matcher.group(1));
            });
        }
    }

    private void nudgeSensors(final HardwareState state, final String type, final double spread, final long now) {
        final List<SensorState> matching = state.sensors().stream()
                .filter(s -> type.equals(s.type()))
                .toList();
        for (SensorState sensor : matching) {
            final double delta = (random.nextDouble() - 0.5) * spread;
            state.putSensor(sensor.withValue(sensor.value() + delta, now));
        }
    }
}
