package org.circuitrepl.hardware;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps board attribute names such as {@code D5}, {@code LED} or {@code A1} to pin numbers.
 */
public final class PinNameMapper {

    public static final int LED_PIN = 13;
    public static final int FIRST_ANALOG_PIN = 14;
    public static final int ANALOG_PIN_COUNT = 3;
    public static final int DIGITAL_PIN_COUNT = 14;

    private static final Pattern DIGITAL = Pattern.compile("D(0|[1-9]\\d*)");
    private static final Pattern ANALOG = Pattern.compile("A(0|[1-9]\\d*)");

    private PinNameMapper() {
    }

    public static OptionalInt toPinNumber(final String name) {
        if (name == null) {
            return OptionalInt.empty();
        }
        if ("LED".equals(name)) {
            return OptionalInt.of(LED_PIN);
        }
        Matcher m = DIGITAL.matcher(name);
        if (m.matches()) {
            return bounded(m.group(1), DIGITAL_PIN_COUNT, 0);
        }
        m = ANALOG.matcher(name);
        if (m.matches()) {
            return bounded(m.group(1), ANALOG_PIN_COUNT, FIRST_ANALOG_PIN);
        }
        return OptionalInt.empty();
    }

    private static OptionalInt bounded(final String digits, final int count, final int offset) {
        if (digits.length() > 2) {
            return OptionalInt.empty();
        }
        final int index = Integer.parseInt(digits);
        return index < count ? OptionalInt.of(offset + index) : OptionalInt.empty();
    }
}
