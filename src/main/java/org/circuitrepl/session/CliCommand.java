package org.circuitrepl.session;

import java.util.List;

/**
 * A parsed CLI-style command line.
 */
public record CliCommand(String name, List<String> arguments) {

    public CliCommand {
        arguments = List.copyOf(arguments);
    }

    public String argument(final int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }
}
