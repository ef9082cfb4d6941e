package org.circuitrepl.session;

import com.fasterxml.jackson.databind.JsonNode;
import org.circuitrepl.hardware.HardwareSnapshot;
import org.circuitrepl.hardware.PinMode;
import org.circuitrepl.hardware.PinState;
import org.circuitrepl.hardware.SensorState;
import org.circuitrepl.protocol.BoardProfile;
import org.circuitrepl.protocol.ConfigurePayload;
import org.circuitrepl.protocol.ConfigureResult;
import org.circuitrepl.protocol.EnvelopeCodec;
import org.circuitrepl.protocol.HardwareQueryPayload;
import org.circuitrepl.protocol.HardwareQueryResult;
import org.circuitrepl.protocol.HardwareSetPayload;
import org.circuitrepl.protocol.HardwareSetResult;
import org.circuitrepl.protocol.QueryPayload;
import org.circuitrepl.protocol.RequestType;
import org.circuitrepl.protocol.Response;
import org.circuitrepl.protocol.StatusResult;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Runs CLI-style commands.
 * <p>
 * Local commands are answered by the host itself, remote ones become worker requests. Both
 * register in the session's correlation table, so a local answer is resolved through the
 * same path as a worker response.
 */
public final class HostCommandProcessor {

    static final String HELP_TEXT = String.join("\n",
            "Commands (prefix with 'mu ' or '.'):",
            "  help                          show this help",
            "  clear                         clear the screen",
            "  history                       list submitted lines",
            "  status                        show session status",
            "  health                        query runtime health",
            "  reset                         restart the interpreter and reset hardware",
            "  hardware | pins | sensors     show simulated hardware",
            "  pin <n> <on|off> [input|output]  set a pin",
            "  sensor <id> <value>           set a sensor reading",
            "  board <boardId>               select a board profile",
            "  exit                          close the session",
            "Keys: Ctrl-C interrupt, Ctrl-D soft restart, Ctrl-E paste mode, Tab complete");

    private final Session session;
    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final Runnable exitAction;

    public HostCommandProcessor(final Session session, final Runnable exitAction) {
        this.session = session;
        this.exitAction = exitAction;
    }

    public CompletableFuture<CommandResult> execute(final CliCommand command, final RuntimeClient client) {
        return switch (command.name()) {
            case "help" -> local(CommandKind.QUERY, HELP_TEXT);
            case "clear" -> local(CommandKind.CONTROL, SessionRenderer.CLEAR_SCREEN);
            case "history" -> local(CommandKind.QUERY, history());
            case "status" -> local(CommandKind.QUERY, status(client));
            case "exit", "quit" -> {
                final CompletableFuture<CommandResult> result = local(CommandKind.CONTROL, "bye");
                exitAction.run();
                yield result;
            }
            case "health" -> remote(client, RequestType.QUERY, new QueryPayload(QueryPayload.HEALTH),
                    CommandKind.QUERY, this::formatHealth);
            case "reset" -> remote(client, RequestType.RESET, Map.of(), CommandKind.RESET,
                    result -> "Runtime " + codec.fromTree(result, StatusResult.class).status().replace('_', ' '));
            case "hardware", "pins", "sensors" -> remote(client, RequestType.HARDWARE_QUERY,
                    new HardwareQueryPayload(HardwareQueryPayload.FULL_STATE), CommandKind.HARDWARE,
                    result -> formatHardware(command.name(), codec.fromTree(result, HardwareQueryResult.class).state()));
            case "pin" -> setPin(command, client);
            case "sensor" -> setSensor(command, client);
            case "board" -> selectBoard(command, client);
            default -> CompletableFuture.completedFuture(
                    CommandResult.failed("Unknown command '" + command.name() + "'. Try 'mu help'."));
        };
    }

    private CompletableFuture<CommandResult> setPin(final CliCommand command, final RuntimeClient client) {
        final String pinArg = command.argument(0);
        final String levelArg = command.argument(1);
        if (pinArg == null || levelArg == null) {
            return usage("pin <n> <on|off> [input|output]");
        }
        final int pin;
        try {
            pin = Integer.parseInt(pinArg);
        } catch (NumberFormatException e) {
            return usage("pin <n> <on|off> [input|output]");
        }
        final Boolean level = switch (levelArg.toLowerCase(Locale.ROOT)) {
            case "on", "1", "true", "high" -> Boolean.TRUE;
            case "off", "0", "false", "low" -> Boolean.FALSE;
            default -> null;
        };
        if (level == null) {
            return usage("pin <n> <on|off> [input|output]");
        }
        PinMode mode = null;
        final String modeArg = command.argument(2);
        if (modeArg != null) {
            try {
                mode = PinMode.valueOf(modeArg.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return usage("pin <n> <on|off> [input|output]");
            }
        }
        final HardwareSetPayload payload = new HardwareSetPayload(
                List.of(new HardwareSetPayload.PinUpdate(pin, level, mode)), null);
        return remote(client, RequestType.HARDWARE_SET, payload, CommandKind.HARDWARE, this::formatChanges);
    }

    private CompletableFuture<CommandResult> setSensor(final CliCommand command, final RuntimeClient client) {
        final String id = command.argument(0);
        final String valueArg = command.argument(1);
        if (id == null || valueArg == null) {
            return usage("sensor <id> <value>");
        }
        final double value;
        try {
            value = Double.parseDouble(valueArg);
        } catch (NumberFormatException e) {
            return usage("sensor <id> <value>");
        }
        final HardwareSetPayload payload = new HardwareSetPayload(null,
                List.of(new HardwareSetPayload.SensorUpdate(id, value)));
        return remote(client, RequestType.HARDWARE_SET, payload, CommandKind.HARDWARE, this::formatChanges);
    }

    private CompletableFuture<CommandResult> selectBoard(final CliCommand command, final RuntimeClient client) {
        final String boardId = command.argument(0);
        if (boardId == null) {
            return usage("board <boardId>");
        }
        final ConfigurePayload payload = new ConfigurePayload(new BoardProfile(boardId), null, null);
        return remote(client, RequestType.CONFIGURE, payload, CommandKind.CONFIGURE, result -> {
            final ConfigureResult configured = codec.fromTree(result, ConfigureResult.class);
            return "Board set to " + configured.boardProfile().boardId();
        });
    }

    /**
     * Registers a command and resolves it right away with a host-made response.
     */
    private CompletableFuture<CommandResult> local(final CommandKind kind, final String text) {
        final CorrelationTable<Response> table = session.pendingCommands();
        final PendingCommand<Response> command = table.register(kind);
        final CompletableFuture<CommandResult> result = command.continuation().thenApply(response ->
                CommandResult.ok(response.result().path("output").asText()));
        table.resolve(command.id(), Response.success(command.id(),
                codec.toTree(Map.of("output", text)), 0, null));
        return result;
    }

    private CompletableFuture<CommandResult> remote(final RuntimeClient client,
                                                    final RequestType type,
                                                    final Object payload,
                                                    final CommandKind kind,
                                                    final Function<JsonNode, String> formatter) {
        if (client == null) {
            return CompletableFuture.completedFuture(CommandResult.failed("No runtime connected"));
        }
        return client.send(type, payload, kind).thenApply(response -> response.success()
                ? CommandResult.ok(formatter.apply(response.result()))
                : CommandResult.failed(response.error()));
    }

    private String history() {
        final List<String> entries = session.history().entries();
        if (entries.isEmpty()) {
            return "(no history)";
        }
        final StringBuilder text = new StringBuilder();
        for (int i = 0; i < entries.size(); i++) {
            text.append(String.format("%4d  %s%n", i + 1, entries.get(i)));
        }
        return text.toString();
    }

    private String status(final RuntimeClient client) {
        final Transport selected = session.transport();
        final String transport;
        if (selected instanceof Transport.Direct) {
            transport = "direct";
        } else if (selected instanceof Transport.PassThrough) {
            transport = "pass-through";
        } else {
            transport = "none";
        }
        return String.format("session %s%nmode: %s%nstate: %s%ntransport: %s%nconnected: %s%npending: %d",
                session.id(),
                session.mode().name().toLowerCase(Locale.ROOT).replace('_', '-'),
                session.state().name().toLowerCase(Locale.ROOT),
                transport,
                client != null && client.isConnected(),
                session.pendingCommands().size());
    }

    private String formatHealth(final JsonNode result) {
        final StatusResult health = codec.fromTree(result, StatusResult.class);
        return String.format("Runtime %s (initialized: %s, heap: %d bytes)",
                health.status(), health.initialized(), health.heapSizeBytes());
    }

    private String formatChanges(final JsonNode result) {
        final HardwareSetResult set = codec.fromTree(result, HardwareSetResult.class);
        return set.changesApplied() == 0
                ? "No matching pin or sensor"
                : "Updated " + set.changesApplied() + (set.changesApplied() == 1 ? " entry" : " entries");
    }

    static String formatHardware(final String view, final HardwareSnapshot snapshot) {
        final StringBuilder text = new StringBuilder();
        if (!"sensors".equals(view)) {
            text.append("PIN  MODE    VALUE").append('\n');
            snapshot.pins().values().stream()
                    .sorted((a, b) -> Integer.compare(a.pin(), b.pin()))
                    .forEach(pin -> text.append(formatPin(pin)).append('\n'));
        }
        if (!"pins".equals(view)) {
            text.append("SENSOR           TYPE          VALUE      RANGE").append('\n');
            snapshot.sensors().values().stream()
                    .sorted((a, b) -> a.id().compareTo(b.id()))
                    .forEach(sensor -> text.append(formatSensor(sensor)).append('\n'));
        }
        return text.toString();
    }

    private static String formatPin(final PinState pin) {
        return String.format("%-4d %-7s %s", pin.pin(), pin.mode().name().toLowerCase(Locale.ROOT),
                pin.value() ? "on" : "off");
    }

    private static String formatSensor(final SensorState sensor) {
        return String.format(Locale.ROOT, "%-16s %-13s %-10.2f %.1f..%.1f", sensor.id(), sensor.type(),
                sensor.value(), sensor.range().min(), sensor.range().max());
    }

    private static CompletableFuture<CommandResult> usage(final String usage) {
        return CompletableFuture.completedFuture(CommandResult.failed("Usage: mu " + usage));
    }
}
