package org.circuitrepl.cli.commands;

import com.typesafe.config.Config;
import org.circuitrepl.cli.CommandLineInterface;
import org.circuitrepl.channel.IRuntimeConnector;
import org.circuitrepl.completion.ModuleRegistry;
import org.circuitrepl.protocol.ControlSignal;
import org.circuitrepl.session.ISessionHost;
import org.circuitrepl.session.ITerminalOutput;
import org.circuitrepl.session.SessionBootstrap;
import org.circuitrepl.session.SessionController;
import org.circuitrepl.session.SessionMode;
import org.circuitrepl.session.SessionSettings;
import org.circuitrepl.worker.InProcessRuntimeConnector;
import org.circuitrepl.worker.ProcessRuntimeConnector;
import org.circuitrepl.worker.WorkerSettings;
import org.jline.terminal.Attributes;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.NonBlockingReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
    name = "repl",
    description = "Opens an interactive session in the current terminal."
)
public class ReplCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplCommand.class);
    private static final long POLL_MILLIS = 100;
    private static final long ESCAPE_MILLIS = 20;

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-m", "--mode"}, description = "Session mode: shell or device-repl.")
    private String mode;

    @Option(names = "--process", description = "Run the runtime worker in a child JVM.")
    private boolean process;

    @Option(names = "--pass-through", arity = "1..*",
        description = "Forward keystrokes to this external command instead of a runtime worker.")
    private List<String> passThroughCommand;

    @Override
    public Integer call() throws Exception {
        final Config config = parent.getConfig();
        SessionSettings settings = SessionSettings.fromConfig(config);
        if (mode != null) {
            settings = settings.withMode(SessionMode.parse(mode));
        }
        WorkerSettings workerSettings = WorkerSettings.fromConfig(config);
        if (process) {
            workerSettings = workerSettings.withLaunch(WorkerSettings.Launch.PROCESS);
        }

        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            final Attributes saved = terminal.enterRawMode();
            final PrintWriter writer = terminal.writer();
            final ITerminalOutput output = text -> {
                synchronized (writer) {
                    writer.print(text);
                    writer.flush();
                }
            };
            final CountDownLatch closed = new CountDownLatch(1);
            final ISessionHost host = new ISessionHost() {
                @Override
                public void onControlSignal(final ControlSignal signal) {
                    LOGGER.debug("Control signal {} ({})", signal.type().wireName(), signal.id());
                }

                @Override
                public void onInitializationFailure(final String message) {
                    LOGGER.error("Runtime failed to initialize: {}", message);
                }

                @Override
                public void onClosed() {
                    closed.countDown();
                }
            };

            final SessionController controller = open(settings, workerSettings, output, host);
            terminal.handle(Terminal.Signal.INT, signal -> controller.handleInput("\u0003"));
            try {
                readKeys(terminal.reader(), controller, closed);
            } finally {
                controller.dispose();
                if (!closed.await(5, TimeUnit.SECONDS)) {
                    LOGGER.warn("Session did not close in time");
                }
                terminal.setAttributes(saved);
                writer.println();
                writer.flush();
            }
        }
        return 0;
    }

    private SessionController open(final SessionSettings settings,
                                   final WorkerSettings workerSettings,
                                   final ITerminalOutput output,
                                   final ISessionHost host) throws IOException {
        if (passThroughCommand != null && !passThroughCommand.isEmpty()) {
            final ProcessPassThroughTarget target = new ProcessPassThroughTarget(passThroughCommand);
            final SessionController controller = SessionBootstrap.passThrough(settings, target, output, host);
            target.start(controller::onPassThroughOutput, controller::dispose);
            return controller;
        }
        final IRuntimeConnector connector = workerSettings.launch() == WorkerSettings.Launch.PROCESS
            ? new ProcessRuntimeConnector(workerSettings)
            : new InProcessRuntimeConnector(workerSettings);
        return SessionBootstrap.direct(settings, connector, output, host, ModuleRegistry.loadDefault());
    }

    /**
     * Reads keys until end of input or until the session closes. Escape sequences are
     * collected into one chunk so that arrow keys reach the session intact.
     */
    private static void readKeys(final NonBlockingReader reader,
                                 final SessionController controller,
                                 final CountDownLatch closed) throws IOException {
        while (closed.getCount() > 0) {
            final int c = reader.read(POLL_MILLIS);
            if (c == NonBlockingReader.READ_EXPIRED) {
                continue;
            }
            if (c < 0) {
                return;
            }
            if (c != 27) {
                controller.handleInput(String.valueOf((char) c));
                continue;
            }
            final StringBuilder sequence = new StringBuilder().append((char) c);
            int next = reader.read(ESCAPE_MILLIS);
            if (next == '[' || next == 'O') {
                sequence.append((char) next);
                next = reader.read(ESCAPE_MILLIS);
                if (next >= 0) {
                    sequence.append((char) next);
                }
            } else if (next >= 0) {
                sequence.append((char) next);
            }
            controller.handleInput(sequence.toString());
        }
    }
}
