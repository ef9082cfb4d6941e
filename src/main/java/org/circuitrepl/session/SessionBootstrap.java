package org.circuitrepl.session;

import org.circuitrepl.channel.IRuntimeConnector;
import org.circuitrepl.completion.CompletionBridge;
import org.circuitrepl.completion.ModuleRegistry;
import org.circuitrepl.protocol.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Opens sessions the way a terminal host does: builds the session and its controller, starts
 * the runtime, reports progress and finally signals readiness with the chosen transport.
 */
public final class SessionBootstrap {

    private static final Logger log = LoggerFactory.getLogger(SessionBootstrap.class);

    private SessionBootstrap() {
    }

    /**
     * Opens a session talking to a runtime worker started by {@code connector}.
     */
    public static SessionController direct(final SessionSettings settings,
                                           final IRuntimeConnector connector,
                                           final ITerminalOutput output,
                                           final ISessionHost host,
                                           final ModuleRegistry registry) {
        final Clock clock = Clock.systemUTC();
        final SessionReactor reactor = new SessionReactor("session-reactor");
        final CorrelationTable<Response> table =
                new CorrelationTable<>(new CorrelationIdGenerator(), clock, settings.commandTimeout());
        final Session session = new Session(settings.mode(), table, new CommandHistory(settings.historySize()));
        final CompletionBridge completions = registry == null
                ? null
                : CompletionBridge.inProcess(registry, reactor, settings.completionTimeout());
        final SessionController controller =
                new SessionController(session, reactor, output, host, settings, completions, clock);
        controller.start();

        final RuntimeClient client = new RuntimeClient(connector, table, reactor, clock);
        final Transport transport = new Transport.Direct(client);
        controller.onProgress(10, "Starting runtime worker");
        final CompletableFuture<Response> init;
        try {
            init = client.connect();
        } catch (IOException e) {
            log.error("Failed to start runtime worker: {}", e.getMessage());
            controller.onReadiness(ReadinessSignal.failed(transport, "Failed to start runtime: " + e.getMessage()));
            return controller;
        }
        controller.onProgress(50, "Initializing interpreter");
        init.whenComplete((response, error) -> {
            if (error != null) {
                controller.onReadiness(ReadinessSignal.failed(transport, "Runtime failed to start: " + error.getMessage()));
            } else if (!response.success()) {
                controller.onReadiness(ReadinessSignal.failed(transport, response.error()));
            } else {
                controller.onProgress(100, "Runtime ready");
                controller.onReadiness(ReadinessSignal.ready(transport));
            }
        });
        log.info("Session {} opened in {} mode", session.id(), settings.mode());
        return controller;
    }

    /**
     * Opens a session forwarding raw keystrokes to an externally managed terminal process.
     */
    public static SessionController passThrough(final SessionSettings settings,
                                                final IPassThroughTarget target,
                                                final ITerminalOutput output,
                                                final ISessionHost host) {
        final Clock clock = Clock.systemUTC();
        final SessionReactor reactor = new SessionReactor("session-reactor");
        final CorrelationTable<Response> table =
                new CorrelationTable<>(new CorrelationIdGenerator(), clock, settings.commandTimeout());
        final Session session = new Session(settings.mode(), table, new CommandHistory(settings.historySize()));
        final SessionController controller =
                new SessionController(session, reactor, output, host, settings, null, clock);
        controller.start();
        controller.onReadiness(ReadinessSignal.ready(new Transport.PassThrough(target)));
        log.info("Session {} opened in pass-through mode", session.id());
        return controller;
    }
}
