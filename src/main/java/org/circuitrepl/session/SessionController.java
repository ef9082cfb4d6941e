package org.circuitrepl.session;

import org.circuitrepl.completion.CompletionBridge;
import org.circuitrepl.completion.CompletionCycle;
import org.circuitrepl.completion.CompletionItem;
import org.circuitrepl.hardware.HardwareSnapshot;
import org.circuitrepl.protocol.ChannelClosedException;
import org.circuitrepl.protocol.CommandInterruptedException;
import org.circuitrepl.protocol.ControlSignal;
import org.circuitrepl.protocol.ControlSignalType;
import org.circuitrepl.protocol.EnvelopeCodec;
import org.circuitrepl.protocol.ExecuteResult;
import org.circuitrepl.protocol.ExecutionMode;
import org.circuitrepl.protocol.ProtocolException;
import org.circuitrepl.protocol.RequestType;
import org.circuitrepl.protocol.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * Terminal-facing state machine of a session.
 * <p>
 * Public methods may be called from any thread. They hand their work to the session reactor,
 * which is the only thread that touches session state. Runtime responses arrive on the reactor
 * as completed continuations.
 */
public final class SessionController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    static final char CTRL_C = '\u0003';
    static final char CTRL_D = '\u0004';
    static final char CTRL_E = '\u0005';
    static final String ARROW_UP = "\u001b[A";
    static final String ARROW_DOWN = "\u001b[B";

    private final Session session;
    private final SessionReactor reactor;
    private final ITerminalOutput output;
    private final ISessionHost host;
    private final SessionSettings settings;
    private final CompletionBridge completions;
    private final Clock clock;
    private final SessionRenderer renderer = new SessionRenderer();
    private final HostCommandProcessor processor;
    private final PasteBuffer paste = new PasteBuffer();
    private final CompletionCycle cycle = new CompletionCycle();
    private final CorrelationIdGenerator signalIds = new CorrelationIdGenerator();
    private final EnvelopeCodec codec = new EnvelopeCodec();

    private RuntimeClient client;
    private ScheduledFuture<?> sweep;
    private long commandSequence;
    private long inFlight;
    private int inputGeneration;
    private boolean initializationFailureReported;
    private boolean exitRequested;
    private volatile HardwareSnapshot lastHardwareSnapshot;
    private volatile boolean disposed;

    public SessionController(final Session session,
                             final SessionReactor reactor,
                             final ITerminalOutput output,
                             final ISessionHost host,
                             final SessionSettings settings,
                             final CompletionBridge completions,
                             final Clock clock) {
        this.session = session;
        this.reactor = reactor;
        this.output = output;
        this.host = host;
        this.settings = settings;
        this.completions = completions;
        this.clock = clock;
        this.processor = new HostCommandProcessor(session, () -> exitRequested = true);
    }

    /**
     * Starts the timeout sweep and shows the awaiting prompt.
     */
    public void start() {
        reactor.execute(() -> {
            sweep = reactor.scheduleAtFixedRate(this::sweepExpired, settings.sweepInterval());
            showPrompt();
        });
    }

    public void handleInput(final String data) {
        reactor.execute(() -> processInput(data));
    }

    public void onProgress(final int percent, final String message) {
        reactor.execute(() -> {
            if (session.state() == SessionState.AWAITING_RUNTIME) {
                output.write(renderer.progress(percent, message));
            }
        });
    }

    public void onReadiness(final ReadinessSignal signal) {
        reactor.execute(() -> applyReadiness(signal));
    }

    public void onPassThroughOutput(final String text) {
        reactor.execute(() -> output.write(text));
    }

    /**
     * Explicit restart: replaces a failed runtime and returns the session to idle.
     */
    public void restart() {
        reactor.execute(this::restartRuntime);
    }

    /**
     * Rejects all pending commands, stops the sweep, closes the transport and the reactor.
     */
    public void dispose() {
        reactor.execute(this::disposeNow);
    }

    @Override
    public void close() {
        dispose();
    }

    public Session session() {
        return session;
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * The hardware snapshot carried by the most recent runtime response, or null.
     */
    public HardwareSnapshot lastHardwareSnapshot() {
        return lastHardwareSnapshot;
    }

    void processInput(final String data) {
        if (disposed || data == null || data.isEmpty()) {
            return;
        }
        if (session.transport() instanceof Transport.PassThrough passThrough) {
            passThrough.target().write(data);
            return;
        }
        if (data.length() == 1) {
            switch (data.charAt(0)) {
                case CTRL_C -> {
                    interrupt();
                    return;
                }
                case CTRL_D -> {
                    if (paste.isActive()) {
                        finishPaste();
                    } else {
                        softRestart();
                    }
                    return;
                }
                case CTRL_E -> {
                    enterPasteMode();
                    return;
                }
                case '\t' -> {
                    requestCompletion();
                    return;
                }
                default -> {
                    // regular key
                }
            }
        }
        if (session.state() == SessionState.AWAITING_RUNTIME) {
            return;
        }
        cycle.reset();
        inputGeneration++;

        if (data.startsWith("\u001b")) {
            if (ARROW_UP.equals(data)) {
                session.history().previous().ifPresent(this::replaceInput);
            } else if (ARROW_DOWN.equals(data)) {
                session.history().next().ifPresent(this::replaceInput);
            }
            return;
        }

        char previous = 0;
        for (int i = 0; i < data.length(); i++) {
            final char c = data.charAt(i);
            if (c == '\n' && previous == '\r') {
                previous = c;
                continue;
            }
            if (c == '\r' || c == '\n') {
                enter();
            } else if (c == 0x7f || c == '\b') {
                backspace();
            } else if (c >= 0x20) {
                typed(c);
            }
            previous = c;
        }
    }

    private void typed(final char c) {
        if (paste.isActive()) {
            paste.append(String.valueOf(c));
        } else {
            session.inputBuffer().append(c);
        }
        output.write(String.valueOf(c));
    }

    private void backspace() {
        if (paste.isActive()) {
            if (paste.backspace()) {
                output.write(renderer.backspace());
            }
            return;
        }
        final StringBuilder buffer = session.inputBuffer();
        if (buffer.length() > 0) {
            buffer.setLength(buffer.length() - 1);
            output.write(renderer.backspace());
        }
    }

    private void enter() {
        if (paste.isActive()) {
            paste.newLine();
            output.write(renderer.pasteContinuation());
            return;
        }
        switch (session.state()) {
            case IDLE -> submitLine();
            case ERROR -> {
                output.write(SessionRenderer.NEWLINE + renderer.error("Runtime unavailable. Press Ctrl-D to restart."));
                showPrompt();
            }
            default -> log.debug("Ignoring submit while {}", session.state());
        }
    }

    private void submitLine() {
        final String line = session.input();
        session.replaceInput("");
        output.write(SessionRenderer.NEWLINE);
        if (line.isBlank()) {
            showPrompt();
            return;
        }
        session.history().add(line);
        final Optional<CliCommand> command = InputClassifier.classify(line, session.mode());
        if (command.isPresent()) {
            run(() -> processor.execute(command.get(), client));
        } else {
            run(() -> execute(line, ExecutionMode.REPL));
        }
    }

    private void run(final Supplier<CompletableFuture<CommandResult>> dispatch) {
        session.transitionTo(SessionState.EXECUTING);
        final long sequence = ++commandSequence;
        inFlight = sequence;
        final CompletableFuture<CommandResult> result;
        try {
            result = dispatch.get();
        } catch (RuntimeException e) {
            finish(sequence, null, e);
            return;
        }
        result.whenComplete((value, error) -> reactor.execute(() -> finish(sequence, value, error)));
    }

    private CompletableFuture<CommandResult> execute(final String code, final ExecutionMode mode) {
        if (client == null) {
            return CompletableFuture.completedFuture(CommandResult.failed("No runtime connected"));
        }
        return client.execute(code, mode, settings.hardwareMonitoring()).thenApply(this::toResult);
    }

    private CommandResult toResult(final Response response) {
        if (response.hardwareSnapshot() != null) {
            lastHardwareSnapshot = response.hardwareSnapshot();
        }
        if (response.result() == null || response.result().isNull()) {
            return response.success() ? CommandResult.ok("") : CommandResult.failed(response.error());
        }
        try {
            final ExecuteResult result = codec.fromTree(response.result(), ExecuteResult.class);
            final String output = result.output() == null ? "" : result.output();
            return new CommandResult(response.success(), output,
                    response.success() ? result.error() : response.error());
        } catch (ProtocolException e) {
            log.warn("Unreadable execute result: {}", e.getMessage());
            return CommandResult.failed(e.getMessage());
        }
    }

    private void finish(final long sequence, final CommandResult result, final Throwable error) {
        if (disposed) {
            return;
        }
        if (sequence != inFlight) {
            log.debug("Discarding result of superseded command #{}", sequence);
            return;
        }
        inFlight = 0;
        if (error != null) {
            output.write(renderer.error(describe(error)));
        } else {
            output.write(renderer.result(result));
        }
        if (exitRequested) {
            output.write(SessionRenderer.NEWLINE);
            disposeNow();
            return;
        }
        if (session.state() == SessionState.EXECUTING) {
            session.transitionTo(SessionState.IDLE);
        }
        showPrompt();
    }

    private void interrupt() {
        cycle.reset();
        final boolean wasPasting = paste.isActive();
        paste.cancel();
        output.write(renderer.interruptEcho());
        final int rejected = session.pendingCommands()
                .rejectAll(() -> new CommandInterruptedException("Interrupted"));
        log.debug("Interrupt rejected {} pending commands{}", rejected, wasPasting ? " and cancelled paste mode" : "");
        inFlight = 0;
        session.replaceInput("");
        session.history().resetNavigation();
        emit(ControlSignalType.INTERRUPT);
        session.forceIdle();
        showPrompt();
    }

    private void softRestart() {
        cycle.reset();
        output.write(renderer.restartEcho());
        session.pendingCommands().rejectAll(() -> new CommandInterruptedException("Soft restart"));
        inFlight = 0;
        session.replaceInput("");
        emit(ControlSignalType.SOFT_RESTART);
        if (session.state() == SessionState.ERROR) {
            restartRuntime();
            return;
        }
        if (client != null && session.state() != SessionState.AWAITING_RUNTIME) {
            client.send(RequestType.RESET, Map.of(), CommandKind.RESET).whenComplete((response, error) ->
                    reactor.execute(() -> resetCompleted(response, error)));
        }
        session.forceIdle();
        showPrompt();
    }

    private void resetCompleted(final Response response, final Throwable error) {
        if (error != null) {
            if (!(unwrap(error) instanceof CommandInterruptedException)) {
                log.warn("Soft restart failed: {}", describe(error));
            }
            return;
        }
        if (response.hardwareSnapshot() != null) {
            lastHardwareSnapshot = response.hardwareSnapshot();
        }
        if (!response.success()) {
            output.write(SessionRenderer.NEWLINE + renderer.error("Soft restart failed: " + response.error()));
            showPrompt();
        }
    }

    private void restartRuntime() {
        if (disposed) {
            return;
        }
        if (client == null) {
            output.write(renderer.error("Runtime cannot be restarted from this session"));
            showPrompt();
            return;
        }
        if (session.state() != SessionState.ERROR) {
            log.debug("Restart requested while {}, nothing to do", session.state());
            return;
        }
        output.write(renderer.notice("Restarting runtime..."));
        final CompletableFuture<Response> init;
        try {
            init = client.reconnect();
        } catch (IOException | RuntimeException e) {
            output.write(renderer.error("Restart failed: " + e.getMessage()));
            showPrompt();
            return;
        }
        init.whenComplete((response, error) -> reactor.execute(() -> restarted(response, error)));
    }

    private void restarted(final Response response, final Throwable error) {
        if (disposed || session.state() != SessionState.ERROR) {
            return;
        }
        if (error != null || !response.success()) {
            output.write(renderer.error("Restart failed: " + (error != null ? describe(error) : response.error())));
            showPrompt();
            return;
        }
        if (response.hardwareSnapshot() != null) {
            lastHardwareSnapshot = response.hardwareSnapshot();
        }
        session.transitionTo(SessionState.IDLE);
        output.write(renderer.success("Runtime restarted"));
        showPrompt();
    }

    private void enterPasteMode() {
        if (session.state() == SessionState.AWAITING_RUNTIME || paste.isActive()) {
            return;
        }
        cycle.reset();
        paste.enter();
        emit(ControlSignalType.PASTE_MODE_ENTER);
        output.write(renderer.pasteBanner());
    }

    private void finishPaste() {
        final String text = paste.finish();
        output.write(SessionRenderer.NEWLINE);
        if (text.isBlank() || session.state() != SessionState.IDLE) {
            showPrompt();
            return;
        }
        run(() -> execute(text, ExecutionMode.FILE));
    }

    private void requestCompletion() {
        if (paste.isActive() || session.state() != SessionState.IDLE) {
            return;
        }
        if (cycle.isActive()) {
            cycle.advance().ifPresent(this::replaceInput);
            return;
        }
        if (completions == null) {
            return;
        }
        final int generation = inputGeneration;
        final String input = session.input();
        completions.complete(input, input.length())
                .thenAccept(items -> reactor.execute(() -> completionArrived(generation, input, items)));
    }

    private void completionArrived(final int generation, final String input, final List<CompletionItem> items) {
        if (generation != inputGeneration || cycle.isActive() || session.state() != SessionState.IDLE) {
            log.debug("Discarding stale completion for '{}'", input);
            return;
        }
        cycle.start(input, items).ifPresent(this::replaceInput);
    }

    private void applyReadiness(final ReadinessSignal signal) {
        if (disposed) {
            return;
        }
        if (session.hasTransport()) {
            log.warn("Ignoring readiness signal, transport already selected");
            return;
        }
        if (signal.transport() != null) {
            session.selectTransport(signal.transport());
            if (signal.transport() instanceof Transport.Direct direct) {
                client = direct.client();
                client.onFault(this::channelFault);
            }
        }
        output.write(SessionRenderer.NEWLINE);
        if (!signal.ready()) {
            final String message = signal.message() == null ? "Runtime failed to start" : signal.message();
            output.write(renderer.error(message));
            if (!initializationFailureReported) {
                initializationFailureReported = true;
                host.onInitializationFailure(message);
            }
            session.transitionTo(SessionState.ERROR);
            showPrompt();
            return;
        }
        session.transitionTo(SessionState.IDLE);
        if (session.transport() instanceof Transport.Direct) {
            output.write(renderer.success("Runtime ready"));
            showPrompt();
        }
    }

    private void channelFault(final Throwable cause) {
        if (disposed) {
            return;
        }
        session.pendingCommands().rejectAll(() -> new ChannelClosedException("Runtime channel closed"));
        inFlight = 0;
        paste.cancel();
        cycle.reset();
        output.write(SessionRenderer.NEWLINE + renderer.error("Runtime connection lost: " + cause.getMessage()));
        session.transitionTo(SessionState.ERROR);
        showPrompt();
    }

    private void sweepExpired() {
        final int expired = session.pendingCommands().sweepExpired();
        if (expired > 0) {
            log.debug("Timeout sweep rejected {} commands", expired);
        }
    }

    private void disposeNow() {
        if (disposed) {
            return;
        }
        disposed = true;
        if (sweep != null) {
            sweep.cancel(false);
        }
        session.pendingCommands().rejectAll(() -> new ChannelClosedException("Session disposed"));
        final Transport transport = session.transport();
        if (transport instanceof Transport.Direct direct) {
            direct.client().close();
        } else if (transport instanceof Transport.PassThrough passThrough) {
            passThrough.target().close();
        }
        if (completions != null) {
            completions.close();
        }
        log.info("Session {} disposed", session.id());
        host.onClosed();
        reactor.close();
    }

    private void emit(final ControlSignalType type) {
        host.onControlSignal(new ControlSignal(signalIds.next(), type, clock.millis()));
    }

    private void replaceInput(final String text) {
        session.replaceInput(text);
        output.write(renderer.promptLine(session.state(), session.mode(), text));
    }

    private void showPrompt() {
        output.write(renderer.prompt(session.state(), session.mode()));
    }

    private static Throwable unwrap(final Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static String describe(final Throwable error) {
        final Throwable cause = unwrap(error);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
