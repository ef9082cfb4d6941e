package org.circuitrepl.session;

import org.circuitrepl.channel.IDuplexChannel;
import org.circuitrepl.channel.IRuntimeConnector;
import org.circuitrepl.protocol.ChannelClosedException;
import org.circuitrepl.protocol.EnvelopeCodec;
import org.circuitrepl.protocol.ExecutePayload;
import org.circuitrepl.protocol.ExecutionMode;
import org.circuitrepl.protocol.Request;
import org.circuitrepl.protocol.RequestType;
import org.circuitrepl.protocol.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Controller side of the runtime protocol.
 * <p>
 * Registers each outbound request in the session's {@link CorrelationTable} and resolves it
 * when the matching response arrives. A reader thread takes responses off the channel and
 * hands them to the session reactor, so continuations always run on the reactor.
 */
public final class RuntimeClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RuntimeClient.class);

    private final IRuntimeConnector connector;
    private final CorrelationTable<Response> table;
    private final SessionReactor reactor;
    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final Clock clock;

    private volatile IDuplexChannel<Request, Response> channel;
    private volatile CompletableFuture<Response> initialization = new CompletableFuture<>();
    private volatile Consumer<Throwable> faultHandler = cause -> { };
    private volatile boolean closed;

    public RuntimeClient(final IRuntimeConnector connector,
                         final CorrelationTable<Response> table,
                         final SessionReactor reactor,
                         final Clock clock) {
        this.connector = connector;
        this.table = table;
        this.reactor = reactor;
        this.clock = clock;
    }

    /**
     * Starts a worker and begins reading its responses.
     *
     * @return completes on the reactor with the worker's {@code init} response.
     */
    public synchronized CompletableFuture<Response> connect() throws IOException {
        final IDuplexChannel<Request, Response> next = connector.connect();
        final CompletableFuture<Response> init = new CompletableFuture<>();
        channel = next;
        initialization = init;
        closed = false;
        final Thread reader = new Thread(() -> readLoop(next, init), "runtime-client-reader");
        reader.setDaemon(true);
        reader.start();
        return init;
    }

    /**
     * Replaces the current worker with a fresh one.
     */
    public synchronized CompletableFuture<Response> reconnect() throws IOException {
        final IDuplexChannel<Request, Response> previous = channel;
        channel = null;
        if (previous != null) {
            previous.close();
        }
        return connect();
    }

    /**
     * Sets the handler notified, on the reactor, when the channel fails unexpectedly.
     */
    public void onFault(final Consumer<Throwable> handler) {
        this.faultHandler = handler;
    }

    public CompletableFuture<Response> initialization() {
        return initialization;
    }

    public CompletableFuture<Response> execute(final String code, final ExecutionMode mode, final boolean monitorHardware) {
        return send(RequestType.EXECUTE, new ExecutePayload(code, mode, monitorHardware), CommandKind.EXECUTE);
    }

    /**
     * Sends a request and returns its continuation. Send failures reject the continuation.
     */
    public CompletableFuture<Response> send(final RequestType type, final Object payload, final CommandKind kind) {
        final PendingCommand<Response> command = table.register(kind);
        final IDuplexChannel<Request, Response> current = channel;
        if (current == null || !current.isOpen()) {
            table.reject(command.id(), new ChannelClosedException("Runtime is not connected"));
            return command.continuation();
        }
        try {
            current.send(new Request(command.id(), type, codec.toTree(payload), clock.millis()));
        } catch (ChannelClosedException e) {
            table.reject(command.id(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            table.reject(command.id(), new ChannelClosedException("Interrupted while sending", e));
        }
        return command.continuation();
    }

    public boolean isConnected() {
        final IDuplexChannel<Request, Response> current = channel;
        return current != null && current.isOpen();
    }

    @Override
    public synchronized void close() {
        closed = true;
        final IDuplexChannel<Request, Response> current = channel;
        channel = null;
        if (current != null) {
            current.close();
        }
    }

    private void readLoop(final IDuplexChannel<Request, Response> source, final CompletableFuture<Response> init) {
        try {
            while (true) {
                final Response response = source.take();
                reactor.execute(() -> dispatch(response, init));
            }
        } catch (ChannelClosedException e) {
            reactor.execute(() -> channelEnded(source, init, e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void dispatch(final Response response, final CompletableFuture<Response> init) {
        if (Response.INIT_ID.equals(response.id())) {
            if (!init.complete(response)) {
                log.debug("Ignoring repeated init response");
            }
            return;
        }
        table.resolve(response.id(), response);
    }

    private void channelEnded(final IDuplexChannel<Request, Response> source,
                              final CompletableFuture<Response> init,
                              final ChannelClosedException cause) {
        // A channel we replaced or closed ourselves is not a fault.
        if (closed || source != channel) {
            return;
        }
        log.warn("Runtime channel failed: {}", cause.getMessage());
        channel = null;
        init.completeExceptionally(cause);
        table.rejectAll(() -> new ChannelClosedException("Runtime channel closed"));
        faultHandler.accept(cause);
    }
}
