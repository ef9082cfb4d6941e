package org.circuitrepl.completion;

import org.circuitrepl.channel.IDuplexChannel;
import org.circuitrepl.channel.InMemoryDuplexChannel;
import org.circuitrepl.protocol.ChannelClosedException;
import org.circuitrepl.session.CommandKind;
import org.circuitrepl.session.CorrelationIdGenerator;
import org.circuitrepl.session.CorrelationTable;
import org.circuitrepl.session.PendingCommand;
import org.circuitrepl.session.SessionReactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Controller side of the completion exchange. Requests are correlated like runtime commands
 * and expire after the completion timeout. Any failure yields an empty candidate list.
 */
public final class CompletionBridge implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CompletionBridge.class);

    private final IDuplexChannel<CompletionRequest, CompletionResponse> channel;
    private final CorrelationTable<CompletionResponse> table;
    private final SessionReactor reactor;
    private final ScheduledFuture<?> sweep;

    public CompletionBridge(final IDuplexChannel<CompletionRequest, CompletionResponse> channel,
                            final SessionReactor reactor,
                            final Duration timeout) {
        this.channel = channel;
        this.reactor = reactor;
        this.table = new CorrelationTable<>(new CorrelationIdGenerator(), Clock.systemUTC(), timeout);
        this.sweep = reactor.scheduleAtFixedRate(table::sweepExpired, timeout);
        final Thread reader = new Thread(this::readLoop, "completion-bridge-reader");
        reader.setDaemon(true);
        reader.start();
    }

    /**
     * Starts a {@link CompletionService} on its own thread and connects a bridge to it.
     */
    public static CompletionBridge inProcess(final ModuleRegistry registry,
                                             final SessionReactor reactor,
                                             final Duration timeout) {
        final InMemoryDuplexChannel.Pair<CompletionRequest, CompletionResponse> pair = InMemoryDuplexChannel.pair();
        final Thread service = new Thread(new CompletionService(registry, pair.second()), "completion-service");
        service.setDaemon(true);
        service.start();
        return new CompletionBridge(pair.first(), reactor, timeout);
    }

    /**
     * Requests candidates for the given single-line input and cursor offset.
     *
     * @return completes on the reactor, never exceptionally.
     */
    public CompletableFuture<List<CompletionItem>> complete(final String input, final int cursor) {
        final String[] lines = input.substring(0, Math.min(cursor, input.length())).split("\n", -1);
        final int line = lines.length - 1;
        final int character = lines[line].length();

        final PendingCommand<CompletionResponse> command = table.register(CommandKind.QUERY);
        try {
            channel.send(new CompletionRequest(command.id(), input, line, character));
        } catch (ChannelClosedException e) {
            table.reject(command.id(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            table.reject(command.id(), new ChannelClosedException("Interrupted while sending", e));
        }
        return command.continuation().handle((response, error) -> {
            if (error != null) {
                log.debug("Completion failed: {}", error.getMessage());
                return List.<CompletionItem>of();
            }
            return response.items();
        });
    }

    @Override
    public void close() {
        sweep.cancel(false);
        channel.close();
        table.rejectAll(() -> new ChannelClosedException("Completion bridge closed"));
    }

    private void readLoop() {
        try {
            while (true) {
                final CompletionResponse response = channel.take();
                reactor.execute(() -> table.resolve(response.id(), response));
            }
        } catch (ChannelClosedException e) {
            log.debug("Completion channel closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
