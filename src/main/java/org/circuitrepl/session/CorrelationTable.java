package org.circuitrepl.session;

import org.circuitrepl.protocol.CommandTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Outstanding commands keyed by correlation id.
 * <p>
 * Removing an entry from the map is the single point that decides its fate: whichever of
 * {@link #resolve}, {@link #reject}, {@link #rejectAll} or {@link #sweepExpired} removes it
 * completes its continuation, and nobody else can. A command is therefore resolved, rejected
 * or timed out exactly once.
 *
 * @param <T> The response type.
 */
public final class CorrelationTable<T> {

    private static final Logger log = LoggerFactory.getLogger(CorrelationTable.class);

    private final Map<String, PendingCommand<T>> pending = new ConcurrentHashMap<>();
    private final CorrelationIdGenerator ids;
    private final Clock clock;
    private final Duration defaultTimeout;

    public CorrelationTable(final CorrelationIdGenerator ids, final Clock clock, final Duration defaultTimeout) {
        this.ids = ids;
        this.clock = clock;
        this.defaultTimeout = defaultTimeout;
    }

    public PendingCommand<T> register(final CommandKind kind) {
        return register(kind, defaultTimeout);
    }

    /**
     * Creates a pending command with a fresh id and the given deadline offset.
     */
    public PendingCommand<T> register(final CommandKind kind, final Duration timeout) {
        final Instant now = clock.instant();
        final PendingCommand<T> command = new PendingCommand<>(ids.next(), kind, now, now.plus(timeout),
                new CompletableFuture<>());
        if (pending.putIfAbsent(command.id(), command) != null) {
            throw new IllegalStateException("Duplicate correlation id " + command.id());
        }
        return command;
    }

    /**
     * Completes the command with the given id. An unknown id is ignored.
     *
     * @return true if a pending command was completed.
     */
    public boolean resolve(final String id, final T response) {
        final PendingCommand<T> command = id == null ? null : pending.remove(id);
        if (command == null) {
            log.debug("Discarding response with unmatched id {}", id);
            return false;
        }
        command.continuation().complete(response);
        return true;
    }

    /**
     * Rejects the command with the given id. An unknown id is ignored.
     *
     * @return true if a pending command was rejected.
     */
    public boolean reject(final String id, final Throwable cause) {
        final PendingCommand<T> command = pending.remove(id);
        if (command == null) {
            return false;
        }
        command.continuation().completeExceptionally(cause);
        return true;
    }

    /**
     * Rejects every outstanding command.
     *
     * @param cause Creates the exception for each rejected command.
     * @return the number of rejected commands.
     */
    public int rejectAll(final Supplier<? extends Throwable> cause) {
        int rejected = 0;
        for (String id : new ArrayList<>(pending.keySet())) {
            if (reject(id, cause.get())) {
                rejected++;
            }
        }
        return rejected;
    }

    /**
     * Rejects every command whose deadline has passed with a {@link CommandTimeoutException}.
     * A no-op on an empty table.
     *
     * @return the number of timed out commands.
     */
    public int sweepExpired() {
        if (pending.isEmpty()) {
            return 0;
        }
        final Instant now = clock.instant();
        final List<PendingCommand<T>> expired = pending.values().stream()
                .filter(command -> command.isExpired(now))
                .toList();
        int timedOut = 0;
        for (PendingCommand<T> command : expired) {
            if (reject(command.id(), new CommandTimeoutException("Command timeout"))) {
                log.debug("Command {} ({}) timed out", command.id(), command.kind());
                timedOut++;
            }
        }
        return timedOut;
    }

    public boolean contains(final String id) {
        return pending.containsKey(id);
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
