package org.circuitrepl.session;

import org.circuitrepl.protocol.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;

/**
 * State of one terminal session, owned by whoever opened the terminal.
 * <p>
 * Only the session reactor thread reads or writes it, except for the pending command table
 * which is safe for concurrent use.
 */
public final class Session {

    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private final String id;
    private final SessionMode mode;
    private final CorrelationTable<Response> pendingCommands;
    private final CommandHistory history;
    private final StringBuilder inputBuffer = new StringBuilder();
    private volatile SessionState state = SessionState.AWAITING_RUNTIME;
    private volatile Transport transport;

    public Session(final SessionMode mode, final CorrelationTable<Response> pendingCommands, final CommandHistory history) {
        this(UUID.randomUUID().toString(), mode, pendingCommands, history);
    }

    public Session(final String id,
                   final SessionMode mode,
                   final CorrelationTable<Response> pendingCommands,
                   final CommandHistory history) {
        this.id = id;
        this.mode = mode;
        this.pendingCommands = pendingCommands;
        this.history = history;
    }

    public String id() {
        return id;
    }

    public SessionMode mode() {
        return mode;
    }

    public SessionState state() {
        return state;
    }

    /**
     * Moves along the state machine.
     *
     * @throws IllegalStateException if the transition is not allowed.
     */
    public void transitionTo(final SessionState target) {
        if (state == target) {
            return;
        }
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal session transition " + state + " -> " + target);
        }
        log.debug("Session {}: {} -> {}", id, state, target);
        state = target;
    }

    /**
     * Forces an executing session back to {@link SessionState#IDLE}, as interrupt and
     * soft-restart do. Other states are left alone.
     */
    public void forceIdle() {
        if (state == SessionState.EXECUTING) {
            log.debug("Session {}: {} -> {} (forced)", id, state, SessionState.IDLE);
            state = SessionState.IDLE;
        }
    }

    public Transport transport() {
        return transport;
    }

    public boolean hasTransport() {
        return transport != null;
    }

    /**
     * Fixes the transport. Can be called once.
     *
     * @throws IllegalStateException if a transport was already chosen.
     */
    public void selectTransport(final Transport selected) {
        Objects.requireNonNull(selected, "transport");
        if (transport != null) {
            throw new IllegalStateException("Transport already selected: " + transport.getClass().getSimpleName());
        }
        transport = selected;
    }

    public CorrelationTable<Response> pendingCommands() {
        return pendingCommands;
    }

    public CommandHistory history() {
        return history;
    }

    public StringBuilder inputBuffer() {
        return inputBuffer;
    }

    public String input() {
        return inputBuffer.toString();
    }

    public void replaceInput(final String text) {
        inputBuffer.setLength(0);
        inputBuffer.append(text);
    }
}
