package org.circuitrepl.session;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a REPL session.
 */
public enum SessionState {
    /** No runtime is ready yet. */
    AWAITING_RUNTIME,
    /** Accepting input. */
    IDLE,
    /** One command in flight. */
    EXECUTING,
    /** The channel to the runtime failed. Leaves only through an explicit restart. */
    ERROR;

    /**
     * Whether the regular state machine permits moving from this state to {@code target}.
     * Interrupt and soft-restart force {@link #IDLE} and are checked separately.
     */
    public boolean canTransitionTo(final SessionState target) {
        return allowedTargets().contains(target);
    }

    private Set<SessionState> allowedTargets() {
        return switch (this) {
            case AWAITING_RUNTIME -> EnumSet.of(IDLE, ERROR);
            case IDLE -> EnumSet.of(EXECUTING, ERROR);
            case EXECUTING -> EnumSet.of(IDLE, ERROR);
            case ERROR -> EnumSet.of(IDLE);
        };
    }
}
