package org.circuitrepl.session;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * An issued command awaiting its response.
 *
 * @param id           Correlation id.
 * @param kind         What the command does.
 * @param issuedAt     Issuance time.
 * @param deadline     Time after which the timeout sweep rejects the command.
 * @param continuation Completed exactly once: with the response, or exceptionally.
 * @param <T>          The response type.
 */
public record PendingCommand<T>(String id,
                                CommandKind kind,
                                Instant issuedAt,
                                Instant deadline,
                                CompletableFuture<T> continuation) {

    public boolean isExpired(final Instant now) {
        return now.isAfter(deadline);
    }
}
