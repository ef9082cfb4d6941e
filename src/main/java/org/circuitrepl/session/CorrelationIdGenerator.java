package org.circuitrepl.session;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates correlation ids. Ids from one generator never repeat: each carries a strictly
 * increasing sequence number after a per-generator random prefix, so ids from different
 * sessions do not collide either.
 */
public final class CorrelationIdGenerator {

    private final String prefix;
    private final AtomicLong sequence = new AtomicLong();

    public CorrelationIdGenerator() {
        this(UUID.randomUUID().toString().substring(0, 8));
    }

    CorrelationIdGenerator(final String prefix) {
        this.prefix = prefix;
    }

    public String next() {
        return prefix + "-" + Long.toString(sequence.incrementAndGet(), 36);
    }
}
