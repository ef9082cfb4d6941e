package org.circuitrepl.channel;

/**
 * In-memory duplex channel connecting two endpoints in the same JVM.
 * <p>
 * Use {@link #pair()} to create both ends. Messages are handed over by reference, so both
 * ends must treat them as immutable. Closing either end closes both.
 *
 * @param <O> The type of message this endpoint sends.
 * @param <I> The type of message this endpoint receives.
 */
public final class InMemoryDuplexChannel<O, I> extends AbstractDuplexChannel<O, I> {

    private InMemoryDuplexChannel<I, O> peer;

    private InMemoryDuplexChannel() {
    }

    /**
     * Creates two connected endpoints.
     *
     * @param <A> The type sent by the first endpoint and received by the second.
     * @param <B> The type sent by the second endpoint and received by the first.
     * @return the connected endpoints.
     */
    public static <A, B> Pair<A, B> pair() {
        final InMemoryDuplexChannel<A, B> first = new InMemoryDuplexChannel<>();
        final InMemoryDuplexChannel<B, A> second = new InMemoryDuplexChannel<>();
        first.peer = second;
        second.peer = first;
        return new Pair<>(first, second);
    }

    @Override
    public void send(final O message) {
        ensureOpen();
        peer.deliver(message);
    }

    @Override
    protected void onClose() {
        peer.close();
    }

    /**
     * The two ends of an in-memory channel.
     */
    public record Pair<A, B>(InMemoryDuplexChannel<A, B> first, InMemoryDuplexChannel<B, A> second) {
    }
}
