package org.circuitrepl.channel;

/**
 * One endpoint of a bidirectional, order-preserving channel.
 * <p>
 * Once either side closes, pending and future {@link #take()} calls fail with
 * {@link org.circuitrepl.protocol.ChannelClosedException} after the already delivered
 * messages have been drained.
 *
 * @param <O> The type of message this endpoint sends.
 * @param <I> The type of message this endpoint receives.
 */
public interface IDuplexChannel<O, I> extends IOutputChannel<O>, IInputChannel<I>, AutoCloseable {

    boolean isOpen();

    @Override
    void close();
}
