package org.circuitrepl.channel;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * A channel for receiving messages.
 *
 * @param <T> The type of message received.
 */
public interface IInputChannel<T> {

    /**
     * Reads a message from the channel, blocking until a message is available.
     *
     * @return The message read from the channel.
     * @throws InterruptedException if the thread is interrupted while waiting for a message.
     * @throws org.circuitrepl.protocol.ChannelClosedException if the channel was closed.
     */
    T take() throws InterruptedException;

    Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException;
}
