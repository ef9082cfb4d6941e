package org.circuitrepl.channel;

import org.circuitrepl.protocol.ChannelClosedException;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base class for duplex endpoints whose inbound side is a blocking queue.
 * A sentinel marks end of stream so that blocked readers wake up on close.
 */
abstract class AbstractDuplexChannel<O, I> implements IDuplexChannel<O, I> {

    private static final Object END_OF_STREAM = new Object();

    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean open = new AtomicBoolean(true);

    @Override
    public I take() throws InterruptedException {
        return unwrap(inbound.take());
    }

    @Override
    public Optional<I> poll(final long timeout, final TimeUnit unit) throws InterruptedException {
        final Object element = inbound.poll(timeout, unit);
        return element == null ? Optional.empty() : Optional.of(unwrap(element));
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            onClose();
            markEndOfStream();
        }
    }

    /**
     * Hands a received message to readers of this endpoint.
     */
    protected void deliver(final I message) {
        inbound.add(message);
    }

    protected void markEndOfStream() {
        inbound.add(END_OF_STREAM);
    }

    protected void ensureOpen() {
        if (!open.get()) {
            throw new ChannelClosedException("Channel is closed");
        }
    }

    /**
     * Releases transport resources. Called once, on the first {@link #close()}.
     */
    protected abstract void onClose();

    @SuppressWarnings("unchecked")
    private I unwrap(final Object element) {
        if (element == END_OF_STREAM) {
            // Keep the marker in place for any further reader.
            inbound.add(END_OF_STREAM);
            throw new ChannelClosedException("Channel reached end of stream");
        }
        return (I) element;
    }
}
