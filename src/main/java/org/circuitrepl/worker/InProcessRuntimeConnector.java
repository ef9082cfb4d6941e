package org.circuitrepl.worker;

import org.circuitrepl.channel.IDuplexChannel;
import org.circuitrepl.channel.IRuntimeConnector;
import org.circuitrepl.channel.InMemoryDuplexChannel;
import org.circuitrepl.protocol.Request;
import org.circuitrepl.protocol.Response;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Starts each runtime worker on its own thread, connected through an in-memory channel.
 * Closing the returned channel stops the worker.
 */
public final class InProcessRuntimeConnector implements IRuntimeConnector {

    private static final AtomicInteger WORKER_COUNTER = new AtomicInteger();

    private final Function<IDuplexChannel<Response, Request>, RuntimeWorker> workerFactory;

    public InProcessRuntimeConnector(final WorkerSettings settings) {
        this(channel -> RuntimeWorkers.create(channel, settings));
    }

    public InProcessRuntimeConnector(final Function<IDuplexChannel<Response, Request>, RuntimeWorker> workerFactory) {
        this.workerFactory = workerFactory;
    }

    @Override
    public IDuplexChannel<Request, Response> connect() {
        final InMemoryDuplexChannel.Pair<Request, Response> pair = InMemoryDuplexChannel.pair();
        final RuntimeWorker worker = workerFactory.apply(pair.second());
        final Thread thread = new Thread(worker, "runtime-worker-" + WORKER_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        thread.start();
        return pair.first();
    }
}
