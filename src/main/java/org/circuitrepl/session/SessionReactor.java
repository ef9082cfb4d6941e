package org.circuitrepl.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded event loop of a session. Keystrokes, channel messages, continuations and
 * periodic ticks all run here, one at a time. Tasks must not block.
 */
public final class SessionReactor implements Executor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionReactor.class);

    private final ScheduledExecutorService executor;

    public SessionReactor(final String name) {
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            final Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void execute(final Runnable task) {
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("Reactor is closed, dropping task");
        }
    }

    public ScheduledFuture<?> scheduleAtFixedRate(final Runnable task, final Duration interval) {
        final long millis = interval.toMillis();
        return executor.scheduleAtFixedRate(guarded(task), millis, millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static Runnable guarded(final Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // A failing task must not kill the loop or cancel a periodic schedule.
                log.error("Session task failed", e);
            }
        };
    }
}
