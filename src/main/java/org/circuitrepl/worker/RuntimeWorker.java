package org.circuitrepl.worker;

import com.fasterxml.jackson.databind.JsonNode;
import org.circuitrepl.channel.IDuplexChannel;
import org.circuitrepl.hardware.HardwareState;
import org.circuitrepl.hardware.IHardwareSimulation;
import org.circuitrepl.hardware.PinState;
import org.circuitrepl.hardware.SensorState;
import org.circuitrepl.protocol.BoardProfile;
import org.circuitrepl.protocol.ChannelClosedException;
import org.circuitrepl.protocol.ConfigurePayload;
import org.circuitrepl.protocol.ConfigureResult;
import org.circuitrepl.protocol.EnvelopeCodec;
import org.circuitrepl.protocol.ExecutePayload;
import org.circuitrepl.protocol.ExecuteResult;
import org.circuitrepl.protocol.HardwareQueryPayload;
import org.circuitrepl.protocol.HardwareQueryResult;
import org.circuitrepl.protocol.HardwareSetPayload;
import org.circuitrepl.protocol.HardwareSetResult;
import org.circuitrepl.protocol.QueryPayload;
import org.circuitrepl.protocol.Request;
import org.circuitrepl.protocol.Response;
import org.circuitrepl.protocol.RuntimeInitializationException;
import org.circuitrepl.protocol.StatusResult;
import org.circuitrepl.worker.interpreter.InterpreterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Single-threaded dispatch loop of a runtime worker.
 * <p>
 * Reads one request, produces exactly one response, then reads the next. Every fault while
 * handling a request is answered with a failure response; only a closed channel ends the loop.
 * The worker owns its {@link RuntimeInstance} and {@link HardwareState} exclusively.
 */
public class RuntimeWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RuntimeWorker.class);

    static final String NOT_INITIALIZED = "runtime not initialized";

    private final IDuplexChannel<Response, Request> channel;
    private final RuntimeInstance runtime;
    private final IHardwareSimulation simulation;
    private final LongSupplier clock;
    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final HardwareState hardware;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    /**
     * @param channel    Worker side of the channel: sends responses, receives requests.
     * @param runtime    The interpreter instance to host.
     * @param simulation Strategy deriving hardware side effects from executed code.
     * @param clock      Epoch millisecond clock.
     */
    public RuntimeWorker(final IDuplexChannel<Response, Request> channel,
                         final RuntimeInstance runtime,
                         final IHardwareSimulation simulation,
                         final LongSupplier clock) {
        this.channel = channel;
        this.runtime = runtime;
        this.simulation = simulation;
        this.clock = clock;
        this.hardware = HardwareState.withDefaults(clock.getAsLong());
    }

    @Override
    public void run() {
        log.info("{} started", getClass().getSimpleName());
        try {
            send(initialize());
            while (!stopped.get()) {
                final Request request = channel.take();
                send(handle(request));
            }
        } catch (ChannelClosedException e) {
            log.debug("Channel closed: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            shutdown();
        }
    }

    /**
     * Stops the loop and releases the interpreter. Safe to call from any thread and more than once.
     */
    public void shutdown() {
        if (stopped.compareAndSet(false, true)) {
            runtime.deinitialize();
            channel.close();
            log.info("{} stopped", getClass().getSimpleName());
        }
    }

    /**
     * Starts the interpreter and builds the distinguished {@code init} response.
     */
    Response initialize() {
        final long start = clock.getAsLong();
        try {
            runtime.initialize();
            return Response.success(Response.INIT_ID,
                    codec.toTree(new StatusResult("ready", true, runtime.heapSizeBytes(), null)),
                    elapsed(start), hardware.snapshot());
        } catch (RuntimeInitializationException e) {
            log.error("Interpreter failed to initialize: {}", e.getMessage());
            return Response.failure(Response.INIT_ID, "Initialization failed: " + e.getMessage(), elapsed(start));
        }
    }

    /**
     * Handles one request. Never throws.
     */
    Response handle(final Request request) {
        final long start = clock.getAsLong();
        final String id = request.id();
        try {
            return switch (request.type()) {
                case EXECUTE -> execute(id, codec.fromTree(request.payload(), ExecutePayload.class), start);
                case QUERY -> succeed(id, query(codec.fromTree(request.payload(), QueryPayload.class)), start);
                case RESET -> succeed(id, reset(), start);
                case CONFIGURE -> succeed(id, configure(codec.fromTree(request.payload(), ConfigurePayload.class)), start);
                case HARDWARE_QUERY -> succeed(id,
                        hardwareQuery(codec.fromTree(request.payload(), HardwareQueryPayload.class)), start);
                case HARDWARE_SET -> succeed(id,
                        hardwareSet(codec.fromTree(request.payload(), HardwareSetPayload.class)), start);
                case UNKNOWN -> Response.failure(id, "Unknown message type", elapsed(start));
            };
        } catch (RuntimeException e) {
            log.warn("Request {} ({}) failed: {}", id, request.type(), e.getMessage());
            return Response.failure(id, e.getMessage(), elapsed(start));
        }
    }

    private Response execute(final String id, final ExecutePayload payload, final long start) {
        if (!runtime.isInitialized()) {
            return Response.failure(id, NOT_INITIALIZED, elapsed(start));
        }
        final String code = payload.code() == null ? "" : payload.code();
        ExecuteResult result;
        try {
            result = runtime.execute(code, payload.effectiveMode());
        } catch (InterpreterException e) {
            log.warn("Interpreter failure while executing request {}: {}", id, e.getMessage());
            result = new ExecuteResult("", e.getMessage(), payload.effectiveMode());
        }
        if (payload.hardwareMonitoring()) {
            simulation.simulate(code, hardware);
        }
        if (result.error() != null) {
            return Response.failure(id, codec.toTree(result), result.error(), elapsed(start), hardware.snapshot());
        }
        return succeed(id, result, start);
    }

    private StatusResult query(final QueryPayload payload) {
        final String queryType = payload.queryType();
        if (QueryPayload.READY.equals(queryType)) {
            return StatusResult.of(runtime.isInitialized() ? "ready" : "not_ready");
        }
        if (QueryPayload.HEALTH.equals(queryType)) {
            return new StatusResult("healthy", runtime.isInitialized(), runtime.heapSizeBytes(), clock.getAsLong());
        }
        throw new IllegalArgumentException("Unknown query type: " + queryType);
    }

    private StatusResult reset() {
        runtime.reinitialize();
        hardware.resetToDefaults(clock.getAsLong());
        return StatusResult.of("reset_complete");
    }

    private ConfigureResult configure(final ConfigurePayload payload) {
        final long now = clock.getAsLong();
        for (SensorState sensor : payload.sensorsOrEmpty()) {
            hardware.putSensor(sensor.withValue(sensor.value(), now));
        }
        for (PinState pin : payload.gpiosOrEmpty()) {
            hardware.putPin(pin.withValue(pin.value(), now));
        }
        hardware.touch(now);
        final BoardProfile profile = payload.boardProfile() == null ? BoardProfile.DEFAULT : payload.boardProfile();
        return new ConfigureResult("configured", profile, payload.sensorsOrEmpty().size(), payload.gpiosOrEmpty().size());
    }

    private HardwareQueryResult hardwareQuery(final HardwareQueryPayload payload) {
        hardware.touch(clock.getAsLong());
        return new HardwareQueryResult(payload.effectiveQueryType(), hardware.snapshot());
    }

    private HardwareSetResult hardwareSet(final HardwareSetPayload payload) {
        final long now = clock.getAsLong();
        int changes = 0;
        for (HardwareSetPayload.PinUpdate update : payload.pinsOrEmpty()) {
            final PinState current = hardware.pin(update.pin()).orElse(null);
            if (current == null) {
                continue;
            }
            PinState next = current.withValue(update.value(), now);
            if (update.mode() != null) {
                next = next.withMode(update.mode(), now);
            }
            hardware.putPin(next);
            changes++;
        }
        for (HardwareSetPayload.SensorUpdate update : payload.sensorsOrEmpty()) {
            final SensorState current = hardware.sensor(update.id()).orElse(null);
            if (current == null) {
                continue;
            }
            hardware.putSensor(current.withValue(update.value(), now));
            changes++;
        }
        hardware.touch(now);
        return new HardwareSetResult("updated", changes);
    }

    private Response succeed(final String id, final Object result, final long start) {
        final JsonNode tree = codec.toTree(result);
        return Response.success(id, tree, elapsed(start), hardware.snapshot());
    }

    private long elapsed(final long start) {
        return Math.max(0, clock.getAsLong() - start);
    }

    private void send(final Response response) throws InterruptedException {
        channel.send(response);
    }

    HardwareState hardware() {
        return hardware;
    }
}
