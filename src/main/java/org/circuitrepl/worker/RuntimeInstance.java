package org.circuitrepl.worker;

import org.circuitrepl.protocol.ExecuteResult;
import org.circuitrepl.protocol.ExecutionMode;
import org.circuitrepl.protocol.RuntimeInitializationException;
import org.circuitrepl.worker.interpreter.IInterpreter;
import org.circuitrepl.worker.interpreter.InterpreterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * The single interpreter instance hosted by a runtime worker.
 * <p>
 * {@link #reinitialize()} tears the interpreter down and creates a fresh one, so at most one
 * interpreter is alive at any time.
 */
public final class RuntimeInstance {

    private static final Logger log = LoggerFactory.getLogger(RuntimeInstance.class);

    private final Supplier<IInterpreter> interpreterFactory;
    private final long heapSizeBytes;

    private IInterpreter interpreter;
    private boolean initialized;

    public RuntimeInstance(final Supplier<IInterpreter> interpreterFactory, final long heapSizeBytes) {
        this.interpreterFactory = interpreterFactory;
        this.heapSizeBytes = heapSizeBytes;
    }

    /**
     * Allocates the interpreter with the configured heap and enables interactive mode.
     *
     * @throws RuntimeInitializationException if the interpreter cannot be started.
     */
    public void initialize() {
        deinitialize();
        final IInterpreter candidate = interpreterFactory.get();
        try {
            candidate.initialize(heapSizeBytes);
        } catch (InterpreterException e) {
            candidate.close();
            throw new RuntimeInitializationException(e.getMessage(), e);
        }
        interpreter = candidate;
        initialized = true;
        log.info("Interpreter initialized with heap of {} bytes", heapSizeBytes);
    }

    public void reinitialize() {
        initialize();
    }

    /**
     * Best-effort teardown. Never throws.
     */
    public void deinitialize() {
        initialized = false;
        if (interpreter != null) {
            try {
                interpreter.close();
            } catch (RuntimeException e) {
                log.warn("Interpreter did not close cleanly: {}", e.getMessage());
            }
            interpreter = null;
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    public long heapSizeBytes() {
        return heapSizeBytes;
    }

    /**
     * Runs code and returns the captured streams.
     *
     * @throws IllegalStateException if the instance is not initialized.
     * @throws InterpreterException  if the interpreter itself fails.
     */
    public ExecuteResult execute(final String code, final ExecutionMode mode) throws InterpreterException {
        if (!initialized) {
            throw new IllegalStateException("runtime not initialized");
        }
        interpreter.drainOutput();
        interpreter.drainError();
        if (mode == ExecutionMode.FILE && interpreter.supportsWholeSource()) {
            interpreter.evaluate(code);
        } else {
            feedLines(code);
        }
        final String error = interpreter.drainError();
        return new ExecuteResult(interpreter.drainOutput(), error.isEmpty() ? null : error, mode);
    }

    private void feedLines(final String code) throws InterpreterException {
        boolean more = false;
        for (String line : code.split("\\r?\\n", -1)) {
            more = interpreter.pushLine(line);
        }
        if (more) {
            more = interpreter.pushLine("");
        }
        if (more) {
            log.debug("Discarding incomplete input block");
            interpreter.resetInput();
        }
    }
}
