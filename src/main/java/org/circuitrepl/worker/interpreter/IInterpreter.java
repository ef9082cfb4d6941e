package org.circuitrepl.worker.interpreter;

/**
 * An embedded interpreter with an interactive line processor.
 * <p>
 * Errors raised by user code are written to the interpreter's captured error stream and do
 * not surface as exceptions. {@link InterpreterException} is reserved for failures of the
 * interpreter itself. Implementations are used from a single thread.
 */
public interface IInterpreter extends AutoCloseable {

    /**
     * Allocates the interpreter and enables interactive mode.
     *
     * @param heapSizeBytes The heap budget requested for the interpreter.
     * @throws InterpreterException if the interpreter cannot be started.
     */
    void initialize(long heapSizeBytes) throws InterpreterException;

    /**
     * Feeds one source line to the interactive processor. An empty line submits a pending block.
     *
     * @return true if the processor needs more input to complete the current unit.
     */
    boolean pushLine(String line) throws InterpreterException;

    /**
     * Discards any partially entered block.
     */
    void resetInput() throws InterpreterException;

    /**
     * @return whether {@link #evaluate(String)} is available.
     */
    boolean supportsWholeSource();

    /**
     * Evaluates a complete source buffer at once.
     */
    void evaluate(String source) throws InterpreterException;

    /**
     * Returns and clears everything written to standard output since the last call.
     */
    String drainOutput();

    /**
     * Returns and clears everything written to standard error since the last call.
     */
    String drainError();

    /**
     * Releases the interpreter. Safe to call more than once.
     */
    @Override
    void close();
}
