package org.circuitrepl.worker.interpreter;

import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * {@link IInterpreter} backed by an embedded GraalPy context.
 * <p>
 * Interactive mode is a Python {@code code.InteractiveConsole} living inside the context, so
 * line continuation, expression echo and traceback printing behave like the stock REPL.
 * The console works on the {@code __main__} globals, the namespace whole-source evaluation
 * also runs in, so names defined in either mode are visible in the other.
 * A {@code sys.exit()} from user code closes the context. It is reported on the error stream
 * and the context is rebuilt.
 */
public final class GraalPythonInterpreter implements IInterpreter {

    private static final Logger log = LoggerFactory.getLogger(GraalPythonInterpreter.class);

    private static final String LANGUAGE = "python";
    private static final String CONSOLE_BOOTSTRAP = """
            import code as _code
            import __main__ as _main
            _console = _code.InteractiveConsole(locals=_main.__dict__)
            """;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private Context context;
    private Value console;
    private long heapSizeBytes;

    @Override
    public void initialize(final long heapSizeBytes) throws InterpreterException {
        this.heapSizeBytes = heapSizeBytes;
        close();
        try {
            context = Context.newBuilder(LANGUAGE)
                    .out(out)
                    .err(err)
                    .allowAllAccess(true)
                    .option("engine.WarnInterpreterOnly", "false")
                    .build();
            context.eval(LANGUAGE, CONSOLE_BOOTSTRAP);
            console = context.getBindings(LANGUAGE).getMember("_console");
            log.debug("GraalPy context ready (requested heap {} bytes)", heapSizeBytes);
        } catch (PolyglotException | IllegalArgumentException | IllegalStateException e) {
            close();
            throw new InterpreterException("Failed to start Python context: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean pushLine(final String line) throws InterpreterException {
        ensureStarted();
        try {
            return console.invokeMember("push", line).asBoolean();
        } catch (PolyglotException e) {
            handleGuestFailure(e);
            return false;
        }
    }

    @Override
    public void resetInput() throws InterpreterException {
        ensureStarted();
        try {
            console.invokeMember("resetbuffer");
        } catch (PolyglotException e) {
            throw new InterpreterException("Failed to reset input buffer: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean supportsWholeSource() {
        return true;
    }

    @Override
    public void evaluate(final String source) throws InterpreterException {
        ensureStarted();
        try {
            context.eval(Source.create(LANGUAGE, source));
        } catch (PolyglotException e) {
            handleGuestFailure(e);
        }
    }

    @Override
    public String drainOutput() {
        return drain(out);
    }

    @Override
    public String drainError() {
        return drain(err);
    }

    @Override
    public void close() {
        console = null;
        if (context != null) {
            try {
                context.close(true);
            } catch (PolyglotException | IllegalStateException e) {
                log.debug("Error while closing Python context: {}", e.getMessage());
            }
            context = null;
        }
    }

    private void handleGuestFailure(final PolyglotException e) throws InterpreterException {
        if (e.isExit()) {
            writeError("SystemExit: " + e.getExitStatus() + System.lineSeparator());
            log.info("User code exited the interpreter with status {}, restarting context", e.getExitStatus());
            initialize(heapSizeBytes);
        } else if (e.isGuestException() || e.isSyntaxError()) {
            writeError(e.getMessage() + System.lineSeparator());
        } else {
            throw new InterpreterException("Interpreter failure: " + e.getMessage(), e);
        }
    }

    private void writeError(final String text) {
        synchronized (err) {
            err.writeBytes(text.getBytes(StandardCharsets.UTF_8));
        }
    }

    private void ensureStarted() throws InterpreterException {
        if (context == null || console == null) {
            throw new InterpreterException("Python context is not started");
        }
    }

    private static String drain(final ByteArrayOutputStream stream) {
        synchronized (stream) {
            final String text = stream.toString(StandardCharsets.UTF_8);
            stream.reset();
            return text;
        }
    }
}
