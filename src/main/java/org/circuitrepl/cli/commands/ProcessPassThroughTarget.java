package org.circuitrepl.cli.commands;

import org.circuitrepl.session.IPassThroughTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs an external terminal program and exchanges raw text with it.
 */
final class ProcessPassThroughTarget implements IPassThroughTarget {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessPassThroughTarget.class);

    private final Process process;
    private final OutputStream stdin;

    ProcessPassThroughTarget(final List<String> command) throws IOException {
        this.process = new ProcessBuilder(command).redirectErrorStream(true).start();
        this.stdin = process.getOutputStream();
        LOGGER.info("Pass-through process {} started: {}", process.pid(), command);
    }

    /**
     * Starts forwarding the process output.
     *
     * @param outputSink Receives output text with terminal line endings.
     * @param onExit     Runs once the process output ends.
     */
    void start(final Consumer<String> outputSink, final Runnable onExit) {
        final Thread pump = new Thread(() -> pump(outputSink, onExit), "pass-through-output");
        pump.setDaemon(true);
        pump.start();
    }

    @Override
    public void write(final String rawInput) {
        try {
            stdin.write(rawInput.getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        } catch (IOException e) {
            LOGGER.warn("Failed to write to pass-through process: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        process.destroy();
    }

    private void pump(final Consumer<String> outputSink, final Runnable onExit) {
        final char[] buffer = new char[1024];
        try (Reader reader = new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)) {
            int read;
            while ((read = reader.read(buffer)) >= 0) {
                outputSink.accept(new String(buffer, 0, read).replace("\n", "\r\n"));
            }
        } catch (IOException e) {
            LOGGER.debug("Pass-through output ended: {}", e.getMessage());
        }
        onExit.run();
    }
}
