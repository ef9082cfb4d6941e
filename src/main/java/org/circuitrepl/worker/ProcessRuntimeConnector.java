package org.circuitrepl.worker;

import org.circuitrepl.channel.IDuplexChannel;
import org.circuitrepl.channel.IRuntimeConnector;
import org.circuitrepl.channel.StreamDuplexChannel;
import org.circuitrepl.protocol.EnvelopeCodec;
import org.circuitrepl.protocol.Request;
import org.circuitrepl.protocol.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Starts each runtime worker as a child JVM running {@link WorkerMain}. Requests go to the
 * child's standard input and responses come back on its standard output, one JSON object per
 * line. The child's standard error is inherited so its log output stays visible.
 */
public final class ProcessRuntimeConnector implements IRuntimeConnector {

    private static final Logger log = LoggerFactory.getLogger(ProcessRuntimeConnector.class);
    private static final long DESTROY_GRACE_MILLIS = 2000;

    private final WorkerSettings settings;
    private final EnvelopeCodec codec = new EnvelopeCodec();

    public ProcessRuntimeConnector(final WorkerSettings settings) {
        this.settings = settings;
    }

    @Override
    public IDuplexChannel<Request, Response> connect() throws IOException {
        final List<String> command = command();
        log.debug("Launching worker process: {}", command);
        final Process process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        log.info("Worker process {} started", process.pid());
        return new StreamDuplexChannel<>("worker-" + process.pid(),
                process.getInputStream(),
                process.getOutputStream(),
                codec::encode,
                codec::decodeResponse,
                () -> destroy(process));
    }

    List<String> command() {
        final String javaBin = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        final List<String> command = new ArrayList<>();
        command.add(javaBin);
        command.add("-Xmx" + settings.jvmMaxHeap());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(WorkerMain.class.getName());
        command.add("--heap-size-bytes=" + settings.heapSizeBytes());
        command.add("--random-seed=" + settings.randomSeed());
        return command;
    }

    private static void destroy(final Process process) {
        if (!process.isAlive()) {
            return;
        }
        // SIGTERM first so the worker's shutdown hook can release the interpreter.
        process.destroy();
        try {
            if (!process.waitFor(DESTROY_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                log.warn("Worker process {} did not exit, killing it", process.pid());
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }
}
