package org.circuitrepl.worker;

import com.typesafe.config.Config;
import org.circuitrepl.channel.StreamDuplexChannel;
import org.circuitrepl.config.ConfigLoader;
import org.circuitrepl.config.LoggingConfigurator;
import org.circuitrepl.protocol.EnvelopeCodec;
import org.circuitrepl.protocol.Request;
import org.circuitrepl.protocol.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.FileDescriptor;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.util.concurrent.Callable;

/**
 * Entry point of a runtime worker process.
 * <p>
 * Reads requests from standard input and writes responses to standard output. Logging goes to
 * standard error. A JVM shutdown hook releases the interpreter on SIGTERM or SIGINT.
 */
@Command(name = "worker",
        description = "Runs a runtime worker speaking the JSON line protocol on stdin/stdout.",
        mixinStandardHelpOptions = true)
public class WorkerMain implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);

    @Option(names = "--heap-size-bytes", description = "Interpreter heap budget in bytes.")
    private Long heapSizeBytes;

    @Option(names = "--random-seed", description = "Seed of the simulated sensor drift, 0 for a clock-based seed.")
    private Long randomSeed;

    public static void main(final String[] args) {
        System.exit(new CommandLine(new WorkerMain()).execute(args));
    }

    @Override
    public Integer call() {
        final Config config = ConfigLoader.load(null);
        LoggingConfigurator.configure(config);
        final WorkerSettings defaults = WorkerSettings.fromConfig(config);
        final WorkerSettings settings = new WorkerSettings(
                heapSizeBytes != null ? heapSizeBytes : defaults.heapSizeBytes(),
                defaults.jvmMaxHeap(),
                WorkerSettings.Launch.PROCESS,
                defaults.hardwareMonitoring(),
                randomSeed != null ? randomSeed : defaults.randomSeed());

        final EnvelopeCodec codec = new EnvelopeCodec();
        // Raw descriptors, so nothing written through System.out can interleave with frames.
        final StreamDuplexChannel<Response, Request> channel = new StreamDuplexChannel<>("controller",
                new FileInputStream(FileDescriptor.in),
                new FileOutputStream(FileDescriptor.out),
                codec::encode,
                codec::decodeRequest,
                null);
        System.setOut(System.err);

        final RuntimeWorker worker = RuntimeWorkers.create(channel, settings);
        Runtime.getRuntime().addShutdownHook(new Thread(worker::shutdown, "worker-shutdown"));
        log.info("Worker process ready, heap {} bytes", settings.heapSizeBytes());
        worker.run();
        return 0;
    }
}
