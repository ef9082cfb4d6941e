package org.circuitrepl.worker;

import com.typesafe.config.Config;

import java.util.Locale;

/**
 * Worker settings read from the {@code circuitrepl.worker} block.
 *
 * @param heapSizeBytes      Heap budget handed to the interpreter.
 * @param jvmMaxHeap         {@code -Xmx} value for a worker child process.
 * @param launch             Whether the worker runs on a thread or in a child JVM.
 * @param hardwareMonitoring Default for the {@code enableHardwareMonitoring} execute flag.
 * @param randomSeed         Seed of the sensor drift; 0 seeds from the clock.
 */
public record WorkerSettings(long heapSizeBytes,
                             String jvmMaxHeap,
                             Launch launch,
                             boolean hardwareMonitoring,
                             long randomSeed) {

    public static final String PATH = "circuitrepl.worker";

    public enum Launch {
        IN_PROCESS,
        PROCESS
    }

    public static WorkerSettings fromConfig(final Config root) {
        final Config c = root.getConfig(PATH);
        return new WorkerSettings(
                c.getBytes("heap-size-bytes"),
                c.getString("jvm-max-heap"),
                Launch.valueOf(c.getString("launch").trim().toUpperCase(Locale.ROOT).replace('-', '_')),
                c.getBoolean("hardware-monitoring"),
                c.getLong("random-seed"));
    }

    public WorkerSettings withLaunch(final Launch newLaunch) {
        return new WorkerSettings(heapSizeBytes, jvmMaxHeap, newLaunch, hardwareMonitoring, randomSeed);
    }
}
