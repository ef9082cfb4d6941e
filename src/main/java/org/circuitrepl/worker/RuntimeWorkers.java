package org.circuitrepl.worker;

import org.circuitrepl.channel.IDuplexChannel;
import org.circuitrepl.hardware.IRandomProvider;
import org.circuitrepl.hardware.PatternHardwareSimulation;
import org.circuitrepl.hardware.SeededRandomProvider;
import org.circuitrepl.protocol.Request;
import org.circuitrepl.protocol.Response;
import org.circuitrepl.worker.interpreter.GraalPythonInterpreter;

/**
 * Assembles runtime workers with the default interpreter and hardware simulation.
 */
public final class RuntimeWorkers {

    private RuntimeWorkers() {
    }

    public static RuntimeWorker create(final IDuplexChannel<Response, Request> channel, final WorkerSettings settings) {
        final IRandomProvider random = settings.randomSeed() == 0
                ? SeededRandomProvider.unseeded()
                : new SeededRandomProvider(settings.randomSeed());
        return new RuntimeWorker(channel,
                new RuntimeInstance(GraalPythonInterpreter::new, settings.heapSizeBytes()),
                new PatternHardwareSimulation(random.deriveFor("sensor", 0), System::currentTimeMillis),
                System::currentTimeMillis);
    }
}
