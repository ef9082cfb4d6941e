package org.circuitrepl.worker;

import com.typesafe.config.ConfigFactory;
import org.circuitrepl.config.ConfigLoader;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class WorkerSettingsTest {

    @Test
    void fromConfig_readsDefaults() {
        final WorkerSettings settings = WorkerSettings.fromConfig(ConfigLoader.defaults());

        assertThat(settings.heapSizeBytes()).isEqualTo(524_288L);
        assertThat(settings.jvmMaxHeap()).isEqualTo("512m");
        assertThat(settings.launch()).isEqualTo(WorkerSettings.Launch.IN_PROCESS);
        assertThat(settings.hardwareMonitoring()).isTrue();
        assertThat(settings.randomSeed()).isZero();
    }

    @Test
    void fromConfig_parsesLaunchAndByteSizes() {
        final WorkerSettings settings = WorkerSettings.fromConfig(ConfigFactory.parseString("""
                circuitrepl.worker {
                  heap-size-bytes = 1M
                  jvm-max-heap = "256m"
                  launch = "process"
                  hardware-monitoring = false
                  random-seed = 7
                }
                """));

        assertThat(settings.heapSizeBytes()).isEqualTo(1024L * 1024L);
        assertThat(settings.launch()).isEqualTo(WorkerSettings.Launch.PROCESS);
        assertThat(settings.hardwareMonitoring()).isFalse();
        assertThat(settings.randomSeed()).isEqualTo(7L);
    }

    @Test
    void processCommand_passesHeapAndSeedToWorkerMain() {
        final WorkerSettings settings = new WorkerSettings(2048L, "128m", WorkerSettings.Launch.PROCESS, true, 9L);

        final List<String> command = new ProcessRuntimeConnector(settings).command();

        assertThat(command.get(0)).endsWith("java");
        assertThat(command).contains("-Xmx128m", WorkerMain.class.getName(),
                "--heap-size-bytes=2048", "--random-seed=9");
        assertThat(command.indexOf(WorkerMain.class.getName())).isLessThan(command.indexOf("--heap-size-bytes=2048"));
    }
}
