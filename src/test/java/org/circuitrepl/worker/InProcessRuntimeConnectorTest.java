package org.circuitrepl.worker;

import org.circuitrepl.channel.IDuplexChannel;
import org.circuitrepl.hardware.IHardwareSimulation;
import org.circuitrepl.junit.extensions.logging.LogWatchExtension;
import org.circuitrepl.protocol.ChannelClosedException;
import org.circuitrepl.protocol.EnvelopeCodec;
import org.circuitrepl.protocol.ExecutePayload;
import org.circuitrepl.protocol.ExecutionMode;
import org.circuitrepl.protocol.Request;
import org.circuitrepl.protocol.RequestType;
import org.circuitrepl.protocol.Response;
import org.circuitrepl.testutils.ScriptedInterpreter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class InProcessRuntimeConnectorTest {

    private final EnvelopeCodec codec = new EnvelopeCodec();

    @Test
    @DisplayName("A connected worker sends init first and then answers requests in order")
    void connect_servesRequests() throws Exception {
        final InProcessRuntimeConnector connector = new InProcessRuntimeConnector(channel ->
                new RuntimeWorker(channel, new RuntimeInstance(ScriptedInterpreter::new, 1024L),
                        IHardwareSimulation.none(), System::currentTimeMillis));

        try (IDuplexChannel<Request, Response> channel = connector.connect()) {
            final Response init = take(channel);
            assertThat(init.id()).isEqualTo(Response.INIT_ID);
            assertThat(init.success()).isTrue();

            channel.send(new Request("a", RequestType.EXECUTE,
                    codec.toTree(new ExecutePayload("first", ExecutionMode.REPL, true)), 0));
            channel.send(new Request("b", RequestType.EXECUTE,
                    codec.toTree(new ExecutePayload("second", ExecutionMode.REPL, true)), 0));

            assertThat(take(channel).id()).isEqualTo("a");
            assertThat(take(channel).id()).isEqualTo("b");
        }
    }

    @Test
    @DisplayName("Closing the channel stops the worker and releases its interpreter")
    void close_stopsWorker() throws Exception {
        final AtomicReference<RuntimeWorker> created = new AtomicReference<>();
        final AtomicReference<RuntimeInstance> runtime = new AtomicReference<>();
        final InProcessRuntimeConnector connector = new InProcessRuntimeConnector(channel -> {
            runtime.set(new RuntimeInstance(ScriptedInterpreter::new, 1024L));
            final RuntimeWorker worker = new RuntimeWorker(channel, runtime.get(),
                    IHardwareSimulation.none(), System::currentTimeMillis);
            created.set(worker);
            return worker;
        });

        final IDuplexChannel<Request, Response> channel = connector.connect();
        take(channel);

        channel.close();

        await().atMost(5, TimeUnit.SECONDS).until(() -> !runtime.get().isInitialized());
        assertThat(created.get()).isNotNull();
        assertThatThrownBy(() -> channel.send(new Request("x", RequestType.RESET, codec.toTree(null), 0)))
                .isInstanceOf(ChannelClosedException.class);
    }

    private static Response take(final IDuplexChannel<Request, Response> channel) throws InterruptedException {
        final Optional<Response> response = channel.poll(5, TimeUnit.SECONDS);
        assertThat(response).as("response within 5s").isPresent();
        return response.get();
    }
}
