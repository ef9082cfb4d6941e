package org.circuitrepl.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import org.circuitrepl.hardware.HardwareState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class EnvelopeCodecTest {

    private final EnvelopeCodec codec = new EnvelopeCodec();

    @Test
    @DisplayName("Requests use the snake_case wire names and a single line")
    void encodeRequest_usesWireNames() {
        final Request request = new Request("abc-1", RequestType.HARDWARE_QUERY,
                codec.toTree(new HardwareQueryPayload("full_state")), 1234L);

        final String line = codec.encode(request);

        assertThat(line).doesNotContain("\n");
        assertThat(line).contains("\"type\":\"hardware_query\"", "\"id\":\"abc-1\"", "\"queryType\":\"full_state\"");
    }

    @Test
    @DisplayName("Execute payloads carry the lower-case mode and the monitoring flag")
    void executePayload_wireFormat() {
        final JsonNode tree = codec.toTree(new ExecutePayload("print(1)", ExecutionMode.FILE, false));

        assertThat(tree.path("code").asText()).isEqualTo("print(1)");
        assertThat(tree.path("mode").asText()).isEqualTo("file");
        assertThat(tree.path("enableHardwareMonitoring").asBoolean(true)).isFalse();
    }

    @Test
    @DisplayName("Unknown request types decode to UNKNOWN instead of failing")
    void decodeRequest_unknownType() {
        final Request request = codec.decodeRequest("{\"id\":\"x\",\"type\":\"reboot\",\"payload\":{},\"timestamp\":1}");

        assertThat(request.type()).isEqualTo(RequestType.UNKNOWN);
        assertThat(request.id()).isEqualTo("x");
    }

    @Test
    @DisplayName("Failure responses omit absent fields")
    void encodeResponse_omitsNulls() {
        final String line = codec.encode(Response.failure("r", "boom", 3));

        assertThat(line).doesNotContain("result", "hardwareSnapshot");
        assertThat(codec.decodeResponse(line)).isEqualTo(Response.failure("r", "boom", 3));
    }

    @Test
    @DisplayName("A response with a hardware snapshot decodes to an equal response")
    void decodeResponse_withSnapshot() {
        final Response response = Response.success("r", codec.toTree(StatusResult.of("ready")), 7,
                HardwareState.withDefaults(99L).snapshot());

        final Response decoded = codec.decodeResponse(codec.encode(response));

        assertThat(decoded.hardwareSnapshot()).isEqualTo(response.hardwareSnapshot());
        assertThat(decoded.hardwareSnapshot().sensors().get("temp_sensor").isActive()).isTrue();
        assertThat(codec.fromTree(decoded.result(), StatusResult.class).status()).isEqualTo("ready");
    }

    @Test
    @DisplayName("Control signals use hyphenated type names")
    void controlSignal_wireFormat() {
        final String line = codec.encode(new ControlSignal("s-1", ControlSignalType.SOFT_RESTART, 5));

        assertThat(line).contains("\"type\":\"soft-restart\"");
        assertThat(codec.decodeControlSignal(line).type()).isEqualTo(ControlSignalType.SOFT_RESTART);
    }

    @Test
    @DisplayName("Malformed or empty frames raise ProtocolException")
    void decode_malformed() {
        assertThatThrownBy(() -> codec.decodeResponse("{not json"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageStartingWith("Malformed Response frame");
        assertThatThrownBy(() -> codec.decodeRequest("  "))
                .isInstanceOf(ProtocolException.class)
                .hasMessage("Empty frame");
    }

    @Test
    @DisplayName("A missing payload decodes as an empty object")
    void fromTree_nullIsEmptyObject() {
        final HardwareQueryPayload payload = codec.fromTree(null, HardwareQueryPayload.class);

        assertThat(payload.queryType()).isNull();
        assertThat(payload.effectiveQueryType()).isEqualTo(HardwareQueryPayload.FULL_STATE);
    }
}
