package org.circuitrepl.session;

import org.circuitrepl.protocol.Response;
import org.circuitrepl.testutils.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@Tag("unit")
class SessionTest {

    private Session session;

    @BeforeEach
    void setUp() {
        final CorrelationTable<Response> table =
                new CorrelationTable<>(new CorrelationIdGenerator(), new MutableClock(), Duration.ofSeconds(10));
        session = new Session("s1", SessionMode.SHELL, table, new CommandHistory(5));
    }

    @ParameterizedTest
    @CsvSource({
            "AWAITING_RUNTIME, IDLE, true",
            "AWAITING_RUNTIME, ERROR, true",
            "AWAITING_RUNTIME, EXECUTING, false",
            "IDLE, EXECUTING, true",
            "IDLE, AWAITING_RUNTIME, false",
            "EXECUTING, IDLE, true",
            "EXECUTING, ERROR, true",
            "ERROR, IDLE, true",
            "ERROR, EXECUTING, false"
    })
    void canTransitionTo_followsStateMachine(final SessionState from, final SessionState to, final boolean allowed) {
        assertThat(from.canTransitionTo(to)).isEqualTo(allowed);
    }

    @Test
    void transitionTo_rejectsIllegalMoves() {
        assertThat(session.state()).isEqualTo(SessionState.AWAITING_RUNTIME);

        assertThatThrownBy(() -> session.transitionTo(SessionState.EXECUTING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("AWAITING_RUNTIME -> EXECUTING");
    }

    @Test
    void forceIdle_onlyLeavesExecuting() {
        session.transitionTo(SessionState.IDLE);
        session.transitionTo(SessionState.EXECUTING);

        session.forceIdle();
        assertThat(session.state()).isEqualTo(SessionState.IDLE);

        session.transitionTo(SessionState.ERROR);
        session.forceIdle();
        assertThat(session.state()).isEqualTo(SessionState.ERROR);
    }

    @Test
    void selectTransport_canBeCalledOnce() {
        final Transport transport = new Transport.PassThrough(mock(IPassThroughTarget.class));

        session.selectTransport(transport);

        assertThat(session.hasTransport()).isTrue();
        assertThatThrownBy(() -> session.selectTransport(transport)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new Session(SessionMode.SHELL, session.pendingCommands(), new CommandHistory(1))
                .selectTransport(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void replaceInput_overwritesBuffer() {
        session.inputBuffer().append("abc");

        session.replaceInput("xy");

        assertThat(session.input()).isEqualTo("xy");
    }

    @Test
    void sessionMode_parsesHyphenatedNames() {
        assertThat(SessionMode.parse("device-repl")).isEqualTo(SessionMode.DEVICE_REPL);
        assertThat(SessionMode.parse(" Shell ")).isEqualTo(SessionMode.SHELL);
    }
}
