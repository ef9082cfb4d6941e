package org.circuitrepl.session;

import org.circuitrepl.junit.extensions.logging.LogWatchExtension;
import org.circuitrepl.protocol.CommandInterruptedException;
import org.circuitrepl.protocol.CommandTimeoutException;
import org.circuitrepl.testutils.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CorrelationTableTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private MutableClock clock;
    private CorrelationTable<String> table;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        table = new CorrelationTable<>(new CorrelationIdGenerator("test"), clock, TIMEOUT);
    }

    @Test
    @DisplayName("A resolved command completes with its response and leaves the table")
    void resolve_completesContinuation() throws Exception {
        // Arrange
        final PendingCommand<String> command = table.register(CommandKind.EXECUTE);

        // Act
        final boolean resolved = table.resolve(command.id(), "done");

        // Assert
        assertThat(resolved).isTrue();
        assertThat(command.continuation().get()).isEqualTo("done");
        assertThat(table.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("A response for an unknown id is discarded without side effects")
    void resolve_unmatchedIdIsNoOp() {
        final PendingCommand<String> command = table.register(CommandKind.EXECUTE);

        assertThat(table.resolve("test-unknown", "late")).isFalse();
        assertThat(table.resolve(null, "late")).isFalse();

        assertThat(table.size()).isEqualTo(1);
        assertThat(command.continuation()).isNotDone();
    }

    @Test
    @DisplayName("Commands past their deadline are rejected with a timeout")
    void sweepExpired_rejectsOnlyExpiredCommands() {
        // Arrange
        final PendingCommand<String> old = table.register(CommandKind.EXECUTE);
        clock.advance(Duration.ofSeconds(6));
        final PendingCommand<String> young = table.register(CommandKind.QUERY);

        // Act
        clock.advance(Duration.ofSeconds(5));
        final int expired = table.sweepExpired();

        // Assert
        assertThat(expired).isEqualTo(1);
        assertThat(old.continuation()).isCompletedExceptionally();
        assertThatThrownBy(() -> old.continuation().get())
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(CommandTimeoutException.class)
                .hasMessageContaining("Command timeout");
        assertThat(young.continuation()).isNotDone();
        assertThat(table.contains(young.id())).isTrue();
    }

    @Test
    @DisplayName("A deadline exactly at the sweep instant is not yet expired")
    void sweepExpired_deadlineIsExclusive() {
        final PendingCommand<String> command = table.register(CommandKind.EXECUTE);

        clock.advance(TIMEOUT);

        assertThat(table.sweepExpired()).isZero();
        assertThat(command.continuation()).isNotDone();
    }

    @Test
    @DisplayName("Sweeping an empty table does nothing")
    void sweepExpired_emptyTable() {
        clock.advance(Duration.ofDays(1));

        assertThat(table.sweepExpired()).isZero();
        assertThat(table.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("A timed out command ignores its late response")
    void resolveAfterTimeout_isDiscarded() {
        final PendingCommand<String> command = table.register(CommandKind.EXECUTE, Duration.ofMillis(100));
        clock.advance(Duration.ofSeconds(1));
        table.sweepExpired();

        assertThat(table.resolve(command.id(), "late")).isFalse();
        assertThat(command.continuation()).isCompletedExceptionally();
    }

    @Test
    @DisplayName("rejectAll empties the table and rejects every continuation")
    void rejectAll_clearsTable() {
        final PendingCommand<String> first = table.register(CommandKind.EXECUTE);
        final PendingCommand<String> second = table.register(CommandKind.HARDWARE);

        final int rejected = table.rejectAll(() -> new CommandInterruptedException("Interrupted"));

        assertThat(rejected).isEqualTo(2);
        assertThat(table.size()).isZero();
        assertThatThrownBy(() -> first.continuation().join())
                .hasCauseInstanceOf(CommandInterruptedException.class);
        assertThat(second.continuation()).isCompletedExceptionally();
    }

    @Test
    @DisplayName("Ids issued by one generator never collide")
    void register_issuesUniqueIds() {
        final Set<String> ids = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            ids.add(table.register(CommandKind.EXECUTE).id());
        }

        assertThat(ids).hasSize(10_000);
        assertThat(table.size()).isEqualTo(10_000);
    }

    @Test
    @DisplayName("Different generators produce different ids")
    void generators_doNotShareIds() {
        final CorrelationIdGenerator a = new CorrelationIdGenerator();
        final CorrelationIdGenerator b = new CorrelationIdGenerator();

        assertThat(a.next()).isNotEqualTo(b.next());
    }

    @Test
    @DisplayName("Racing resolve, reject and sweep complete each command exactly once")
    void concurrentCompletion_happensExactlyOnce() throws Exception {
        final int commands = 2_000;
        final PendingCommand<String>[] pending = registerMany(commands);
        clock.advance(TIMEOUT.plusSeconds(1));

        final AtomicInteger wins = new AtomicInteger();
        final CountDownLatch start = new CountDownLatch(1);
        final ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            pool.submit(() -> {
                start.await();
                for (PendingCommand<String> command : pending) {
                    if (table.resolve(command.id(), "ok")) {
                        wins.incrementAndGet();
                    }
                }
                return null;
            });
            pool.submit(() -> {
                start.await();
                for (int i = pending.length - 1; i >= 0; i--) {
                    if (table.reject(pending[i].id(), new CommandInterruptedException("Interrupted"))) {
                        wins.incrementAndGet();
                    }
                }
                return null;
            });
            pool.submit(() -> {
                start.await();
                wins.addAndGet(table.sweepExpired());
                return null;
            });
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(wins.get()).isEqualTo(commands);
        assertThat(table.isEmpty()).isTrue();
        for (PendingCommand<String> command : pending) {
            assertThat(command.continuation()).isDone();
        }
    }

    @SuppressWarnings("unchecked")
    private PendingCommand<String>[] registerMany(final int count) {
        final PendingCommand<String>[] commands = new PendingCommand[count];
        for (int i = 0; i < count; i++) {
            commands[i] = table.register(CommandKind.EXECUTE);
        }
        return commands;
    }
}
