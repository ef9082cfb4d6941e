package org.circuitrepl.completion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CompletionCycleTest {

    private static final List<CompletionItem> ITEMS = List.of(
            CompletionItem.of("D0", "pin", ""),
            CompletionItem.of("D1", "pin", ""),
            CompletionItem.of("D2", "pin", ""));

    @Test
    @DisplayName("k advances over k candidates select the first candidate again")
    void advance_wrapsAroundAfterAllCandidates() {
        final CompletionCycle cycle = new CompletionCycle();

        assertThat(cycle.start("x = board.D", ITEMS)).contains("x = board.D0");
        assertThat(cycle.advance()).contains("x = board.D1");
        assertThat(cycle.advance()).contains("x = board.D2");
        assertThat(cycle.advance()).contains("x = board.D0");
        assertThat(cycle.current()).contains(ITEMS.get(0));
    }

    @Test
    @DisplayName("Candidates replace the trailing token instead of accumulating")
    void advance_neverAccumulates() {
        final CompletionCycle cycle = new CompletionCycle();
        cycle.start("import t", List.of(CompletionItem.of("time", "module", ""), CompletionItem.of("touchio", "module", "")));

        for (int i = 0; i < 5; i++) {
            assertThat(cycle.advance().orElseThrow()).matches("import (time|touchio)");
        }
    }

    @Test
    void start_withoutCandidatesIsInactive() {
        final CompletionCycle cycle = new CompletionCycle();

        assertThat(cycle.start("zz", List.of())).isEmpty();
        assertThat(cycle.isActive()).isFalse();
        assertThat(cycle.advance()).isEmpty();
    }

    @Test
    void reset_endsCycle() {
        final CompletionCycle cycle = new CompletionCycle();
        cycle.start("a", ITEMS);

        cycle.reset();

        assertThat(cycle.isActive()).isFalse();
        assertThat(cycle.size()).isZero();
    }
}
