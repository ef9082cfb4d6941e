package org.circuitrepl.session;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class PasteBufferTest {

    @Test
    void finish_returnsBufferedLines() {
        final PasteBuffer paste = new PasteBuffer();
        paste.enter();
        paste.append("def f():");
        paste.newLine();
        paste.append("    return 1");

        assertThat(paste.isActive()).isTrue();
        assertThat(paste.finish()).isEqualTo("def f():\n    return 1");
        assertThat(paste.isActive()).isFalse();
    }

    @Test
    void backspace_staysOnCurrentLine() {
        final PasteBuffer paste = new PasteBuffer();
        paste.enter();
        paste.append("a");
        paste.newLine();

        assertThat(paste.backspace()).isFalse();
        paste.append("bc");
        assertThat(paste.backspace()).isTrue();
        assertThat(paste.finish()).isEqualTo("a\nb");
    }

    @Test
    void cancel_discardsText() {
        final PasteBuffer paste = new PasteBuffer();
        paste.enter();
        paste.append("x");

        paste.cancel();
        paste.enter();

        assertThat(paste.finish()).isEmpty();
    }
}
