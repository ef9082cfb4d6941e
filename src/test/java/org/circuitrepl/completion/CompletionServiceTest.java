package org.circuitrepl.completion;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CompletionServiceTest {

    private static CompletionService service;

    @BeforeAll
    static void loadRegistry() {
        service = new CompletionService(ModuleRegistry.loadDefault());
    }

    @Test
    @DisplayName("After 'import' all modules matching the prefix are offered")
    void complete_importOffersModules() {
        final List<CompletionItem> items = service.complete("import d", 0, 8);

        assertThat(items).extracting(CompletionItem::label).containsExactly("digitalio");
        assertThat(items.get(0).kind()).isEqualTo("module");
    }

    @Test
    @DisplayName("After 'board.' the pins of the default board are offered")
    void complete_boardOffersPins() {
        final List<CompletionItem> items = service.complete("led = board.A", 0, 13);

        assertThat(items).extracting(CompletionItem::label).containsExactly("A0", "A1", "A2");
        assertThat(items).allSatisfy(item -> assertThat(item.kind()).isEqualTo("pin"));
        assertThat(items.get(0).detail()).contains("analog");
    }

    @Test
    @DisplayName("After 'module.' the members of that module are offered")
    void complete_moduleMembers() {
        final List<CompletionItem> items = service.complete("time.", 0, 5);

        assertThat(items).extracting(CompletionItem::label).containsExactly("monotonic", "sleep", "time");
        assertThat(items).extracting(CompletionItem::kind).containsOnly("function");
    }

    @Test
    @DisplayName("Members of an unknown module yield nothing")
    void complete_unknownQualifier() {
        assertThat(service.complete("os.pa", 0, 5)).isEmpty();
    }

    @Test
    @DisplayName("Only the text before the cursor on the cursor line counts")
    void complete_usesCursorPosition() {
        final String document = "import board\ngc.co";

        assertThat(service.complete(document, 1, 5)).extracting(CompletionItem::label).containsExactly("collect");
        assertThat(service.complete(document, 1, 2)).extracting(CompletionItem::label).containsExactly("gc");
    }

    @Test
    @DisplayName("Exact-case matches rank before case-insensitive ones")
    void rank_prefersExactCase() {
        final List<CompletionItem> ranked = CompletionService.rank(List.of(
                CompletionItem.of("Delay", "function", ""),
                CompletionItem.of("digital", "module", ""),
                CompletionItem.of("display", "module", ""),
                CompletionItem.of("analog", "module", "")), "d");

        assertThat(ranked).extracting(CompletionItem::label).containsExactly("digital", "display", "Delay");
    }

    @Test
    void trailingToken_stopsAtWhitespaceAndDot() {
        assertThat(CompletionService.trailingToken("import dig")).isEqualTo("dig");
        assertThat(CompletionService.trailingToken("board.")).isEmpty();
        assertThat(CompletionService.trailingToken("x = time.mono")).isEqualTo("mono");
        assertThat(CompletionService.trailingToken("word")).isEqualTo("word");
    }
}
