package org.circuitrepl.completion;

import org.circuitrepl.channel.IDuplexChannel;
import org.circuitrepl.protocol.ChannelClosedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Language side of tab completion.
 * <p>
 * The text before the cursor selects the candidate set: after {@code import} all modules,
 * after {@code board.} the pins of the current board, after {@code name.} the members of that
 * module, anywhere else the module names. Candidates matching the trailing token are ranked
 * first, then exact-case matches, then alphabetically.
 */
public final class CompletionService implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CompletionService.class);

    private static final Pattern QUALIFIER = Pattern.compile("(\\w+)\\.(\\w*)$");

    private final ModuleRegistry registry;
    private final IDuplexChannel<CompletionResponse, CompletionRequest> channel;

    public CompletionService(final ModuleRegistry registry) {
        this(registry, null);
    }

    public CompletionService(final ModuleRegistry registry,
                             final IDuplexChannel<CompletionResponse, CompletionRequest> channel) {
        this.registry = registry;
        this.channel = channel;
    }

    /**
     * Serves requests from the channel until it closes.
     */
    @Override
    public void run() {
        if (channel == null) {
            throw new IllegalStateException("CompletionService has no channel to serve");
        }
        try {
            while (true) {
                final CompletionRequest request = channel.take();
                CompletionResponse response;
                try {
                    response = CompletionResponse.of(request.id(),
                            complete(request.document(), request.line(), request.character()));
                } catch (RuntimeException e) {
                    log.warn("Completion request {} failed: {}", request.id(), e.getMessage());
                    response = CompletionResponse.failed(request.id(), e.getMessage());
                }
                channel.send(response);
            }
        } catch (ChannelClosedException e) {
            log.debug("Completion channel closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public List<CompletionItem> complete(final String document, final int line, final int character) {
        final String[] lines = document.split("\n", -1);
        final String currentLine = line >= 0 && line < lines.length ? lines[line] : "";
        final String beforeCursor = currentLine.substring(0, Math.max(0, Math.min(character, currentLine.length())));
        return rank(candidates(beforeCursor), trailingToken(beforeCursor));
    }

    private List<CompletionItem> candidates(final String beforeCursor) {
        if (beforeCursor.contains("import ")) {
            return registry.modules().stream()
                    .map(module -> CompletionItem.of(module.name(), "module", "import " + module.name()))
                    .toList();
        }
        if (beforeCursor.contains("board.")) {
            return registry.board(ModuleRegistry.DEFAULT_BOARD)
                    .map(board -> board.pins().stream()
                            .map(pin -> CompletionItem.of(pin.name(), "pin",
                                    "Pin: " + String.join(", ", pin.capabilities())))
                            .toList())
                    .orElse(List.of());
        }
        final Matcher qualifier = QUALIFIER.matcher(beforeCursor);
        if (qualifier.find()) {
            return registry.module(qualifier.group(1))
                    .map(module -> module.members().stream()
                            .map(member -> CompletionItem.of(member.name(),
                                    "function".equals(member.kind()) ? "function" : member.kind(),
                                    member.description()))
                            .toList())
                    .orElse(List.of());
        }
        return registry.modules().stream()
                .map(module -> CompletionItem.of(module.name(), "module", module.description()))
                .toList();
    }

    /**
     * Keeps the candidates whose label starts with {@code prefix}, ignoring case, and orders them.
     */
    static List<CompletionItem> rank(final List<CompletionItem> candidates, final String prefix) {
        final String lowerPrefix = prefix.toLowerCase(Locale.ROOT);
        return candidates.stream()
                .filter(item -> item.label().toLowerCase(Locale.ROOT).startsWith(lowerPrefix))
                .sorted(Comparator
                        .comparing((CompletionItem item) -> !item.label().startsWith(prefix))
                        .thenComparing(CompletionItem::label, String.CASE_INSENSITIVE_ORDER)
                        .thenComparing(CompletionItem::label))
                .toList();
    }

    /**
     * The text after the last whitespace or dot.
     */
    public static String trailingToken(final String text) {
        int start = text.length();
        while (start > 0) {
            final char c = text.charAt(start - 1);
            if (Character.isWhitespace(c) || c == '.') {
                break;
            }
            start--;
        }
        return text.substring(start);
    }
}
