package org.circuitrepl.completion;

import java.util.List;
import java.util.Optional;

/**
 * Cycles through completion candidates on repeated Tab presses.
 * <p>
 * Each candidate replaces the trailing token of the input the cycle started from, so cycling
 * never accumulates earlier candidates. After {@code k} advances over {@code k} candidates the
 * first candidate is selected again.
 */
public final class CompletionCycle {

    private List<CompletionItem> candidates = List.of();
    private String baseInput = "";
    private int index = -1;

    /**
     * Starts a new cycle and selects the first candidate.
     *
     * @return the input with the first candidate applied, or empty if there are no candidates.
     */
    public Optional<String> start(final String input, final List<CompletionItem> items) {
        reset();
        if (items.isEmpty()) {
            return Optional.empty();
        }
        candidates = List.copyOf(items);
        baseInput = input;
        index = 0;
        return Optional.of(applied());
    }

    /**
     * Selects the next candidate, wrapping after the last.
     */
    public Optional<String> advance() {
        if (!isActive()) {
            return Optional.empty();
        }
        index = (index + 1) % candidates.size();
        return Optional.of(applied());
    }

    public boolean isActive() {
        return index >= 0;
    }

    public void reset() {
        candidates = List.of();
        baseInput = "";
        index = -1;
    }

    public Optional<CompletionItem> current() {
        return isActive() ? Optional.of(candidates.get(index)) : Optional.empty();
    }

    public int size() {
        return candidates.size();
    }

    private String applied() {
        return replaceTrailingToken(baseInput, candidates.get(index).insertText());
    }

    /**
     * Replaces the text after the last whitespace or dot with {@code replacement}.
     */
    public static String replaceTrailingToken(final String input, final String replacement) {
        final String token = CompletionService.trailingToken(input);
        return input.substring(0, input.length() - token.length()) + replacement;
    }
}
