package org.circuitrepl.session;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a submitted line is a CLI-style command or interpreter input.
 * <p>
 * Lines starting with {@code mu} or {@code .} are commands in every mode, and a bare
 * {@code mu} asks for help. In shell mode a line whose first word is a shell word is a
 * command too.
 */
public final class InputClassifier {

    static final String COMMAND_PREFIX = "mu ";
    static final String DOT_PREFIX = ".";
    static final Set<String> SHELL_WORDS = Set.of("help", "clear", "history", "status");

    private InputClassifier() {
    }

    public static Optional<CliCommand> classify(final String line, final SessionMode mode) {
        final String trimmed = line.trim();
        if (trimmed.startsWith(COMMAND_PREFIX) || trimmed.equals(COMMAND_PREFIX.trim())) {
            return parse(trimmed.substring(COMMAND_PREFIX.trim().length()));
        }
        if (trimmed.startsWith(DOT_PREFIX) && trimmed.length() > 1 && Character.isLetter(trimmed.charAt(1))) {
            return parse(trimmed.substring(DOT_PREFIX.length()));
        }
        if (mode == SessionMode.SHELL) {
            final String firstWord = trimmed.split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
            if (SHELL_WORDS.contains(firstWord)) {
                return parse(trimmed);
            }
        }
        return Optional.empty();
    }

    private static Optional<CliCommand> parse(final String text) {
        final String body = text.trim();
        if (body.isEmpty()) {
            return Optional.of(new CliCommand("help", List.of()));
        }
        final String[] words = body.split("\\s+");
        return Optional.of(new CliCommand(words[0].toLowerCase(Locale.ROOT),
                Arrays.asList(words).subList(1, words.length)));
    }
}
