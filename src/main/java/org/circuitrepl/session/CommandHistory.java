package org.circuitrepl.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Bounded list of submitted lines with up/down navigation.
 * Consecutive duplicates are stored once; the oldest entry is dropped when full.
 */
public final class CommandHistory {

    private final int capacity;
    private final List<String> entries = new ArrayList<>();
    /** Navigation cursor; equals entries.size() when not navigating. */
    private int cursor;

    public CommandHistory(final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive");
        }
        this.capacity = capacity;
    }

    public void add(final String line) {
        if (line == null || line.isBlank()) {
            return;
        }
        if (entries.isEmpty() || !entries.get(entries.size() - 1).equals(line)) {
            entries.add(line);
            if (entries.size() > capacity) {
                entries.remove(0);
            }
        }
        cursor = entries.size();
    }

    /**
     * Moves to the previous entry.
     *
     * @return the entry, or empty if the history is empty.
     */
    public Optional<String> previous() {
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        if (cursor > 0) {
            cursor--;
        }
        return Optional.of(entries.get(cursor));
    }

    /**
     * Moves to the next entry. Moving past the newest entry yields an empty line.
     *
     * @return the entry, or empty if not navigating.
     */
    public Optional<String> next() {
        if (cursor >= entries.size()) {
            return Optional.empty();
        }
        cursor++;
        return Optional.of(cursor == entries.size() ? "" : entries.get(cursor));
    }

    public void resetNavigation() {
        cursor = entries.size();
    }

    public List<String> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }
}
