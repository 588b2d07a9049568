package com.tessera.core.command;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Bounded list of submitted inputs, oldest first. Consecutive duplicates are
 * stored once.
 */
public class CommandHistory {

    private final int maxEntries;
    private final Deque<String> entries = new ArrayDeque<>();

    public CommandHistory(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    public synchronized void add(String input) {
        if (input == null || input.isBlank()) {
            return;
        }
        if (input.equals(entries.peekLast())) {
            return;
        }
        entries.addLast(input);
        while (entries.size() > maxEntries) {
            entries.removeFirst();
        }
    }

    public synchronized List<String> entries() {
        return List.copyOf(entries);
    }

    /** Most recent entries first. */
    public synchronized List<String> recent() {
        var list = new ArrayList<String>(entries.size());
        entries.descendingIterator().forEachRemaining(list::add);
        return list;
    }

    public synchronized List<String> search(String query) {
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
        return entries.stream()
                .filter(e -> e.toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }
}
