package io.fuzzdeck.core.history;

import io.fuzzdeck.api.history.HistoryEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Ordered log of submitted request templates, unique by content, with a recall cursor.
 * <p>
 * Resubmitting a template moves it to the tail, so the most recently used templates
 * sit next to the cursor. The cursor only moves on {@link #submit} and on a successful
 * recall.
 */
public class RequestHistory {

    private final List<String> entries = new ArrayList<>();
    private int cursor = -1;

    /**
     * Append a template, removing an earlier copy of the same content first.
     *
     * @return the new cursor position (always the tail)
     */
    public synchronized int submit(String content) {
        if (content == null) {
            throw new IllegalArgumentException("Content must not be null");
        }
        entries.remove(content);
        entries.add(content);
        cursor = entries.size() - 1;
        return cursor;
    }

    public synchronized Optional<String> recallBackward() {
        if (cursor <= 0) {
            return Optional.empty();
        }
        cursor--;
        return Optional.of(entries.get(cursor));
    }

    public synchronized Optional<String> recallForward() {
        if (cursor < 0 || cursor >= entries.size() - 1) {
            return Optional.empty();
        }
        cursor++;
        return Optional.of(entries.get(cursor));
    }

    /**
     * Move the cursor straight to a position, as picked from {@link #list()}.
     */
    public synchronized Optional<String> recallAt(int position) {
        if (position < 0 || position >= entries.size()) {
            return Optional.empty();
        }
        cursor = position;
        return Optional.of(entries.get(cursor));
    }

    /**
     * @return a read-only copy of the history, oldest first
     */
    public synchronized List<HistoryEntry> list() {
        List<HistoryEntry> view = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            view.add(new HistoryEntry(i, entries.get(i)));
        }
        return List.copyOf(view);
    }

    public synchronized OptionalInt cursor() {
        return cursor < 0 ? OptionalInt.empty() : OptionalInt.of(cursor);
    }

    public synchronized Optional<String> current() {
        return cursor < 0 ? Optional.empty() : Optional.of(entries.get(cursor));
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }
}
