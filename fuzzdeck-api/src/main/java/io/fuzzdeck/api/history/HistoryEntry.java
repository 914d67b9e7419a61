package io.fuzzdeck.api.history;

/**
 * A submitted request template and its position in the history.
 */
public record HistoryEntry(int position, String content) {

    public HistoryEntry {
        if (position < 0) {
            throw new IllegalArgumentException("Position must be non-negative");
        }
        if (content == null) {
            throw new IllegalArgumentException("Content must not be null");
        }
    }
}
