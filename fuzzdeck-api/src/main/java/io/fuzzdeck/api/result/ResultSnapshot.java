package io.fuzzdeck.api.result;

import io.fuzzdeck.api.session.SessionToken;

import java.time.Instant;
import java.util.List;

/**
 * Immutable, ordered copy of every result a session has collected so far.
 * Published to observers at the flush cadence and once more when the session ends.
 */
public record ResultSnapshot(
        SessionToken token,
        List<ResultRecord> records,
        Instant publishedAt
) {

    public ResultSnapshot {
        records = List.copyOf(records);
    }

    /**
     * Snapshot with no session behind it, shown before the first run and after a clear.
     */
    public static ResultSnapshot empty() {
        return new ResultSnapshot(null, List.of(), Instant.now());
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
