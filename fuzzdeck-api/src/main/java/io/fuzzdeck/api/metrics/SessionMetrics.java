package io.fuzzdeck.api.metrics;

import io.fuzzdeck.api.result.ResultRecord;

/**
 * Abstraction for session metrics.
 * Default implementation uses Micrometer.
 */
public interface SessionMetrics {

    /**
     * Record one result event as it arrives.
     */
    void recordResult(ResultRecord record);

    /**
     * Record a non-fatal engine error.
     */
    void recordEngineError();

    /**
     * Record one snapshot publication.
     *
     * @param size number of records in the published snapshot
     */
    void recordPublication(int size);

    void recordSessionStarted();

    void recordSessionCancelled();

    /**
     * Metrics that discard everything.
     */
    static SessionMetrics noop() {
        return new SessionMetrics() {
            @Override public void recordResult(ResultRecord record) {}
            @Override public void recordEngineError() {}
            @Override public void recordPublication(int size) {}
            @Override public void recordSessionStarted() {}
            @Override public void recordSessionCancelled() {}
        };
    }
}
