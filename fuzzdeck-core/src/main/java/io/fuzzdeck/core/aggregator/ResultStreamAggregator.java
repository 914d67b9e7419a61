package io.fuzzdeck.core.aggregator;

import io.fuzzdeck.api.result.ResultRecord;
import io.fuzzdeck.api.result.ResultSnapshot;
import io.fuzzdeck.api.session.SessionToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Buffers one session's result events and republishes them at a bounded rate.
 * <p>
 * Results are appended in arrival order and never dropped, reordered or deduplicated.
 * A snapshot of the whole buffer is published on every tick of the flush timer that
 * follows new arrivals, and once more when the session ends. Bursts of hundreds of
 * results per second therefore reach observers as at most one publication per interval.
 * <p>
 * All buffer mutation and every publication happen under this object's monitor, so
 * observers see snapshots in order and snapshot sizes never decrease.
 */
public class ResultStreamAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultStreamAggregator.class);

    private final SessionToken token;
    private final Duration flushInterval;
    private final ThreadFactory threadFactory;
    private final List<ResultRecord> buffer = new ArrayList<>();
    private final List<Consumer<ResultSnapshot>> listeners = new CopyOnWriteArrayList<>();

    private ScheduledExecutorService scheduler;
    private ResultSnapshot lastPublished;
    private int publishedSize;
    private boolean completed;

    public ResultStreamAggregator(SessionToken token, Duration flushInterval) {
        this(token, flushInterval, null);
    }

    public ResultStreamAggregator(SessionToken token, Duration flushInterval, ThreadFactory threadFactory) {
        if (flushInterval == null || flushInterval.isZero() || flushInterval.isNegative()) {
            throw new IllegalArgumentException("Flush interval must be positive");
        }
        this.token = token;
        this.flushInterval = flushInterval;
        this.threadFactory = threadFactory != null ? threadFactory : r -> {
            Thread t = new Thread(r, "fuzzdeck-flush-" + token);
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Register an observer for published snapshots.
     */
    public void onSnapshot(Consumer<ResultSnapshot> listener) {
        listeners.add(listener);
    }

    /**
     * Append one result to the buffer.
     */
    public synchronized void onResultEvent(ResultRecord record) {
        if (completed) {
            log.debug("Ignoring result {} after session {} completed", record.uuid(), token);
            return;
        }
        buffer.add(record);
    }

    /**
     * Publish the buffer if anything arrived since the last publication.
     *
     * @return true if a snapshot was published
     */
    public synchronized boolean flush() {
        if (buffer.size() == publishedSize) {
            return false;
        }
        publish();
        return true;
    }

    /**
     * Start periodic flushing.
     */
    public synchronized void start() {
        if (completed) {
            throw new IllegalStateException("Session " + token + " has already completed");
        }
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory);
        scheduler.scheduleAtFixedRate(this::timerFlush,
                flushInterval.toMillis(), flushInterval.toMillis(), TimeUnit.MILLISECONDS);

        log.debug("Result flushing started for session {} with interval: {}ms", token, flushInterval.toMillis());
    }

    /**
     * Handle the end of the session: stop the timer and publish the final buffer.
     * The final publication happens even when nothing new arrived since the last flush.
     */
    public synchronized void complete() {
        if (completed) {
            return;
        }
        completed = true;
        stopTimer();
        if (!buffer.isEmpty()) {
            publish();
        }
        log.debug("Session {} aggregated {} results", token, buffer.size());
    }

    /**
     * Stop the timer without a final publication. Used when the session is abandoned.
     */
    public synchronized void stop() {
        stopTimer();
    }

    public synchronized int bufferedCount() {
        return buffer.size();
    }

    /**
     * @return the last snapshot handed to observers, or null before the first publication
     */
    public synchronized ResultSnapshot lastPublished() {
        return lastPublished;
    }

    public synchronized boolean isCompleted() {
        return completed;
    }

    public synchronized boolean isFlushing() {
        return scheduler != null;
    }

    public SessionToken token() {
        return token;
    }

    private synchronized void timerFlush() {
        if (scheduler == null) {
            return;
        }
        try {
            flush();
        } catch (Exception e) {
            log.error("Error publishing results for session {}", token, e);
        }
    }

    private void publish() {
        ResultSnapshot snapshot = new ResultSnapshot(token, buffer, Instant.now());
        lastPublished = snapshot;
        publishedSize = snapshot.size();
        for (Consumer<ResultSnapshot> listener : listeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                log.error("Snapshot observer failed for session {}", token, e);
            }
        }
    }

    private void stopTimer() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.debug("Result flushing stopped for session {}", token);
        }
    }
}
