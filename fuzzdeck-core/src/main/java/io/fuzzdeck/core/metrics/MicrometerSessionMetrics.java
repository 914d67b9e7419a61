package io.fuzzdeck.core.metrics;

import io.fuzzdeck.api.metrics.SessionMetrics;
import io.fuzzdeck.api.result.ResultRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default session metrics using Micrometer.
 * Counts results per outcome, engine errors, publications and sessions,
 * and times responses per outcome.
 */
public class MicrometerSessionMetrics implements SessionMetrics {

    static final String OUTCOME_OK = "ok";
    static final String OUTCOME_FAILED = "failed";

    private final MeterRegistry registry;
    private final Map<String, Timer> responseTimers = new ConcurrentHashMap<>();
    private final Map<String, Counter> resultCounters = new ConcurrentHashMap<>();
    private final Counter engineErrors;
    private final Counter publications;
    private final DistributionSummary snapshotSizes;
    private final Counter sessionsStarted;
    private final Counter sessionsCancelled;

    public MicrometerSessionMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MicrometerSessionMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.engineErrors = Counter.builder("fuzzdeck.engine.errors").register(registry);
        this.publications = Counter.builder("fuzzdeck.snapshots.published").register(registry);
        this.snapshotSizes = DistributionSummary.builder("fuzzdeck.snapshot.size").register(registry);
        this.sessionsStarted = Counter.builder("fuzzdeck.sessions.started").register(registry);
        this.sessionsCancelled = Counter.builder("fuzzdeck.sessions.cancelled").register(registry);
    }

    @Override
    public void recordResult(ResultRecord record) {
        String outcome = record.ok() ? OUTCOME_OK : OUTCOME_FAILED;
        getResultCounter(outcome).increment();
        getTimer(outcome).record(Duration.ofMillis(record.durationMs()));
    }

    @Override
    public void recordEngineError() {
        engineErrors.increment();
    }

    @Override
    public void recordPublication(int size) {
        publications.increment();
        snapshotSizes.record(size);
    }

    @Override
    public void recordSessionStarted() {
        sessionsStarted.increment();
    }

    @Override
    public void recordSessionCancelled() {
        sessionsCancelled.increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    public long resultCount(boolean ok) {
        return (long) getResultCounter(ok ? OUTCOME_OK : OUTCOME_FAILED).count();
    }

    private Timer getTimer(String outcome) {
        return responseTimers.computeIfAbsent(outcome, name ->
                Timer.builder("fuzzdeck.response.time")
                        .tag("outcome", name)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(registry));
    }

    private Counter getResultCounter(String outcome) {
        return resultCounters.computeIfAbsent(outcome, name ->
                Counter.builder("fuzzdeck.results")
                        .tag("outcome", name)
                        .register(registry));
    }
}
