package io.fuzzdeck.core.metrics;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static io.fuzzdeck.core.ResultFixtures.failed;
import static io.fuzzdeck.core.ResultFixtures.ok;
import static org.assertj.core.api.Assertions.assertThat;

class MicrometerSessionMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerSessionMetrics metrics = new MicrometerSessionMetrics(registry);

    @Test
    void shouldCountResultsPerOutcome() {
        metrics.recordResult(ok("1"));
        metrics.recordResult(ok("2"));
        metrics.recordResult(failed("3"));

        assertThat(registry.find("fuzzdeck.results").tag("outcome", "ok").counter().count()).isEqualTo(2.0);
        assertThat(registry.find("fuzzdeck.results").tag("outcome", "failed").counter().count()).isEqualTo(1.0);
        assertThat(metrics.resultCount(true)).isEqualTo(2);
        assertThat(metrics.resultCount(false)).isEqualTo(1);
    }

    @Test
    void shouldTimeResponsesPerOutcome() {
        metrics.recordResult(ok("1"));
        metrics.recordResult(failed("2"));

        Timer okTimer = registry.find("fuzzdeck.response.time").tag("outcome", "ok").timer();
        Timer failedTimer = registry.find("fuzzdeck.response.time").tag("outcome", "failed").timer();

        assertThat(okTimer.count()).isEqualTo(1);
        assertThat(okTimer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(10.0);
        assertThat(failedTimer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(5000.0);
    }

    @Test
    void shouldTrackPublicationsAndSnapshotSizes() {
        metrics.recordPublication(3);
        metrics.recordPublication(7);

        assertThat(registry.find("fuzzdeck.snapshots.published").counter().count()).isEqualTo(2.0);
        assertThat(registry.find("fuzzdeck.snapshot.size").summary().max()).isEqualTo(7.0);
        assertThat(registry.find("fuzzdeck.snapshot.size").summary().totalAmount()).isEqualTo(10.0);
    }

    @Test
    void shouldCountSessionsAndErrors() {
        metrics.recordSessionStarted();
        metrics.recordSessionStarted();
        metrics.recordSessionCancelled();
        metrics.recordEngineError();

        assertThat(registry.find("fuzzdeck.sessions.started").counter().count()).isEqualTo(2.0);
        assertThat(registry.find("fuzzdeck.sessions.cancelled").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("fuzzdeck.engine.errors").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldReportZeroBeforeAnyResult() {
        assertThat(metrics.resultCount(true)).isZero();
        assertThat(metrics.resultCount(false)).isZero();
    }
}
