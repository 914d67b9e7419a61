package io.fuzzdeck.core.reverse;

import io.fuzzdeck.api.engine.EngineEventSink;
import io.fuzzdeck.api.reverse.FacadeServer;
import io.fuzzdeck.api.reverse.FacadeServerParams;
import io.fuzzdeck.api.reverse.ReverseNotification;
import io.fuzzdeck.api.session.SessionStartException;
import io.fuzzdeck.api.session.SessionToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReverseServerMonitorTest {

    private final FakeFacadeServer server = new FakeFacadeServer();
    private final ReverseNotificationFeed feed = new ReverseNotificationFeed();
    private final ReverseServerMonitor monitor = new ReverseServerMonitor(server, feed, Duration.ofSeconds(10));

    @AfterEach
    void tearDown() {
        monitor.shutdown();
    }

    @Test
    void shouldFeedNotificationsFromServer() {
        SessionToken token = monitor.start(FacadeServerParams.defaults());

        server.sinks.get(token).result("{\"uuid\":\"u1\",\"type\":\"http\"}");
        server.sinks.get(token).result("{\"uuid\":\"u2\",\"type\":\"rmi\"}");

        assertThat(monitor.isRunning()).isTrue();
        assertThat(feed.current()).extracting(ReverseNotification::uuid).containsExactly("u2", "u1");
        assertThat(server.params).containsExactly(FacadeServerParams.defaults());
    }

    @Test
    void shouldRejectSecondStartWhileRunning() {
        monitor.start(FacadeServerParams.defaults());

        assertThatThrownBy(() -> monitor.start(FacadeServerParams.defaults()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldStopThroughEngineAndFinishOnEnd() {
        List<List<ReverseNotification>> published = new CopyOnWriteArrayList<>();
        feed.onChange(published::add);
        SessionToken token = monitor.start(FacadeServerParams.defaults());
        server.sinks.get(token).result("{\"uuid\":\"u1\"}");

        monitor.stop();
        assertThat(server.cancelled).containsExactly(token);
        assertThat(monitor.isRunning()).isTrue();

        server.sinks.get(token).end();

        assertThat(monitor.isRunning()).isFalse();
        assertThat(published).isNotEmpty();
        assertThat(published.get(published.size() - 1)).hasSize(1);
    }

    @Test
    void shouldRestartAfterEnd() {
        SessionToken first = monitor.start(FacadeServerParams.defaults());
        server.sinks.get(first).end();

        SessionToken second = monitor.start(FacadeServerParams.defaults());

        assertThat(second).isNotEqualTo(first);
        assertThat(monitor.isRunning()).isTrue();
    }

    @Test
    void shouldReleaseWhenServerRefusesToStart() {
        server.failOnStart = new IllegalStateException("port in use");

        assertThatThrownBy(() -> monitor.start(FacadeServerParams.defaults()))
                .isInstanceOf(SessionStartException.class);

        assertThat(monitor.isRunning()).isFalse();
    }

    @Test
    void shouldForwardServerErrors() {
        List<String> errors = new CopyOnWriteArrayList<>();
        monitor.onError(errors::add);
        SessionToken token = monitor.start(FacadeServerParams.defaults());

        server.sinks.get(token).error("bridge unreachable");

        assertThat(errors).containsExactly("bridge unreachable");
        assertThat(monitor.isRunning()).isTrue();
    }

    @Test
    void shouldIgnoreStopWhenNotRunning() {
        monitor.stop();

        assertThat(server.cancelled).isEmpty();
    }

    private static class FakeFacadeServer implements FacadeServer {

        final Map<SessionToken, EngineEventSink<String>> sinks = new ConcurrentHashMap<>();
        final List<FacadeServerParams> params = new CopyOnWriteArrayList<>();
        final List<SessionToken> cancelled = new CopyOnWriteArrayList<>();
        volatile RuntimeException failOnStart;

        @Override
        public void start(SessionToken token, FacadeServerParams params, EngineEventSink<String> sink) {
            if (failOnStart != null) {
                throw failOnStart;
            }
            this.params.add(params);
            sinks.put(token, sink);
        }

        @Override
        public void cancel(SessionToken token) {
            cancelled.add(token);
        }
    }
}
