package io.fuzzdeck.core.reverse;

import io.fuzzdeck.api.reverse.FacadeServer;
import io.fuzzdeck.api.reverse.FacadeServerParams;
import io.fuzzdeck.api.session.SessionStartException;
import io.fuzzdeck.api.session.SessionToken;
import io.fuzzdeck.core.session.SessionTokenRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Runs the reverse server through the engine and feeds its notifications into a
 * {@link ReverseNotificationFeed}.
 */
public class ReverseServerMonitor {

    private static final Logger log = LoggerFactory.getLogger(ReverseServerMonitor.class);

    private final FacadeServer server;
    private final ReverseNotificationFeed feed;
    private final Duration flushInterval;
    private final SessionTokenRegistry<String> registry = new SessionTokenRegistry<>();
    private final List<Consumer<String>> errorListeners = new CopyOnWriteArrayList<>();

    private SessionToken token;
    private boolean running;

    public ReverseServerMonitor(FacadeServer server) {
        this(server, new ReverseNotificationFeed(), ReverseNotificationFeed.DEFAULT_INTERVAL);
    }

    public ReverseServerMonitor(FacadeServer server, ReverseNotificationFeed feed, Duration flushInterval) {
        this.server = Objects.requireNonNull(server, "server");
        this.feed = Objects.requireNonNull(feed, "feed");
        this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval");
    }

    public void onError(Consumer<String> listener) {
        errorListeners.add(listener);
    }

    /**
     * Start the reverse server.
     *
     * @throws IllegalStateException if it is already running
     * @throws SessionStartException if the engine refuses to start it
     */
    public synchronized SessionToken start(FacadeServerParams params) {
        if (running) {
            throw new IllegalStateException("Reverse server is already running as " + token);
        }
        SessionToken started = registry.createSession();
        registry.subscribe(started,
                json -> feed.onMessage(json, Instant.now()),
                this::handleError,
                () -> handleEnd(started));
        token = started;
        running = true;
        feed.start(flushInterval);

        try {
            server.start(started, params, registry.sinkFor(started));
        } catch (RuntimeException e) {
            log.error("Engine rejected reverse server {}", started, e);
            release(started);
            throw new SessionStartException(started, e);
        }
        log.info("Reverse server started on {}:{} (bridge: {})",
                params.localFacadeHost(), params.localFacadePort(), params.usesBridge());
        return started;
    }

    /**
     * Ask the engine to stop the server. Its end event finishes the run.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping reverse server {}", token);
        try {
            server.cancel(token);
        } catch (RuntimeException e) {
            log.error("Engine failed to accept stop for reverse server {}", token, e);
        }
    }

    /**
     * Stop the server and release everything without waiting for the engine.
     */
    public synchronized void shutdown() {
        if (running) {
            stop();
            release(token);
        }
        registry.teardownAll();
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public ReverseNotificationFeed feed() {
        return feed;
    }

    private void handleError(String message) {
        log.warn("Reverse server error: {}", message);
        for (Consumer<String> listener : errorListeners) {
            try {
                listener.accept(message);
            } catch (RuntimeException e) {
                log.error("Reverse server error observer failed", e);
            }
        }
    }

    private synchronized void handleEnd(SessionToken ended) {
        feed.flush();
        release(ended);
        log.info("Reverse server {} ended", ended);
    }

    private void release(SessionToken released) {
        feed.stop();
        registry.teardown(released);
        if (released.equals(token)) {
            running = false;
        }
    }
}
