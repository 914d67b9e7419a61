package io.fuzzdeck.core.session;

import io.fuzzdeck.api.engine.EngineEventSink;
import io.fuzzdeck.api.session.SessionToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Allocates session tokens and routes engine events to the handlers subscribed for them.
 * <p>
 * Each controller owns its own registry. The engine never sees the handlers: it gets a
 * per-token {@link EngineEventSink} that looks the subscription up on every call, so
 * events for a token that has been torn down are dropped.
 *
 * @param <E> the result event type
 */
public class SessionTokenRegistry<E> {

    private static final Logger log = LoggerFactory.getLogger(SessionTokenRegistry.class);

    private final Map<SessionToken, Subscription<E>> subscriptions = new ConcurrentHashMap<>();

    /**
     * @return a fresh token with no subscription yet
     */
    public SessionToken createSession() {
        SessionToken token = SessionToken.generate();
        log.debug("Allocated session token {}", token);
        return token;
    }

    /**
     * Register the three handlers for a token.
     *
     * @throws IllegalStateException if the token already has handlers
     */
    public void subscribe(SessionToken token, Consumer<E> onResult, Consumer<String> onError, Runnable onEnd) {
        Objects.requireNonNull(token, "token");
        var subscription = new Subscription<>(
                Objects.requireNonNull(onResult, "onResult"),
                Objects.requireNonNull(onError, "onError"),
                Objects.requireNonNull(onEnd, "onEnd"));
        if (subscriptions.putIfAbsent(token, subscription) != null) {
            throw new IllegalStateException("Session " + token + " is already subscribed");
        }
    }

    /**
     * Release all three handlers of a token. Safe to call repeatedly and for unknown tokens.
     *
     * @return true if handlers were released by this call
     */
    public boolean teardown(SessionToken token) {
        if (token == null) {
            return false;
        }
        boolean released = subscriptions.remove(token) != null;
        if (released) {
            log.debug("Released subscriptions for session {}", token);
        }
        return released;
    }

    /**
     * Release every subscription.
     */
    public void teardownAll() {
        subscriptions.keySet().forEach(this::teardown);
    }

    public boolean isSubscribed(SessionToken token) {
        return subscriptions.containsKey(token);
    }

    public int activeCount() {
        return subscriptions.size();
    }

    /**
     * The sink handed to the engine for one token.
     */
    public EngineEventSink<E> sinkFor(SessionToken token) {
        Objects.requireNonNull(token, "token");
        return new TokenSink(token);
    }

    private record Subscription<E>(Consumer<E> onResult, Consumer<String> onError, Runnable onEnd) {}

    private final class TokenSink implements EngineEventSink<E> {

        private final SessionToken token;

        private TokenSink(SessionToken token) {
            this.token = token;
        }

        @Override
        public void result(E event) {
            Subscription<E> subscription = subscriptions.get(token);
            if (subscription == null) {
                log.debug("Dropping result for released session {}", token);
                return;
            }
            try {
                subscription.onResult().accept(event);
            } catch (RuntimeException e) {
                log.error("Error handling result for session {}", token, e);
            }
        }

        @Override
        public void error(String message) {
            Subscription<E> subscription = subscriptions.get(token);
            if (subscription == null) {
                log.debug("Dropping error for released session {}: {}", token, message);
                return;
            }
            try {
                subscription.onError().accept(message);
            } catch (RuntimeException e) {
                log.error("Error handling engine error for session {}", token, e);
            }
        }

        @Override
        public void end() {
            // Removed before the handler runs so the end is delivered at most once.
            Subscription<E> subscription = subscriptions.remove(token);
            if (subscription == null) {
                log.debug("Dropping end for released session {}", token);
                return;
            }
            try {
                subscription.onEnd().run();
            } catch (RuntimeException e) {
                log.error("Error handling end of session {}", token, e);
            }
        }
    }
}
