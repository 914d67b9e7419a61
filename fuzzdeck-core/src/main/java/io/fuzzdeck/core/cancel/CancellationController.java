package io.fuzzdeck.core.cancel;

import io.fuzzdeck.api.session.SessionState;
import io.fuzzdeck.api.session.SessionToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Tracks one session's run state and turns a cancel request into a single engine signal.
 * <p>
 * {@code IDLE -> RUNNING -> CANCELLING -> COMPLETED}, or {@code RUNNING -> COMPLETED} when
 * the engine finishes first. Cancelling never completes the session on its own; only the
 * engine's end event does, or the owner once it has released the session.
 * <p>
 * A cancel requested before the engine has accepted the session is held back and sent by
 * {@link #engineStarted()}, so the engine never sees a cancel for a session it does not know.
 */
public class CancellationController {

    private static final Logger log = LoggerFactory.getLogger(CancellationController.class);

    private final SessionToken token;
    private final Consumer<SessionToken> cancelSignal;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.IDLE);
    private final List<Consumer<SessionState>> listeners = new CopyOnWriteArrayList<>();
    private final Object signalLock = new Object();
    private boolean engineStarted;
    private boolean signalPending;

    /**
     * @param token        the session this controller guards
     * @param cancelSignal fire-and-forget cancel call into the engine
     */
    public CancellationController(SessionToken token, Consumer<SessionToken> cancelSignal) {
        this.token = token;
        this.cancelSignal = cancelSignal;
    }

    public void onStateChanged(Consumer<SessionState> listener) {
        listeners.add(listener);
    }

    /**
     * Mark the session as running.
     *
     * @return false if the session had already been started
     */
    public boolean begin() {
        if (state.compareAndSet(SessionState.IDLE, SessionState.RUNNING)) {
            fire(SessionState.RUNNING);
            return true;
        }
        return false;
    }

    /**
     * Request cancellation. Only the first call on a running session signals the engine.
     *
     * @return true if this call requested cancellation
     */
    public boolean cancel() {
        if (!state.compareAndSet(SessionState.RUNNING, SessionState.CANCELLING)) {
            log.debug("Ignoring cancel for session {} in state {}", token, state.get());
            return false;
        }
        fire(SessionState.CANCELLING);
        log.info("Cancelling session {}", token);
        synchronized (signalLock) {
            if (!engineStarted) {
                log.debug("Holding cancel for session {} until the engine accepts it", token);
                signalPending = true;
                return true;
            }
        }
        signalEngine();
        return true;
    }

    /**
     * Record that the engine accepted the session, sending any cancel requested meanwhile.
     *
     * @return true if a held-back cancel was sent
     */
    public boolean engineStarted() {
        synchronized (signalLock) {
            if (engineStarted) {
                return false;
            }
            engineStarted = true;
            if (!signalPending) {
                return false;
            }
            signalPending = false;
        }
        signalEngine();
        return true;
    }

    /**
     * Apply the engine's end event, or finish a session whose events are no longer received.
     *
     * @return true if the session moved to {@link SessionState#COMPLETED}
     */
    public boolean complete() {
        SessionState previous = state.get();
        while (previous.isActive()) {
            if (state.compareAndSet(previous, SessionState.COMPLETED)) {
                fire(SessionState.COMPLETED);
                return true;
            }
            previous = state.get();
        }
        return false;
    }

    public SessionState state() {
        return state.get();
    }

    public SessionToken token() {
        return token;
    }

    private void signalEngine() {
        try {
            cancelSignal.accept(token);
        } catch (RuntimeException e) {
            log.error("Engine failed to accept cancel for session {}", token, e);
        }
    }

    private void fire(SessionState newState) {
        for (Consumer<SessionState> listener : listeners) {
            try {
                listener.accept(newState);
            } catch (RuntimeException e) {
                log.error("State observer failed for session {}", token, e);
            }
        }
    }
}
