package io.fuzzdeck.api.session;

import java.time.Instant;

/**
 * Handle to one fuzzing run. Allows monitoring its state and requesting cancellation.
 */
public interface FuzzSession {

    /**
     * @return the token the engine uses to address this session's events
     */
    SessionToken token();

    /**
     * @return the current state of the session
     */
    SessionState state();

    /**
     * @return when the session was created
     */
    Instant createdAt();

    /**
     * Ask the engine to stop. Returns immediately; the engine's end event completes the session.
     */
    void cancel();

    default boolean isRunning() {
        return state() == SessionState.RUNNING;
    }
}
