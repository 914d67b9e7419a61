package io.fuzzdeck.api.session;

/**
 * Lifecycle of a fuzzing session.
 * <p>
 * {@code IDLE -> RUNNING -> (CANCELLING ->) COMPLETED}. Only the engine's end event
 * moves a session to {@link #COMPLETED}.
 */
public enum SessionState {
    IDLE,
    RUNNING,
    CANCELLING,
    COMPLETED;

    /**
     * @return true while the engine may still emit events for the session
     */
    public boolean isActive() {
        return this == RUNNING || this == CANCELLING;
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
