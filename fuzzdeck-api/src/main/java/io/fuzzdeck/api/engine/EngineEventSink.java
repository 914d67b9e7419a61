package io.fuzzdeck.api.engine;

/**
 * Channel through which an engine reports the progress of one session.
 * <p>
 * An engine calls {@link #result} zero or more times, {@link #error} zero or more times
 * and {@link #end} exactly once. Calls after the session has been torn down are ignored.
 *
 * @param <E> the result event type
 */
public interface EngineEventSink<E> {

    /**
     * Deliver one result. Results are kept in the order this method is called.
     */
    void result(E event);

    /**
     * Report a non-fatal, user-visible error.
     */
    void error(String message);

    /**
     * Signal that the engine will emit nothing further for this session.
     */
    void end();
}
