package io.fuzzdeck.api.engine;

import io.fuzzdeck.api.request.FuzzerRequest;
import io.fuzzdeck.api.result.ResultRecord;
import io.fuzzdeck.api.session.SessionToken;

/**
 * Boundary to the external process that mutates the request template and performs
 * the network I/O.
 * <p>
 * Both calls must return without waiting for the work they trigger.
 */
public interface FuzzerEngine {

    /**
     * Begin sending mutated requests.
     *
     * @param token   correlation token allocated by the controller
     * @param request template and dispatch parameters
     * @param sink    where the engine reports results, errors and the end of the run
     */
    void start(SessionToken token, FuzzerRequest request, EngineEventSink<ResultRecord> sink);

    /**
     * Advisory stop. The engine may keep emitting results and must still send its end event.
     */
    void cancel(SessionToken token);
}
