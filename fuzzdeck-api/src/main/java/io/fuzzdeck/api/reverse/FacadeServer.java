package io.fuzzdeck.api.reverse;

import io.fuzzdeck.api.engine.EngineEventSink;
import io.fuzzdeck.api.session.SessionToken;

/**
 * Boundary to the engine-side reverse server. Emits one JSON message per notification.
 */
public interface FacadeServer {

    void start(SessionToken token, FacadeServerParams params, EngineEventSink<String> sink);

    void cancel(SessionToken token);
}
