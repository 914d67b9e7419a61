package io.fuzzdeck.core.session;

import io.fuzzdeck.api.session.FuzzSession;
import io.fuzzdeck.api.session.SessionState;
import io.fuzzdeck.api.session.SessionToken;
import io.fuzzdeck.core.cancel.CancellationController;

import java.time.Instant;

/**
 * Default session handle, backed by the session's cancellation controller.
 */
public class DefaultFuzzSession implements FuzzSession {

    private final SessionToken token;
    private final Instant createdAt;
    private final CancellationController cancellation;

    public DefaultFuzzSession(SessionToken token, Instant createdAt, CancellationController cancellation) {
        this.token = token;
        this.createdAt = createdAt;
        this.cancellation = cancellation;
    }

    @Override
    public SessionToken token() {
        return token;
    }

    @Override
    public SessionState state() {
        return cancellation.state();
    }

    @Override
    public Instant createdAt() {
        return createdAt;
    }

    @Override
    public void cancel() {
        cancellation.cancel();
    }

    public CancellationController cancellation() {
        return cancellation;
    }

    @Override
    public String toString() {
        return "FuzzSession[" + token + ", " + state() + "]";
    }
}
