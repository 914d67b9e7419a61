package io.fuzzdeck.api.session;

/**
 * Thrown when the engine refuses to start a session.
 * The session's subscriptions and timer have already been released when this is thrown.
 */
public class SessionStartException extends RuntimeException {

    private final SessionToken token;

    public SessionStartException(SessionToken token, Throwable cause) {
        super("Engine failed to start session " + token, cause);
        this.token = token;
    }

    public SessionToken token() {
        return token;
    }
}
