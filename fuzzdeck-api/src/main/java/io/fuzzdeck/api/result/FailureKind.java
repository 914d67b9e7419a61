package io.fuzzdeck.api.result;

/**
 * Coarse category of a failed request, used to pick a hint for the operator.
 */
public enum FailureKind {

    /**
     * The request succeeded.
     */
    NONE,

    /**
     * The connection or read timed out.
     */
    TIMEOUT,

    /**
     * The target host name could not be resolved.
     */
    DNS,

    OTHER;

    public static FailureKind classify(String reason) {
        if (reason == null || reason.isEmpty()) {
            return NONE;
        }
        if (reason.contains("tcp: i/o timeout")) {
            return TIMEOUT;
        }
        if (reason.contains("no such host")) {
            return DNS;
        }
        return OTHER;
    }
}
