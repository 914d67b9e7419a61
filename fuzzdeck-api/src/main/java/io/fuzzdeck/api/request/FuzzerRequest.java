package io.fuzzdeck.api.request;

import java.time.Duration;

/**
 * A request template plus the parameters the engine dispatches it with.
 */
public final class FuzzerRequest {

    public static final String DEFAULT_TEMPLATE = "POST / HTTP/1.1\n"
            + "Content-Type: application/json\n"
            + "Host: www.example.com\n"
            + "\n"
            + "{\"key\": \"value\"}";

    private String template = DEFAULT_TEMPLATE;
    private int concurrency = 20;
    private Duration perRequestTimeout = Duration.ofSeconds(5);
    private boolean forceFuzz = true;
    private boolean https = false;
    private String proxy = "";
    private String overrideHost = "";

    private FuzzerRequest() {}

    public static FuzzerRequest create() {
        return new FuzzerRequest();
    }

    public static FuzzerRequest of(String template) {
        return create().template(template);
    }

    public FuzzerRequest template(String template) {
        if (template == null) {
            throw new IllegalArgumentException("Template must not be null");
        }
        this.template = template;
        return this;
    }

    public FuzzerRequest concurrency(int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("Concurrency must be positive");
        }
        this.concurrency = concurrency;
        return this;
    }

    public FuzzerRequest perRequestTimeout(Duration perRequestTimeout) {
        if (perRequestTimeout == null || perRequestTimeout.isZero() || perRequestTimeout.isNegative()) {
            throw new IllegalArgumentException("Per-request timeout must be positive");
        }
        this.perRequestTimeout = perRequestTimeout;
        return this;
    }

    /**
     * Fuzz the template even when it carries no fuzz tags.
     */
    public FuzzerRequest forceFuzz(boolean forceFuzz) {
        this.forceFuzz = forceFuzz;
        return this;
    }

    public FuzzerRequest https(boolean https) {
        this.https = https;
        return this;
    }

    /**
     * Comma-separated proxy list; empty for a direct connection.
     */
    public FuzzerRequest proxy(String proxy) {
        this.proxy = proxy == null ? "" : proxy.trim();
        return this;
    }

    /**
     * Connect to this address instead of the template's Host header; empty to disable.
     */
    public FuzzerRequest overrideHost(String overrideHost) {
        this.overrideHost = overrideHost == null ? "" : overrideHost.trim();
        return this;
    }

    public String template() { return template; }
    public int concurrency() { return concurrency; }
    public Duration perRequestTimeout() { return perRequestTimeout; }
    public boolean forceFuzz() { return forceFuzz; }
    public boolean https() { return https; }
    public String proxy() { return proxy; }
    public String overrideHost() { return overrideHost; }

    /**
     * Timeout as the fractional seconds the engine expects.
     */
    public double perRequestTimeoutSeconds() {
        return perRequestTimeout.getSeconds() + perRequestTimeout.getNano() / 1_000_000_000.0;
    }
}
