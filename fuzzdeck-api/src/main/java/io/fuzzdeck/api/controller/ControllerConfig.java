package io.fuzzdeck.api.controller;

import java.time.Duration;
import java.util.concurrent.ThreadFactory;

/**
 * Configuration for a fuzzer controller.
 * Controls the publication cadence, the scheduler threads and the optional result log.
 */
public final class ControllerConfig {

    private Duration flushInterval = Duration.ofSeconds(1);
    private ThreadFactory threadFactory = null;
    private String resultLogPath = null;

    private ControllerConfig() {}

    public static ControllerConfig create() {
        return new ControllerConfig();
    }

    /**
     * How often buffered results are republished while a session runs.
     */
    public ControllerConfig flushInterval(Duration flushInterval) {
        if (flushInterval == null || flushInterval.isZero() || flushInterval.isNegative()) {
            throw new IllegalArgumentException("Flush interval must be positive");
        }
        this.flushInterval = flushInterval;
        return this;
    }

    /**
     * Provide a custom thread factory for the flush timer, overriding the default daemon threads.
     */
    public ControllerConfig threadFactory(ThreadFactory threadFactory) {
        this.threadFactory = threadFactory;
        return this;
    }

    /**
     * Append every result to this JSON-lines file. Null disables the log.
     */
    public ControllerConfig resultLogPath(String resultLogPath) {
        this.resultLogPath = resultLogPath;
        return this;
    }

    public Duration flushInterval() { return flushInterval; }
    public ThreadFactory threadFactory() { return threadFactory; }
    public String resultLogPath() { return resultLogPath; }

    public boolean resultLogEnabled() {
        return resultLogPath != null && !resultLogPath.isBlank();
    }
}
