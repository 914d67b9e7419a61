package io.fuzzdeck.core.controller;

import io.fuzzdeck.api.controller.ControllerConfig;
import io.fuzzdeck.api.controller.FuzzerController;
import io.fuzzdeck.api.engine.FuzzerEngine;
import io.fuzzdeck.api.history.HistoryEntry;
import io.fuzzdeck.api.log.ResultLogWriter;
import io.fuzzdeck.api.metrics.SessionMetrics;
import io.fuzzdeck.api.request.FuzzerRequest;
import io.fuzzdeck.api.result.PartitionedResults;
import io.fuzzdeck.api.result.ResultRecord;
import io.fuzzdeck.api.result.ResultSnapshot;
import io.fuzzdeck.api.session.FuzzSession;
import io.fuzzdeck.api.session.SessionStartException;
import io.fuzzdeck.api.session.SessionState;
import io.fuzzdeck.api.session.SessionToken;
import io.fuzzdeck.core.aggregator.ResultStreamAggregator;
import io.fuzzdeck.core.cancel.CancellationController;
import io.fuzzdeck.core.history.RequestHistory;
import io.fuzzdeck.core.log.JsonResultLogWriter;
import io.fuzzdeck.core.metrics.MicrometerSessionMetrics;
import io.fuzzdeck.core.session.DefaultFuzzSession;
import io.fuzzdeck.core.session.SessionTokenRegistry;
import io.fuzzdeck.core.view.ResultViews;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Default fuzzer controller.
 * <p>
 * Each {@link #start} allocates a token, wires a {@link ResultStreamAggregator} and a
 * {@link CancellationController} to it through the {@link SessionTokenRegistry}, and hands
 * the engine a sink for that token. A live session is superseded, never run alongside:
 * its engine work is cancelled and its subscriptions and timer are released before the
 * new token is created. A released session reports {@link SessionState#COMPLETED}; if the
 * engine has not yet accepted it, the cancel is sent as soon as it does.
 * <p>
 * Observers are only told about the current session. Snapshots and state changes that
 * belong to a superseded token are discarded. Snapshot observers run on the publishing
 * thread while the session buffer is locked, so they should hand slow work elsewhere.
 */
public class DefaultFuzzerController implements FuzzerController {

    private static final Logger log = LoggerFactory.getLogger(DefaultFuzzerController.class);

    private final FuzzerEngine engine;
    private final ControllerConfig config;
    private final SessionMetrics metrics;
    private final ResultLogWriter resultLog;
    private final SessionTokenRegistry<ResultRecord> registry = new SessionTokenRegistry<>();
    private final RequestHistory history = new RequestHistory();

    private final List<Consumer<ResultSnapshot>> snapshotListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<List<HistoryEntry>>> historyListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<SessionState>> stateListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<String>> errorListeners = new CopyOnWriteArrayList<>();

    private volatile DefaultFuzzSession current;
    private volatile ResultSnapshot snapshot = ResultSnapshot.empty();
    private ResultStreamAggregator aggregator;
    private boolean shutdown;

    public DefaultFuzzerController(FuzzerEngine engine) {
        this(engine, ControllerConfig.create());
    }

    public DefaultFuzzerController(FuzzerEngine engine, ControllerConfig config) {
        this(engine, config, new MicrometerSessionMetrics());
    }

    public DefaultFuzzerController(FuzzerEngine engine, ControllerConfig config, SessionMetrics metrics) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.resultLog = config.resultLogEnabled() ? new JsonResultLogWriter(config.resultLogPath()) : null;
    }

    @Override
    public FuzzSession start(FuzzerRequest request) {
        Objects.requireNonNull(request, "request");
        DefaultFuzzSession session;
        ResultStreamAggregator sessionAggregator;

        synchronized (this) {
            ensureOpen();
            history.submit(request.template());
            fire(historyListeners, history.list());

            releaseCurrent();

            SessionToken token = registry.createSession();
            CancellationController cancellation = new CancellationController(token, engine::cancel);
            session = new DefaultFuzzSession(token, Instant.now(), cancellation);
            sessionAggregator = new ResultStreamAggregator(token, config.flushInterval(), config.threadFactory());

            cancellation.onStateChanged(state -> handleStateChange(token, state));
            sessionAggregator.onSnapshot(this::handleSnapshot);

            DefaultFuzzSession started = session;
            ResultStreamAggregator startedAggregator = sessionAggregator;
            registry.subscribe(token,
                    record -> handleResult(token, startedAggregator, record),
                    message -> handleError(token, message),
                    () -> handleEnd(started, startedAggregator));

            current = session;
            aggregator = sessionAggregator;
            replaceSnapshot(new ResultSnapshot(token, List.of(), Instant.now()));

            cancellation.begin();
            sessionAggregator.start();
            metrics.recordSessionStarted();
        }

        try {
            engine.start(session.token(), request, registry.sinkFor(session.token()));
        } catch (RuntimeException e) {
            log.error("Engine rejected session {}", session.token(), e);
            synchronized (this) {
                sessionAggregator.stop();
                registry.teardown(session.token());
                session.cancellation().complete();
            }
            throw new SessionStartException(session.token(), e);
        }
        session.cancellation().engineStarted();

        log.info("Started fuzzing session {}: concurrency {}, timeout {}s, https {}",
                session.token(), request.concurrency(), request.perRequestTimeoutSeconds(), request.https());
        return session;
    }

    @Override
    public void cancel() {
        DefaultFuzzSession session = current;
        if (session != null) {
            session.cancel();
        }
    }

    @Override
    public void clearResults() {
        DefaultFuzzSession session = current;
        replaceSnapshot(new ResultSnapshot(session == null ? null : session.token(), List.of(), Instant.now()));
    }

    @Override
    public Optional<FuzzSession> currentSession() {
        return Optional.ofNullable(current);
    }

    @Override
    public SessionState state() {
        DefaultFuzzSession session = current;
        return session == null ? SessionState.IDLE : session.state();
    }

    @Override
    public ResultSnapshot currentSnapshot() {
        return snapshot;
    }

    @Override
    public PartitionedResults view(String substring) {
        return ResultViews.partition(ResultViews.search(snapshot, substring));
    }

    @Override
    public List<HistoryEntry> historyList() {
        return history.list();
    }

    @Override
    public OptionalInt cursorPosition() {
        return history.cursor();
    }

    @Override
    public Optional<String> recallBackward() {
        return notifyIfMoved(history.recallBackward());
    }

    @Override
    public Optional<String> recallForward() {
        return notifyIfMoved(history.recallForward());
    }

    @Override
    public Optional<String> recallAt(int position) {
        return notifyIfMoved(history.recallAt(position));
    }

    @Override
    public void onSnapshot(Consumer<ResultSnapshot> listener) {
        snapshotListeners.add(listener);
    }

    @Override
    public void onHistoryChanged(Consumer<List<HistoryEntry>> listener) {
        historyListeners.add(listener);
    }

    @Override
    public void onStateChanged(Consumer<SessionState> listener) {
        stateListeners.add(listener);
    }

    @Override
    public void onEngineError(Consumer<String> listener) {
        errorListeners.add(listener);
    }

    @Override
    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        releaseCurrent();
        registry.teardownAll();
        if (resultLog != null) {
            resultLog.close();
        }
        log.info("Fuzzer controller shut down");
    }

    public synchronized boolean isShutdown() {
        return shutdown;
    }

    /**
     * Cancel the live session at the engine, release its timer and subscriptions and mark it
     * completed.
     */
    private void releaseCurrent() {
        DefaultFuzzSession previous = current;
        if (previous == null) {
            return;
        }
        if (previous.state().isActive()) {
            log.info("Superseding session {}", previous.token());
            previous.cancel();
        }
        if (aggregator != null) {
            aggregator.stop();
        }
        registry.teardown(previous.token());
        // its end event can no longer arrive
        previous.cancellation().complete();
    }

    private void handleResult(SessionToken token, ResultStreamAggregator sessionAggregator, ResultRecord record) {
        metrics.recordResult(record);
        if (resultLog != null) {
            resultLog.append(token, record);
        }
        sessionAggregator.onResultEvent(record);
    }

    private void handleError(SessionToken token, String message) {
        log.warn("Engine error in session {}: {}", token, message);
        metrics.recordEngineError();
        if (isCurrent(token)) {
            fire(errorListeners, message);
        }
    }

    private void handleEnd(DefaultFuzzSession session, ResultStreamAggregator sessionAggregator) {
        sessionAggregator.complete();
        session.cancellation().complete();
        log.info("Fuzzing session {} completed with {} results", session.token(), sessionAggregator.bufferedCount());
    }

    private void handleSnapshot(ResultSnapshot published) {
        if (!isCurrent(published.token())) {
            return;
        }
        metrics.recordPublication(published.size());
        replaceSnapshot(published);
    }

    private void handleStateChange(SessionToken token, SessionState state) {
        if (state == SessionState.CANCELLING) {
            metrics.recordSessionCancelled();
        }
        if (isCurrent(token)) {
            fire(stateListeners, state);
        }
    }

    private void replaceSnapshot(ResultSnapshot next) {
        snapshot = next;
        fire(snapshotListeners, next);
    }

    private Optional<String> notifyIfMoved(Optional<String> recalled) {
        if (recalled.isPresent()) {
            fire(historyListeners, history.list());
        }
        return recalled;
    }

    private boolean isCurrent(SessionToken token) {
        DefaultFuzzSession session = current;
        return session != null && session.token().equals(token);
    }

    private void ensureOpen() {
        if (shutdown) {
            throw new IllegalStateException("Fuzzer controller has been shut down");
        }
    }

    private <T> void fire(List<Consumer<T>> listeners, T value) {
        for (Consumer<T> listener : listeners) {
            try {
                listener.accept(value);
            } catch (RuntimeException e) {
                log.error("Observer failed", e);
            }
        }
    }
}
