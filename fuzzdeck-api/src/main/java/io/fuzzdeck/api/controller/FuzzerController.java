package io.fuzzdeck.api.controller;

import io.fuzzdeck.api.history.HistoryEntry;
import io.fuzzdeck.api.request.FuzzerRequest;
import io.fuzzdeck.api.result.PartitionedResults;
import io.fuzzdeck.api.result.ResultSnapshot;
import io.fuzzdeck.api.session.FuzzSession;
import io.fuzzdeck.api.session.SessionState;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Consumer;

/**
 * Drives interactive fuzzing sessions for one console view.
 * <p>
 * At most one session is live at a time. Results are batched and published as
 * {@link ResultSnapshot}s; submitted templates are kept in a navigable history.
 * <p>
 * Usage:
 * <pre>{@code
 * var controller = new DefaultFuzzerController(engine, ControllerConfig.create());
 * controller.onSnapshot(snapshot -> table.render(snapshot.records()));
 * controller.onStateChanged(state -> startButton.setEnabled(!state.isActive()));
 *
 * FuzzSession session = controller.start(FuzzerRequest.of(template).concurrency(50));
 * ...
 * controller.cancel();
 * }</pre>
 */
public interface FuzzerController {

    /**
     * Record the template in history and start a new session, superseding any live one.
     *
     * @param request the template and dispatch parameters
     * @return a handle to the new session
     * @throws io.fuzzdeck.api.session.SessionStartException if the engine refuses the session
     */
    FuzzSession start(FuzzerRequest request);

    /**
     * Request cancellation of the running session. No-op when nothing is running.
     */
    void cancel();

    /**
     * Drop all published results. Buffering of a running session continues.
     */
    void clearResults();

    /**
     * @return the session started last, if any
     */
    Optional<FuzzSession> currentSession();

    SessionState state();

    /**
     * @return the most recently published snapshot
     */
    ResultSnapshot currentSnapshot();

    /**
     * Search the current snapshot's response text and split the matches by outcome.
     *
     * @param substring case-sensitive search term; empty matches everything
     */
    PartitionedResults view(String substring);

    List<HistoryEntry> historyList();

    OptionalInt cursorPosition();

    Optional<String> recallBackward();

    Optional<String> recallForward();

    /**
     * Jump to a history position picked from {@link #historyList()}.
     */
    Optional<String> recallAt(int position);

    void onSnapshot(Consumer<ResultSnapshot> listener);

    void onHistoryChanged(Consumer<List<HistoryEntry>> listener);

    void onStateChanged(Consumer<SessionState> listener);

    void onEngineError(Consumer<String> listener);

    /**
     * Cancel any running session and release every subscription and timer.
     */
    void shutdown();
}
