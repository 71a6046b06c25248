package io.github.drompincen.taskboard.engine.sync;

import io.github.drompincen.taskboard.engine.Subscription;
import io.github.drompincen.taskboard.engine.backend.BackendException;
import io.github.drompincen.taskboard.engine.backend.FailureKind;
import io.github.drompincen.taskboard.engine.backend.TaskBoardBackend;
import io.github.drompincen.taskboard.engine.schedule.BoardScheduler;
import io.github.drompincen.taskboard.engine.schedule.Cancellable;
import io.github.drompincen.taskboard.engine.store.MergeResult;
import io.github.drompincen.taskboard.engine.store.TaskStore;
import io.github.drompincen.taskboard.protocol.api.TaskDto;
import io.github.drompincen.taskboard.protocol.api.TaskFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Keeps the store in step with the backend by refetching the active scope on a fixed interval. There
 * is no push channel; this loop is the only way other sessions' changes reach the board.
 * <p>
 * At most one fetch is outstanding: a tick that finds one still running is skipped. Responses pass
 * through a {@link GenerationGate} before being merged, and the merge never overwrites a task that
 * has a move in flight.
 */
public class SyncPoller {

    private static final Logger log = LoggerFactory.getLogger(SyncPoller.class);

    private final TaskBoardBackend backend;
    private final TaskStore store;
    private final BoardScheduler scheduler;
    private final GenerationGate gate;
    private final Duration interval;
    private final Duration refreshDebounce;
    private final CopyOnWriteArrayList<Consumer<SyncStatus>> listeners = new CopyOnWriteArrayList<>();

    private TaskFilter filter;
    private boolean fetchInFlight;
    private boolean refetchWhenIdle;
    private int consecutiveFailures;
    private Instant lastSuccessAt;
    private Cancellable ticker;
    private Cancellable pendingRefresh;

    public SyncPoller(TaskBoardBackend backend, TaskStore store, BoardScheduler scheduler, TaskFilter filter,
                      Duration interval, Duration refreshDebounce) {
        this(backend, store, scheduler, new GenerationGate(), filter, interval, refreshDebounce);
    }

    public SyncPoller(TaskBoardBackend backend, TaskStore store, BoardScheduler scheduler, GenerationGate gate,
                      TaskFilter filter, Duration interval, Duration refreshDebounce) {
        this.backend = backend;
        this.store = store;
        this.scheduler = scheduler;
        this.gate = gate;
        this.filter = filter;
        this.interval = interval;
        this.refreshDebounce = refreshDebounce;
    }

    public void start() {
        if (ticker != null) {
            return;
        }
        log.info("Polling {} tasks every {} ms", filter.team(), interval.toMillis());
        ticker = scheduler.scheduleAtFixedRate(this::pollNow, Duration.ZERO, interval);
    }

    public void stop() {
        if (ticker != null) {
            ticker.cancel();
            ticker = null;
        }
        cancelPendingRefresh();
    }

    public boolean isRunning() {
        return ticker != null;
    }

    /**
     * One poll tick. Skipped, not queued, while the previous fetch is unresolved.
     */
    public void pollNow() {
        if (fetchInFlight) {
            log.debug("Poll tick skipped, generation {} still in flight", gate.issuedGeneration());
            return;
        }
        fetch();
    }

    /**
     * Switches the fetch scope. Pending debounced refetches are dropped and every fetch issued for the
     * old scope becomes stale. Moves already persisting are left alone.
     */
    public void changeScope(TaskFilter newFilter) {
        cancelPendingRefresh();
        boolean teamChanged = newFilter.team() != filter.team();
        log.debug("Scope change {} -> {}", filter, newFilter);
        filter = newFilter;
        gate.invalidateOutstanding();
        if (teamChanged) {
            store.retainInFlightOnly();
        }
        requestRefresh();
    }

    /**
     * Refetches the current scope after the debounce delay; a newer request restarts the delay.
     */
    public void requestRefresh() {
        cancelPendingRefresh();
        pendingRefresh = scheduler.schedule(this::refreshNow, refreshDebounce);
    }

    public TaskFilter filter() {
        return filter;
    }

    public SyncStatus status() {
        return new SyncStatus(gate.appliedGeneration(), consecutiveFailures, lastSuccessAt, null);
    }

    public Subscription subscribe(Consumer<SyncStatus> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void refreshNow() {
        pendingRefresh = null;
        if (fetchInFlight) {
            refetchWhenIdle = true;
            return;
        }
        fetch();
    }

    private void fetch() {
        long generation = gate.next();
        TaskFilter requested = filter;
        fetchInFlight = true;
        CompletableFuture<List<TaskDto>> call;
        try {
            call = backend.fetchTasks(requested);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        call.whenComplete((tasks, error) -> scheduler.execute(() -> onFetched(generation, tasks, error)));
    }

    private void onFetched(long generation, List<TaskDto> tasks, Throwable error) {
        fetchInFlight = false;
        if (error == null && tasks == null) {
            error = new BackendException(FailureKind.SERVER_REJECTION, "Poll " + generation + " returned no task list");
        }
        if (error != null) {
            BackendException failure = BackendException.from(error);
            consecutiveFailures++;
            log.warn("Poll {} failed ({} in a row): {} {}", generation, consecutiveFailures,
                    failure.getKind(), failure.getMessage());
            notifyListeners(new SyncStatus(gate.appliedGeneration(), consecutiveFailures, lastSuccessAt,
                    failure.getMessage()));
        } else if (!gate.tryApply(generation)) {
            log.debug("Discarding stale poll {} (applied {})", generation, gate.appliedGeneration());
        } else {
            consecutiveFailures = 0;
            lastSuccessAt = Instant.now();
            MergeResult result = store.merge(tasks);
            if (result.changed()) {
                log.debug("Poll {} merged: +{} ~{} -{} (kept {} in flight)", generation,
                        result.added(), result.updated(), result.removed(), result.preservedInFlight());
            }
            notifyListeners(status());
        }

        if (refetchWhenIdle) {
            refetchWhenIdle = false;
            fetch();
        }
    }

    private void cancelPendingRefresh() {
        if (pendingRefresh != null) {
            pendingRefresh.cancel();
            pendingRefresh = null;
        }
        refetchWhenIdle = false;
    }

    private void notifyListeners(SyncStatus status) {
        for (Consumer<SyncStatus> listener : listeners) {
            try {
                listener.accept(status);
            } catch (Exception e) {
                log.warn("Sync listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
