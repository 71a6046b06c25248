package io.github.drompincen.taskboard.client.session;

import io.github.drompincen.taskboard.engine.Subscription;
import io.github.drompincen.taskboard.engine.backend.BackendException;
import io.github.drompincen.taskboard.engine.backend.TaskBoardBackend;
import io.github.drompincen.taskboard.engine.board.BoardColumn;
import io.github.drompincen.taskboard.engine.board.ColumnProjector;
import io.github.drompincen.taskboard.engine.board.ColumnRef;
import io.github.drompincen.taskboard.engine.board.PermissionGate;
import io.github.drompincen.taskboard.engine.board.TransitionValidator;
import io.github.drompincen.taskboard.engine.schedule.BoardScheduler;
import io.github.drompincen.taskboard.engine.store.TaskStore;
import io.github.drompincen.taskboard.engine.store.TaskStoreSnapshot;
import io.github.drompincen.taskboard.engine.sync.MoveOutcome;
import io.github.drompincen.taskboard.engine.sync.OptimisticMutator;
import io.github.drompincen.taskboard.engine.sync.SyncPoller;
import io.github.drompincen.taskboard.engine.sync.SyncStatus;
import io.github.drompincen.taskboard.protocol.api.CreateTaskRequest;
import io.github.drompincen.taskboard.protocol.api.StatusDefinitionDto;
import io.github.drompincen.taskboard.protocol.api.TaskDto;
import io.github.drompincen.taskboard.protocol.api.TaskFilter;
import io.github.drompincen.taskboard.protocol.api.Team;
import io.github.drompincen.taskboard.protocol.api.UserDto;
import io.github.drompincen.taskboard.protocol.event.BoardEvent;
import io.github.drompincen.taskboard.protocol.event.BoardEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * One user's live board: the engine pieces wired together over a single {@link BoardScheduler}.
 * <p>
 * Public methods may be called from any thread; they hand their work to the scheduler. Column and
 * event listeners are called on the scheduler thread and must hop to their own thread (the Swing EDT,
 * for instance) before touching UI state.
 */
public class BoardSession {

    private static final Logger log = LoggerFactory.getLogger(BoardSession.class);

    private final TaskBoardBackend backend;
    private final BoardScheduler scheduler;
    private final UserDto user;
    private final Duration pollInterval;
    private final Duration refreshDebounce;

    private final TaskStore store = new TaskStore();
    private final PermissionGate permissionGate = new PermissionGate();
    private final ColumnProjector projector = new ColumnProjector();
    private final OptimisticMutator mutator;

    private final CopyOnWriteArrayList<Consumer<List<BoardColumn>>> columnListeners = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Consumer<SyncStatus>> syncListeners = new CopyOnWriteArrayList<>();
    private final List<Subscription> subscriptions = new ArrayList<>();

    private volatile TaskFilter filter;
    private volatile List<StatusDefinitionDto> statusDefinitions = List.of();
    private volatile List<BoardColumn> columns = List.of();
    private SyncPoller poller;
    private long vocabularyRequest;
    private boolean vocabularyLoaded;
    private boolean vocabularyLoading;

    public BoardSession(TaskBoardBackend backend, BoardScheduler scheduler, UserDto user,
                        Duration pollInterval, Duration refreshDebounce) {
        this.backend = backend;
        this.scheduler = scheduler;
        this.user = user;
        this.pollInterval = pollInterval;
        this.refreshDebounce = refreshDebounce;
        this.mutator = new OptimisticMutator(store, backend, new TransitionValidator(permissionGate), scheduler);
    }

    public void open(TaskFilter initialFilter) {
        scheduler.execute(() -> {
            if (poller != null) {
                log.warn("Board session for {} already open", user.userId());
                return;
            }
            filter = initialFilter;
            subscriptions.add(store.subscribe(snapshot -> reproject()));
            subscriptions.add(mutator.subscribe(this::afterMoveEvent));
            poller = new SyncPoller(backend, store, scheduler, initialFilter, pollInterval, refreshDebounce);
            subscriptions.add(poller.subscribe(this::notifySync));
            loadVocabulary(initialFilter.team());
            poller.start();
            log.info("Board session opened for {} on {}", user.userId(), initialFilter.team().code());
        });
    }

    /**
     * Switches the board to another team or filter. The status vocabulary is reloaded only when the
     * team changes.
     */
    public void changeScope(TaskFilter newFilter) {
        scheduler.execute(() -> {
            if (poller == null) {
                return;
            }
            Team previousTeam = filter.team();
            filter = newFilter;
            if (newFilter.team() != previousTeam) {
                statusDefinitions = List.of();
                vocabularyLoaded = false;
                loadVocabulary(newFilter.team());
            }
            poller.changeScope(newFilter);
            reproject();
        });
    }

    public CompletableFuture<MoveOutcome> requestMove(String taskId, String destColumnId) {
        CompletableFuture<MoveOutcome> result = new CompletableFuture<>();
        scheduler.execute(() -> forward(mutator.requestMove(taskId, destColumnId, user), result));
        return result;
    }

    public CompletableFuture<Void> deleteTask(String taskId) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        scheduler.execute(() -> forward(mutator.deleteTask(taskId), result));
        return result;
    }

    /**
     * Creates a task in the current team. The create rights are checked locally first; a refused
     * request never reaches the backend.
     */
    public CompletableFuture<TaskDto> createTask(CreateTaskRequest request) {
        CompletableFuture<TaskDto> result = new CompletableFuture<>();
        scheduler.execute(() -> {
            Team team = filter.team();
            String status = request.status() != null ? request.status() : firstStatusCode();
            if (status == null || !permissionGate.canAct(user, status, team)) {
                result.completeExceptionally(new IllegalStateException(
                        user.userId() + " cannot create tasks in " + team.code() + "_" + status));
                return;
            }
            CompletableFuture<TaskDto> call;
            try {
                call = backend.createTask(team, request);
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }
            call.whenComplete((created, error) -> scheduler.execute(() -> {
                if (error != null) {
                    BackendException failure = BackendException.from(error);
                    log.warn("Task creation in {} failed: {} {}", team.code(), failure.getKind(), failure.getMessage());
                    result.completeExceptionally(failure);
                    return;
                }
                addTask(created);
                result.complete(created);
            }));
        });
        return result;
    }

    /**
     * Adds a task created elsewhere (another dialog, an import) to the board without waiting for the
     * next poll.
     */
    public void addTask(TaskDto task) {
        scheduler.execute(() -> {
            if (filter == null || task.team() != filter.team()) {
                return;
            }
            store.put(task);
            if (poller != null) {
                poller.requestRefresh();
            }
        });
    }

    public boolean canCreateIn(String statusCode) {
        TaskFilter current = filter;
        return current != null && permissionGate.canAct(user, statusCode, current.team());
    }

    public boolean canMoveInto(String columnId) {
        return ColumnRef.parse(columnId)
                .map(ref -> permissionGate.canAct(user, ref.statusCode(), ref.team()))
                .orElse(false);
    }

    public List<BoardColumn> columns() {
        return columns;
    }

    public List<StatusDefinitionDto> statusDefinitions() {
        return statusDefinitions;
    }

    public TaskFilter filter() {
        return filter;
    }

    public UserDto user() {
        return user;
    }

    public TaskStoreSnapshot snapshot() {
        return store.snapshot();
    }

    /**
     * Called with the new columns whenever the projection differs from the previous one.
     */
    public Subscription subscribeColumns(Consumer<List<BoardColumn>> listener) {
        columnListeners.add(listener);
        return () -> columnListeners.remove(listener);
    }

    public Subscription subscribeEvents(Consumer<BoardEvent> listener) {
        return mutator.subscribe(listener);
    }

    public Subscription subscribeSync(Consumer<SyncStatus> listener) {
        syncListeners.add(listener);
        return () -> syncListeners.remove(listener);
    }

    public void close() {
        scheduler.execute(() -> {
            if (poller != null) {
                poller.stop();
            }
            subscriptions.forEach(Subscription::unsubscribe);
            subscriptions.clear();
            log.info("Board session closed for {}", user.userId());
        });
    }

    private void loadVocabulary(Team team) {
        long request = ++vocabularyRequest;
        vocabularyLoading = true;
        CompletableFuture<List<StatusDefinitionDto>> call;
        try {
            call = backend.fetchStatusDefinitions(team);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        call.whenComplete((defs, error) -> scheduler.execute(() -> {
            if (request != vocabularyRequest) {
                return;
            }
            vocabularyLoading = false;
            if (error != null) {
                BackendException failure = BackendException.from(error);
                log.warn("Loading {} statuses failed, retrying after the next poll: {} {}",
                        team.code(), failure.getKind(), failure.getMessage());
                return;
            }
            vocabularyLoaded = true;
            statusDefinitions = List.copyOf(defs);
            reproject();
        }));
    }

    private void reproject() {
        TaskFilter current = filter;
        if (current == null) {
            return;
        }
        Team team = current.team();
        List<BoardColumn> next = projector.project(statusDefinitions, store.snapshot().tasksForTeam(team),
                code -> permissionGate.canViewColumn(user, team, code));
        if (next.equals(columns)) {
            return;
        }
        columns = next;
        for (Consumer<List<BoardColumn>> listener : columnListeners) {
            try {
                listener.accept(next);
            } catch (Exception e) {
                log.warn("Column listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private void afterMoveEvent(BoardEvent event) {
        if (poller != null
                && (event.type() == BoardEventType.COMMITTED || event.type() == BoardEventType.ROLLED_BACK)) {
            poller.requestRefresh();
        }
    }

    // Every poll cycle, failed or not, retries a vocabulary load that never succeeded.
    private void notifySync(SyncStatus status) {
        if (!vocabularyLoaded && !vocabularyLoading && filter != null) {
            loadVocabulary(filter.team());
        }
        for (Consumer<SyncStatus> listener : syncListeners) {
            try {
                listener.accept(status);
            } catch (Exception e) {
                log.warn("Sync listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private String firstStatusCode() {
        return statusDefinitions.isEmpty() ? null : statusDefinitions.get(0).code();
    }

    private static <T> void forward(CompletableFuture<T> source, CompletableFuture<T> target) {
        source.whenComplete((value, error) -> {
            if (error != null) {
                target.completeExceptionally(error);
            } else {
                target.complete(value);
            }
        });
    }
}
