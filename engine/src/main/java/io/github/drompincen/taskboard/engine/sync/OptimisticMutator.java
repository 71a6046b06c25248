package io.github.drompincen.taskboard.engine.sync;

import io.github.drompincen.taskboard.engine.Subscription;
import io.github.drompincen.taskboard.engine.backend.BackendException;
import io.github.drompincen.taskboard.engine.backend.FailureKind;
import io.github.drompincen.taskboard.engine.backend.TaskBoardBackend;
import io.github.drompincen.taskboard.engine.board.ColumnRef;
import io.github.drompincen.taskboard.engine.board.RejectionReason;
import io.github.drompincen.taskboard.engine.board.TransitionDecision;
import io.github.drompincen.taskboard.engine.board.TransitionValidator;
import io.github.drompincen.taskboard.engine.schedule.BoardScheduler;
import io.github.drompincen.taskboard.engine.store.TaskStore;
import io.github.drompincen.taskboard.protocol.api.TaskDto;
import io.github.drompincen.taskboard.protocol.api.UserDto;
import io.github.drompincen.taskboard.protocol.event.BoardEvent;
import io.github.drompincen.taskboard.protocol.event.BoardEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs move requests through validate, optimistic apply, persist, then commit or rollback.
 * <p>
 * Must be driven from the board timeline. Moves of one task are serialized: a request arriving
 * while the task's previous move is still persisting waits in a queue and is validated against the
 * state that move leaves behind. Moves of different tasks run independently.
 */
public class OptimisticMutator {

    private static final Logger log = LoggerFactory.getLogger(OptimisticMutator.class);

    private final TaskStore store;
    private final TaskBoardBackend backend;
    private final TransitionValidator validator;
    private final BoardScheduler scheduler;

    private final Map<String, InFlightMove> inFlight = new HashMap<>();
    private final Map<String, Deque<PendingMove>> queued = new HashMap<>();
    private final CopyOnWriteArrayList<Consumer<BoardEvent>> listeners = new CopyOnWriteArrayList<>();
    private long moveSequence;

    public OptimisticMutator(TaskStore store, TaskBoardBackend backend,
                             TransitionValidator validator, BoardScheduler scheduler) {
        this.store = store;
        this.backend = backend;
        this.validator = validator;
        this.scheduler = scheduler;
    }

    /**
     * Requests a move of {@code taskId} into the column {@code destColumnId}. Rejections and no-op moves
     * complete the returned future before this method returns; accepted moves complete it once the
     * backend has answered.
     */
    public CompletableFuture<MoveOutcome> requestMove(String taskId, String destColumnId, UserDto user) {
        CompletableFuture<MoveOutcome> outcome = new CompletableFuture<>();
        if (inFlight.containsKey(taskId)) {
            queued.computeIfAbsent(taskId, k -> new ArrayDeque<>())
                    .add(new PendingMove(destColumnId, user, outcome));
            log.debug("Move of task {} to {} queued behind move {}", taskId, destColumnId,
                    inFlight.get(taskId).moveId);
            return outcome;
        }
        process(taskId, destColumnId, user, outcome);
        return outcome;
    }

    public MoveState stateOf(String taskId) {
        InFlightMove move = inFlight.get(taskId);
        return move != null ? move.state : MoveState.IDLE;
    }

    public int queuedMoves(String taskId) {
        Deque<PendingMove> pending = queued.get(taskId);
        return pending != null ? pending.size() : 0;
    }

    /**
     * Deletes the task remotely and, once the backend confirms (or reports it already gone), removes it
     * locally and cancels whatever move is pending for it.
     */
    public CompletableFuture<Void> deleteTask(String taskId) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        call(() -> backend.deleteTask(taskId)).whenComplete((ignored, error) -> scheduler.execute(() -> {
            if (error == null) {
                taskDeleted(taskId);
                done.complete(null);
                return;
            }
            BackendException failure = BackendException.from(error);
            if (failure.getKind() == FailureKind.NOT_FOUND) {
                taskDeleted(taskId);
                done.complete(null);
            } else {
                log.warn("Delete of task {} failed: {} {}", taskId, failure.getKind(), failure.getMessage());
                done.completeExceptionally(failure);
            }
        }));
        return done;
    }

    /**
     * The task was deleted: drop it from the store and cancel its in-flight and queued moves. A late
     * answer to the cancelled persistence call is ignored.
     */
    public void taskDeleted(String taskId) {
        InFlightMove move = inFlight.remove(taskId);
        if (move != null) {
            log.debug("Cancelling move {} of deleted task {}", move.moveId, taskId);
            move.outcome.complete(MoveOutcome.cancelled(taskId, move.fromStatus, move.toStatus));
        }
        Deque<PendingMove> pending = queued.remove(taskId);
        if (pending != null) {
            for (PendingMove p : pending) {
                p.outcome.complete(MoveOutcome.cancelled(taskId, null, null));
            }
        }
        store.remove(taskId);
    }

    public Subscription subscribe(Consumer<BoardEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void process(String taskId, String destColumnId, UserDto user,
                         CompletableFuture<MoveOutcome> outcome) {
        Optional<TaskDto> task = store.get(taskId);
        Optional<ColumnRef> dest = ColumnRef.parse(destColumnId);
        String fromStatus = task.map(TaskDto::status).orElse(null);
        String toStatus = dest.map(ColumnRef::statusCode).orElse(null);
        emit(BoardEvent.of(BoardEventType.VALIDATING, taskId, fromStatus, toStatus));

        if (task.isEmpty()) {
            reject(taskId, fromStatus, toStatus, RejectionReason.TASK_NOT_FOUND, outcome);
            return;
        }
        if (dest.isEmpty()) {
            reject(taskId, fromStatus, toStatus, RejectionReason.UNKNOWN_COLUMN, outcome);
            return;
        }

        TransitionDecision decision = validator.validate(task.get(), dest.get(), user);
        if (decision.isRejected()) {
            reject(taskId, fromStatus, toStatus, decision.reason(), outcome);
            return;
        }
        if (decision.isNoChange()) {
            log.debug("Move of task {} to {} changes nothing", taskId, destColumnId);
            outcome.complete(MoveOutcome.noChange(taskId, fromStatus));
            return;
        }

        InFlightMove move = new InFlightMove(++moveSequence, taskId, fromStatus, decision.newStatus(), outcome);
        inFlight.put(taskId, move);
        store.applyOptimistic(taskId, move.toStatus);
        move.state = MoveState.OPTIMISTICALLY_APPLIED;
        emit(BoardEvent.of(BoardEventType.APPLIED, taskId, move.fromStatus, move.toStatus));

        move.state = MoveState.PERSISTING;
        log.debug("Persisting move {}: task {} {} -> {}", move.moveId, taskId, move.fromStatus, move.toStatus);
        call(() -> backend.updateTaskStatus(taskId, move.toStatus))
                .whenComplete((saved, error) -> scheduler.execute(() -> resolve(move, error)));
    }

    private void resolve(InFlightMove move, Throwable error) {
        if (inFlight.get(move.taskId) != move) {
            log.debug("Ignoring answer for cancelled move {} of task {}", move.moveId, move.taskId);
            return;
        }
        inFlight.remove(move.taskId);

        if (error == null) {
            move.state = MoveState.COMMITTED;
            store.commit(move.taskId);
            emit(BoardEvent.of(BoardEventType.COMMITTED, move.taskId, move.fromStatus, move.toStatus));
            move.outcome.complete(MoveOutcome.committed(move.taskId, move.fromStatus, move.toStatus));
        } else {
            BackendException failure = BackendException.from(error);
            move.state = MoveState.ROLLED_BACK;
            store.rollback(move.taskId, move.fromStatus);
            log.warn("Move {} of task {} to {} rolled back: {} {}", move.moveId, move.taskId, move.toStatus,
                    failure.getKind(), failure.getMessage());
            String reason = failure.getKind().name();
            emit(BoardEvent.withReason(BoardEventType.ROLLED_BACK, move.taskId, move.fromStatus, move.toStatus, reason));
            move.outcome.complete(MoveOutcome.rolledBack(move.taskId, move.fromStatus, move.toStatus, reason));
        }
        drainQueue(move.taskId);
    }

    private void drainQueue(String taskId) {
        Deque<PendingMove> pending = queued.get(taskId);
        while (pending != null && !pending.isEmpty() && !inFlight.containsKey(taskId)) {
            PendingMove next = pending.poll();
            process(taskId, next.destColumnId, next.user, next.outcome);
        }
        if (pending != null && pending.isEmpty()) {
            queued.remove(taskId);
        }
    }

    private void reject(String taskId, String fromStatus, String toStatus, RejectionReason reason,
                        CompletableFuture<MoveOutcome> outcome) {
        log.debug("Move of task {} to {} rejected: {}", taskId, toStatus, reason);
        emit(BoardEvent.withReason(BoardEventType.REJECTED, taskId, fromStatus, toStatus, reason.name()));
        outcome.complete(MoveOutcome.rejected(taskId, fromStatus, toStatus, reason.name()));
    }

    private void emit(BoardEvent event) {
        for (Consumer<BoardEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.warn("Board event listener threw on {} for task {}: {}",
                        event.type(), event.taskId(), e.getMessage(), e);
            }
        }
    }

    private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> invocation) {
        try {
            return invocation.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static final class InFlightMove {
        private final long moveId;
        private final String taskId;
        private final String fromStatus;
        private final String toStatus;
        private final CompletableFuture<MoveOutcome> outcome;
        private MoveState state = MoveState.VALIDATING;

        private InFlightMove(long moveId, String taskId, String fromStatus, String toStatus,
                             CompletableFuture<MoveOutcome> outcome) {
            this.moveId = moveId;
            this.taskId = taskId;
            this.fromStatus = fromStatus;
            this.toStatus = toStatus;
            this.outcome = outcome;
        }
    }

    private record PendingMove(String destColumnId, UserDto user, CompletableFuture<MoveOutcome> outcome) {}
}
