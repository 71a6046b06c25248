package io.github.drompincen.taskboard.engine.store;

import io.github.drompincen.taskboard.engine.Subscription;
import io.github.drompincen.taskboard.protocol.api.TaskDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Session cache of the tasks on screen, plus the set of tasks that are inside an uncommitted move.
 * <p>
 * Mutators must be called from the board timeline only. Every mutation publishes a new
 * {@link TaskStoreSnapshot} and notifies subscribers synchronously; {@link #snapshot()} may be read
 * from any thread.
 */
public class TaskStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);

    private final Map<String, TaskDto> tasks = new LinkedHashMap<>();
    private final Set<String> inFlight = new LinkedHashSet<>();
    private final CopyOnWriteArrayList<Consumer<TaskStoreSnapshot>> subscribers = new CopyOnWriteArrayList<>();
    private volatile TaskStoreSnapshot snapshot = TaskStoreSnapshot.EMPTY;

    public TaskStoreSnapshot snapshot() {
        return snapshot;
    }

    public Optional<TaskDto> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public boolean isInFlight(String taskId) {
        return inFlight.contains(taskId);
    }

    public void put(TaskDto task) {
        tasks.put(task.taskId(), task);
        publish();
    }

    /**
     * Sets the task's status ahead of remote confirmation and marks it in flight.
     *
     * @return the task as it was before the change, or empty if the store does not hold it
     */
    public Optional<TaskDto> applyOptimistic(String taskId, String newStatus) {
        TaskDto previous = tasks.get(taskId);
        if (previous == null) {
            return Optional.empty();
        }
        tasks.put(taskId, previous.withStatus(newStatus));
        inFlight.add(taskId);
        publish();
        return Optional.of(previous);
    }

    public void commit(String taskId) {
        if (inFlight.remove(taskId)) {
            publish();
        }
    }

    /**
     * Puts the status back to its pre-move value and clears the in-flight mark. Other fields are left as
     * they are now.
     *
     * @return false if the task is no longer in the store
     */
    public boolean rollback(String taskId, String previousStatus) {
        inFlight.remove(taskId);
        TaskDto current = tasks.get(taskId);
        if (current == null) {
            publish();
            return false;
        }
        tasks.put(taskId, current.withStatus(previousStatus));
        publish();
        return true;
    }

    public boolean remove(String taskId) {
        boolean removed = tasks.remove(taskId) != null;
        inFlight.remove(taskId);
        if (removed) {
            publish();
        }
        return removed;
    }

    /**
     * Folds a fetched task set into the store. Tasks in flight keep their local value whatever the
     * fetch says; every other task takes the fetched value, tasks new to the store are added, and
     * tasks missing from the fetch are dropped.
     */
    public MergeResult merge(List<TaskDto> fetched) {
        Map<String, TaskDto> next = new LinkedHashMap<>();
        int added = 0;
        int updated = 0;
        int preserved = 0;
        for (TaskDto incoming : fetched) {
            TaskDto local = tasks.get(incoming.taskId());
            if (local != null && inFlight.contains(incoming.taskId())) {
                next.put(local.taskId(), local);
                preserved++;
            } else {
                next.put(incoming.taskId(), incoming);
                if (local == null) {
                    added++;
                } else if (!local.equals(incoming)) {
                    updated++;
                }
            }
        }
        int removed = 0;
        for (TaskDto local : tasks.values()) {
            if (next.containsKey(local.taskId())) {
                continue;
            }
            if (inFlight.contains(local.taskId())) {
                next.put(local.taskId(), local);
                preserved++;
            } else {
                removed++;
            }
        }

        boolean reordered = !new ArrayList<>(next.keySet()).equals(new ArrayList<>(tasks.keySet()));
        MergeResult result = new MergeResult(added, updated, removed, preserved);
        if (result.changed() || reordered) {
            tasks.clear();
            tasks.putAll(next);
            publish();
        }
        return result;
    }

    /**
     * Drops every task that is not in flight. Used when the board switches scope; moves already
     * persisting still resolve against their task.
     */
    public void retainInFlightOnly() {
        if (tasks.keySet().retainAll(inFlight)) {
            publish();
        }
    }

    public Subscription subscribe(Consumer<TaskStoreSnapshot> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    private void publish() {
        TaskStoreSnapshot next = new TaskStoreSnapshot(snapshot.version() + 1,
                new ArrayList<>(tasks.values()), inFlight);
        snapshot = next;
        for (Consumer<TaskStoreSnapshot> subscriber : subscribers) {
            try {
                subscriber.accept(next);
            } catch (Exception e) {
                log.warn("Store subscriber failed on version {}: {}", next.version(), e.getMessage(), e);
            }
        }
    }
}
