package io.github.drompincen.taskboard.engine.store;

import io.github.drompincen.taskboard.protocol.api.TaskDto;
import io.github.drompincen.taskboard.protocol.api.Team;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable view of the store at one version. Safe to hand to any thread.
 */
public record TaskStoreSnapshot(
        long version,
        List<TaskDto> tasks,
        Set<String> inFlightTaskIds
) {
    public static final TaskStoreSnapshot EMPTY = new TaskStoreSnapshot(0, List.of(), Set.of());

    public TaskStoreSnapshot {
        tasks = List.copyOf(tasks);
        inFlightTaskIds = Set.copyOf(inFlightTaskIds);
    }

    public Optional<TaskDto> find(String taskId) {
        return tasks.stream().filter(t -> t.taskId().equals(taskId)).findFirst();
    }

    public List<TaskDto> tasksForTeam(Team team) {
        return tasks.stream().filter(t -> t.team() == team).collect(Collectors.toList());
    }

    public boolean isInFlight(String taskId) {
        return inFlightTaskIds.contains(taskId);
    }
}
