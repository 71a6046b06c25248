package io.github.drompincen.taskboard.engine.backend;

import io.github.drompincen.taskboard.protocol.api.CreateTaskRequest;
import io.github.drompincen.taskboard.protocol.api.StatusDefinitionDto;
import io.github.drompincen.taskboard.protocol.api.TaskDto;
import io.github.drompincen.taskboard.protocol.api.TaskFilter;
import io.github.drompincen.taskboard.protocol.api.Team;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Authoritative store behind the board. Every call is asynchronous; failures complete the future
 * exceptionally with a {@link BackendException}.
 */
public interface TaskBoardBackend {

    CompletableFuture<List<TaskDto>> fetchTasks(TaskFilter filter);

    CompletableFuture<List<StatusDefinitionDto>> fetchStatusDefinitions(Team team);

    CompletableFuture<TaskDto> createTask(Team team, CreateTaskRequest request);

    CompletableFuture<TaskDto> updateTaskStatus(String taskId, String newStatus);

    CompletableFuture<Void> deleteTask(String taskId);
}
