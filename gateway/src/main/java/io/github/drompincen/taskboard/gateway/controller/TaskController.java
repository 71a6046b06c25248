package io.github.drompincen.taskboard.gateway.controller;

import io.github.drompincen.taskboard.protocol.api.CreateTaskRequest;
import io.github.drompincen.taskboard.protocol.api.TaskDto;
import io.github.drompincen.taskboard.protocol.api.TaskFilter;
import io.github.drompincen.taskboard.protocol.api.TaskSortOrder;
import io.github.drompincen.taskboard.protocol.api.Team;
import io.github.drompincen.taskboard.protocol.api.UpdateTaskStatusRequest;
import io.github.drompincen.taskboard.runtime.task.TaskNotFoundException;
import io.github.drompincen.taskboard.runtime.task.TaskRejectedException;
import io.github.drompincen.taskboard.runtime.task.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @GetMapping("/teams/{team}/tasks")
    public ResponseEntity<List<TaskDto>> list(@PathVariable String team,
                                              @RequestParam(required = false) String clientId,
                                              @RequestParam(required = false) String assigneeId,
                                              @RequestParam(required = false) String q,
                                              @RequestParam(required = false) String sortBy) {
        Optional<Team> parsed = TeamPaths.parse(team);
        if (parsed.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        TaskSortOrder order;
        try {
            order = sortBy != null ? TaskSortOrder.valueOf(sortBy.toUpperCase()) : TaskSortOrder.NONE;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
        TaskFilter filter = new TaskFilter(parsed.get(), clientId, assigneeId, q, order);
        return ResponseEntity.ok(taskService.search(filter));
    }

    @PostMapping("/teams/{team}/tasks")
    public ResponseEntity<TaskDto> create(@PathVariable String team, @RequestBody CreateTaskRequest request) {
        Optional<Team> parsed = TeamPaths.parse(team);
        if (parsed.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(taskService.create(parsed.get(), request));
        } catch (TaskRejectedException e) {
            log.debug("Task creation in {} rejected: {}", team, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<TaskDto> get(@PathVariable String taskId) {
        return taskService.findById(taskId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/tasks/{taskId}/status")
    public ResponseEntity<TaskDto> updateStatus(@PathVariable String taskId,
                                                @RequestBody UpdateTaskStatusRequest request) {
        try {
            return ResponseEntity.ok(taskService.updateStatus(taskId, request.status()));
        } catch (TaskNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (TaskRejectedException e) {
            log.debug("Status update of task {} rejected: {}", taskId, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    @DeleteMapping("/tasks/{taskId}")
    public ResponseEntity<Void> delete(@PathVariable String taskId) {
        try {
            taskService.delete(taskId);
            return ResponseEntity.noContent().build();
        } catch (TaskNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }
}
