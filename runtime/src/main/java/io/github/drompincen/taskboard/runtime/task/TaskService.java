package io.github.drompincen.taskboard.runtime.task;

import io.github.drompincen.taskboard.engine.board.PermissionGate;
import io.github.drompincen.taskboard.persistence.document.StatusDefinitionDocument;
import io.github.drompincen.taskboard.persistence.document.TaskDocument;
import io.github.drompincen.taskboard.persistence.repository.StatusDefinitionRepository;
import io.github.drompincen.taskboard.persistence.repository.TaskRepository;
import io.github.drompincen.taskboard.persistence.repository.UserRepository;
import io.github.drompincen.taskboard.protocol.api.CreateTaskRequest;
import io.github.drompincen.taskboard.protocol.api.TaskDto;
import io.github.drompincen.taskboard.protocol.api.TaskFilter;
import io.github.drompincen.taskboard.protocol.api.TaskPriority;
import io.github.drompincen.taskboard.protocol.api.Team;
import io.github.drompincen.taskboard.protocol.api.UserDto;
import io.github.drompincen.taskboard.runtime.user.UserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Authoritative task operations. Status updates are last-write-wins; the only checks are that the
 * task exists and the new status belongs to its team's vocabulary.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepository;
    private final StatusDefinitionRepository statusRepository;
    private final UserRepository userRepository;
    private final PermissionGate permissionGate;

    public TaskService(TaskRepository taskRepository, StatusDefinitionRepository statusRepository,
                       UserRepository userRepository, PermissionGate permissionGate) {
        this.taskRepository = taskRepository;
        this.statusRepository = statusRepository;
        this.userRepository = userRepository;
        this.permissionGate = permissionGate;
    }

    public List<TaskDto> search(TaskFilter filter) {
        return taskRepository.search(filter).stream().map(TaskService::toDto).toList();
    }

    public Optional<TaskDto> findById(String taskId) {
        return taskRepository.findById(taskId).map(TaskService::toDto);
    }

    public TaskDto create(Team team, CreateTaskRequest request) {
        if (request.title() == null || request.title().isBlank()) {
            throw new TaskRejectedException("Task title is required");
        }
        String status = request.status() != null ? request.status() : firstStatus(team);
        if (!statusRepository.existsByTeamAndCode(team, status)) {
            throw new TaskRejectedException("Status " + status + " is not defined for team " + team.code());
        }
        if (request.createdBy() != null) {
            Optional<UserDto> creator = userRepository.findById(request.createdBy()).map(UserService::toDto);
            if (creator.isPresent() && !permissionGate.canAct(creator.get(), status, team)) {
                throw new TaskRejectedException("User " + request.createdBy() + " cannot create tasks in " + status);
            }
        }
        if (request.assigneeId() != null) {
            UserDto assignee = userRepository.findById(request.assigneeId()).map(UserService::toDto)
                    .orElseThrow(() -> new TaskRejectedException("Unknown assignee " + request.assigneeId()));
            if (!permissionGate.canAssign(assignee, status, team)) {
                throw new TaskRejectedException("User " + assignee.userId() + " cannot be assigned to " + status);
            }
        }

        Instant now = Instant.now();
        TaskDocument doc = new TaskDocument();
        doc.setTaskId(UUID.randomUUID().toString());
        doc.setTeam(team);
        doc.setTitle(request.title().trim());
        doc.setDescription(request.description());
        doc.setStatus(status);
        doc.setPriority(request.priority() != null ? request.priority() : TaskPriority.MEDIUM);
        doc.setAssigneeId(request.assigneeId());
        doc.setClientId(request.clientId());
        doc.setDueDate(request.dueDate());
        doc.setCreatedBy(request.createdBy());
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        TaskDocument saved = taskRepository.save(doc);
        log.info("Created task {} in {}_{}", saved.getTaskId(), team.code(), status);
        return toDto(saved);
    }

    public TaskDto updateStatus(String taskId, String status) {
        TaskDocument doc = taskRepository.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        if (status == null || !statusRepository.existsByTeamAndCode(doc.getTeam(), status)) {
            throw new TaskRejectedException("Status " + status + " is not defined for team " + doc.getTeam().code());
        }
        if (status.equals(doc.getStatus())) {
            return toDto(doc);
        }
        log.debug("Task {} status {} -> {}", taskId, doc.getStatus(), status);
        doc.setStatus(status);
        doc.setUpdatedAt(Instant.now());
        return toDto(taskRepository.save(doc));
    }

    public void delete(String taskId) {
        if (!taskRepository.existsById(taskId)) {
            throw new TaskNotFoundException(taskId);
        }
        taskRepository.deleteById(taskId);
        log.info("Deleted task {}", taskId);
    }

    private String firstStatus(Team team) {
        return statusRepository.findByTeamOrderByPosition(team).stream()
                .findFirst()
                .map(StatusDefinitionDocument::getCode)
                .orElseThrow(() -> new TaskRejectedException("Team " + team.code() + " has no statuses"));
    }

    public static TaskDto toDto(TaskDocument doc) {
        return new TaskDto(doc.getTaskId(), doc.getTitle(), doc.getDescription(), doc.getTeam(), doc.getStatus(),
                doc.getPriority(), doc.getAssigneeId(), doc.getClientId(), doc.getDueDate(),
                doc.getCreatedAt(), doc.getCreatedBy());
    }
}
