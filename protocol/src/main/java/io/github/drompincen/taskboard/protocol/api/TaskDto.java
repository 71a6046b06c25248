package io.github.drompincen.taskboard.protocol.api;

import java.time.Instant;
import java.time.LocalDate;

public record TaskDto(
        String taskId,
        String title,
        String description,
        Team team,
        String status,
        TaskPriority priority,
        String assigneeId,
        String clientId,
        LocalDate dueDate,
        Instant createdAt,
        String createdBy
) {
    public TaskDto withStatus(String newStatus) {
        return new TaskDto(taskId, title, description, team, newStatus, priority,
                assigneeId, clientId, dueDate, createdAt, createdBy);
    }
}
