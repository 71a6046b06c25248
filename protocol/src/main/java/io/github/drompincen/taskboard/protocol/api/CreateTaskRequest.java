package io.github.drompincen.taskboard.protocol.api;

import java.time.LocalDate;

public record CreateTaskRequest(
        String title,
        String description,
        String status,
        TaskPriority priority,
        String assigneeId,
        String clientId,
        LocalDate dueDate,
        String createdBy
) {}
