package io.github.drompincen.taskboard.protocol.api;

public enum TaskPriority {
    LOW, MEDIUM, HIGH
}
