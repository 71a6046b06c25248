package io.github.drompincen.taskboard.engine.board;

public enum RejectionReason {
    CROSS_TEAM,
    PERMISSION_DENIED,
    TASK_NOT_FOUND,
    UNKNOWN_COLUMN
}
