package io.github.drompincen.taskboard.engine.backend;

public enum FailureKind {
    NETWORK_FAILURE,
    SERVER_REJECTION,
    NOT_FOUND
}
