package io.github.drompincen.taskboard.engine.sync;

public enum MoveState {
    IDLE,
    VALIDATING,
    OPTIMISTICALLY_APPLIED,
    PERSISTING,
    COMMITTED,
    ROLLED_BACK
}
