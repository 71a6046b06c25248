package io.github.drompincen.taskboard.protocol.event;

public enum BoardEventType {
    VALIDATING,
    REJECTED,
    APPLIED,
    COMMITTED,
    ROLLED_BACK
}
