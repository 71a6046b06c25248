package io.github.drompincen.taskboard.protocol.api;

public enum UserRole {
    ADMIN, MANAGER, EMPLOYEE
}
