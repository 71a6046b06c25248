package io.github.drompincen.taskboard.protocol.api;

public record UpdateTaskStatusRequest(String status) {}
