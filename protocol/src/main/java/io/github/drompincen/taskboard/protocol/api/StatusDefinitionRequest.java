package io.github.drompincen.taskboard.protocol.api;

public record StatusDefinitionRequest(String code, String name, String color, Integer position) {}
