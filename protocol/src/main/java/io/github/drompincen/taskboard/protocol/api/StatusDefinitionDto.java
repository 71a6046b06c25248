package io.github.drompincen.taskboard.protocol.api;

public record StatusDefinitionDto(
        String code,
        Team team,
        String name,
        String color,
        int position
) {}
