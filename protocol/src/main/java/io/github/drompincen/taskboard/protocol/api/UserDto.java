package io.github.drompincen.taskboard.protocol.api;

import java.util.Set;

public record UserDto(
        String userId,
        String name,
        UserRole role,
        Team team,
        boolean active,
        Set<String> allowedStatuses
) {
    public UserDto {
        allowedStatuses = allowedStatuses == null ? Set.of() : Set.copyOf(allowedStatuses);
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
