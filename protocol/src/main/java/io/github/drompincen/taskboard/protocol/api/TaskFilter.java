package io.github.drompincen.taskboard.protocol.api;

import java.util.Objects;

/**
 * Scope of a task fetch. Only {@code team} is mandatory; blank optional values are treated as absent.
 */
public record TaskFilter(
        Team team,
        String clientId,
        String assigneeId,
        String searchQuery,
        TaskSortOrder sortBy
) {
    public TaskFilter {
        Objects.requireNonNull(team, "team");
        clientId = blankToNull(clientId);
        assigneeId = blankToNull(assigneeId);
        searchQuery = searchQuery == null || searchQuery.isBlank() ? null : searchQuery.trim();
        sortBy = sortBy == null ? TaskSortOrder.NONE : sortBy;
    }

    public static TaskFilter forTeam(Team team) {
        return new TaskFilter(team, null, null, null, TaskSortOrder.NONE);
    }

    public TaskFilter withClientId(String value) {
        return new TaskFilter(team, value, assigneeId, searchQuery, sortBy);
    }

    public TaskFilter withAssigneeId(String value) {
        return new TaskFilter(team, clientId, value, searchQuery, sortBy);
    }

    public TaskFilter withSearchQuery(String value) {
        return new TaskFilter(team, clientId, assigneeId, value, sortBy);
    }

    public TaskFilter withSortBy(TaskSortOrder value) {
        return new TaskFilter(team, clientId, assigneeId, searchQuery, value);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
