package io.github.drompincen.taskboard.engine.board;

import io.github.drompincen.taskboard.protocol.api.TaskDto;
import io.github.drompincen.taskboard.protocol.api.Team;

import java.util.List;

public record BoardColumn(
        String columnId,
        Team team,
        String statusCode,
        String name,
        String color,
        int position,
        List<TaskDto> tasks
) {
    public BoardColumn {
        tasks = List.copyOf(tasks);
    }

    public int count() {
        return tasks.size();
    }

    public ColumnRef ref() {
        return new ColumnRef(team, statusCode);
    }
}
