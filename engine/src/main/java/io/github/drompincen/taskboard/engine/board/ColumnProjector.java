package io.github.drompincen.taskboard.engine.board;

import io.github.drompincen.taskboard.protocol.api.StatusDefinitionDto;
import io.github.drompincen.taskboard.protocol.api.TaskDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Builds the ordered columns of one team's board from its status vocabulary and a task snapshot.
 * Output depends on the inputs only, so callers can compare successive projections with
 * {@code equals} and skip re-rendering when nothing changed. A task outside the vocabulary is
 * warned about once per status it carries; later projections mention it at DEBUG only.
 */
public class ColumnProjector {

    private static final Logger log = LoggerFactory.getLogger(ColumnProjector.class);

    private final Set<String> reportedOrphans = ConcurrentHashMap.newKeySet();

    public List<BoardColumn> project(List<StatusDefinitionDto> statusDefs, List<TaskDto> tasks) {
        return project(statusDefs, tasks, code -> true);
    }

    public List<BoardColumn> project(List<StatusDefinitionDto> statusDefs, List<TaskDto> tasks,
                                     Predicate<String> permissionFilter) {
        if (statusDefs == null || statusDefs.isEmpty()) {
            return List.of();
        }
        Predicate<String> visible = permissionFilter != null ? permissionFilter : code -> true;

        Map<String, List<TaskDto>> byStatus = new LinkedHashMap<>();
        for (StatusDefinitionDto def : ordered(statusDefs)) {
            byStatus.putIfAbsent(def.code(), new ArrayList<>());
        }
        for (TaskDto task : tasks) {
            List<TaskDto> bucket = byStatus.get(task.status());
            if (bucket == null) {
                if (reportedOrphans.add(task.taskId() + "|" + task.status())) {
                    log.warn("Task {} has status '{}' outside the {} vocabulary, excluded from board",
                            task.taskId(), task.status(), task.team());
                } else {
                    log.debug("Task {} still excluded, status '{}'", task.taskId(), task.status());
                }
                continue;
            }
            bucket.add(task);
        }

        List<BoardColumn> columns = new ArrayList<>();
        Set<String> emitted = new HashSet<>();
        for (StatusDefinitionDto def : ordered(statusDefs)) {
            if (!visible.test(def.code()) || !emitted.add(def.code())) {
                continue;
            }
            columns.add(new BoardColumn(new ColumnRef(def.team(), def.code()).id(), def.team(), def.code(),
                    def.name(), def.color(), def.position(), byStatus.get(def.code())));
        }
        return List.copyOf(columns);
    }

    public List<TaskDto> findOrphans(List<StatusDefinitionDto> statusDefs, List<TaskDto> tasks) {
        Set<String> codes = statusDefs.stream().map(StatusDefinitionDto::code).collect(Collectors.toSet());
        return tasks.stream().filter(t -> !codes.contains(t.status())).collect(Collectors.toList());
    }

    private static List<StatusDefinitionDto> ordered(List<StatusDefinitionDto> statusDefs) {
        return statusDefs.stream()
                .sorted(Comparator.comparingInt(StatusDefinitionDto::position))
                .collect(Collectors.toList());
    }
}
