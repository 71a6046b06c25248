package io.github.drompincen.taskboard.persistence.repository;

import io.github.drompincen.taskboard.persistence.document.TaskDocument;
import io.github.drompincen.taskboard.protocol.api.TaskFilter;

import java.util.List;

public interface TaskSearchRepository {

    /**
     * Tasks of the filter's team matching every optional criterion, in the filter's sort order.
     */
    List<TaskDocument> search(TaskFilter filter);
}
