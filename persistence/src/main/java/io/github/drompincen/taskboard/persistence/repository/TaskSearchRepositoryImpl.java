package io.github.drompincen.taskboard.persistence.repository;

import io.github.drompincen.taskboard.persistence.document.TaskDocument;
import io.github.drompincen.taskboard.protocol.api.TaskFilter;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

public class TaskSearchRepositoryImpl implements TaskSearchRepository {

    private final MongoTemplate mongoTemplate;

    public TaskSearchRepositoryImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<TaskDocument> search(TaskFilter filter) {
        Query query = new Query().addCriteria(Criteria.where("team").is(filter.team()));
        if (filter.clientId() != null) {
            query.addCriteria(Criteria.where("clientId").is(filter.clientId()));
        }
        if (filter.assigneeId() != null) {
            query.addCriteria(Criteria.where("assigneeId").is(filter.assigneeId()));
        }
        if (filter.searchQuery() != null) {
            String pattern = Pattern.quote(filter.searchQuery());
            query.addCriteria(new Criteria().orOperator(
                    Criteria.where("title").regex(pattern, "i"),
                    Criteria.where("description").regex(pattern, "i")));
        }
        query.with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));

        List<TaskDocument> results = mongoTemplate.find(query, TaskDocument.class);
        Comparator<TaskDocument> order = comparatorFor(filter);
        if (order != null) {
            results.sort(order);
        }
        return results;
    }

    // Applied in memory: Mongo sorts missing due dates first and compares titles case-sensitively.
    private static Comparator<TaskDocument> comparatorFor(TaskFilter filter) {
        switch (filter.sortBy()) {
            case CREATED_DATE:
                return Comparator.comparing(TaskDocument::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder()));
            case DUE_DATE:
                return Comparator.comparing(TaskDocument::getDueDate,
                        Comparator.nullsLast(Comparator.naturalOrder()));
            case TITLE:
                return Comparator.comparing(TaskDocument::getTitle,
                        Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER));
            default:
                return null;
        }
    }
}
