package io.github.drompincen.taskboard.persistence.repository;

import io.github.drompincen.taskboard.persistence.document.TaskDocument;
import io.github.drompincen.taskboard.protocol.api.Team;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface TaskRepository extends MongoRepository<TaskDocument, String>, TaskSearchRepository {
    List<TaskDocument> findByTeam(Team team);
    List<TaskDocument> findByTeamAndStatus(Team team, String status);
    boolean existsByTeamAndStatus(Team team, String status);
}
