package io.github.drompincen.taskboard.persistence.repository;

import io.github.drompincen.taskboard.persistence.document.StatusDefinitionDocument;
import io.github.drompincen.taskboard.protocol.api.Team;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface StatusDefinitionRepository extends MongoRepository<StatusDefinitionDocument, String> {
    List<StatusDefinitionDocument> findByTeamOrderByPosition(Team team);
    Optional<StatusDefinitionDocument> findByTeamAndCode(Team team, String code);
    boolean existsByTeamAndCode(Team team, String code);
    long countByTeam(Team team);
}
