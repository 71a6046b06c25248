package io.github.drompincen.taskboard.persistence.repository;

import io.github.drompincen.taskboard.persistence.document.UserDocument;
import io.github.drompincen.taskboard.protocol.api.Team;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface UserRepository extends MongoRepository<UserDocument, String> {
    List<UserDocument> findByTeam(Team team);
    List<UserDocument> findByTeamAndActiveTrue(Team team);
}
