package io.github.drompincen.taskboard.persistence.repository;

import io.github.drompincen.taskboard.persistence.AbstractMongoIntegrationTest;
import io.github.drompincen.taskboard.persistence.document.UserDocument;
import io.github.drompincen.taskboard.protocol.api.Team;
import io.github.drompincen.taskboard.protocol.api.UserRole;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UserRepositoryTest extends AbstractMongoIntegrationTest {

    @Autowired
    private UserRepository userRepository;

    @Test
    void findByTeamAndActive() {
        userRepository.save(createUser("u1", Team.CREATIVE, true));
        userRepository.save(createUser("u2", Team.CREATIVE, false));
        userRepository.save(createUser("u3", Team.WEB, true));

        assertThat(userRepository.findByTeam(Team.CREATIVE)).hasSize(2);
        assertThat(userRepository.findByTeamAndActiveTrue(Team.CREATIVE))
                .extracting(UserDocument::getUserId).containsExactly("u1");
    }

    @Test
    void allowedStatusesRoundTrip() {
        userRepository.save(createUser("u1", Team.CREATIVE, true));

        UserDocument found = userRepository.findById("u1").orElseThrow();
        assertThat(found.getAllowedStatuses()).containsExactly("scripting", "shoot_pending");
        assertThat(found.getRole()).isEqualTo(UserRole.EMPLOYEE);
    }

    private UserDocument createUser(String id, Team team, boolean active) {
        UserDocument doc = new UserDocument();
        doc.setUserId(id);
        doc.setName("User " + id);
        doc.setRole(UserRole.EMPLOYEE);
        doc.setTeam(team);
        doc.setActive(active);
        doc.setAllowedStatuses(List.of("scripting", "shoot_pending"));
        return doc;
    }
}
