package io.github.drompincen.taskboard.engine.board;

import io.github.drompincen.taskboard.protocol.api.StatusDefinitionDto;
import io.github.drompincen.taskboard.protocol.api.Team;
import io.github.drompincen.taskboard.protocol.api.UserDto;
import io.github.drompincen.taskboard.protocol.api.UserRole;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static io.github.drompincen.taskboard.engine.support.BoardFixtures.admin;
import static io.github.drompincen.taskboard.engine.support.BoardFixtures.creativeStatuses;
import static io.github.drompincen.taskboard.engine.support.BoardFixtures.employee;
import static org.assertj.core.api.Assertions.assertThat;

class PermissionGateTest {

    private final PermissionGate gate = new PermissionGate();

    @Test
    void employeeSeesEveryColumnOfOwnTeam() {
        UserDto user = employee("u1", Team.CREATIVE, "backlog");

        assertThat(gate.canViewColumn(user, Team.CREATIVE, "done")).isTrue();
        assertThat(gate.canViewColumn(user, Team.WEB, "backlog")).isFalse();
    }

    @Test
    void employeeActsOnlyInAllowedStatuses() {
        UserDto user = employee("u1", Team.CREATIVE, "backlog", "in_progress");

        assertThat(gate.canAct(user, "in_progress", Team.CREATIVE)).isTrue();
        assertThat(gate.canAct(user, "review", Team.CREATIVE)).isFalse();
        assertThat(gate.canAct(user, "backlog", Team.WEB)).isFalse();
    }

    @Test
    void adminActsAnywhere() {
        UserDto user = admin(Team.CREATIVE);

        assertThat(gate.canAct(user, "review", Team.CREATIVE)).isTrue();
        assertThat(gate.canAct(user, "qa", Team.WEB)).isTrue();
        assertThat(gate.canViewColumn(user, Team.WEB, "qa")).isTrue();
    }

    @Test
    void missingUserCanDoNothing() {
        assertThat(gate.canViewColumn(null, Team.CREATIVE, "backlog")).isFalse();
        assertThat(gate.canAct(null, "backlog", Team.CREATIVE)).isFalse();
    }

    @Test
    void accessibleStatusesKeepsVocabularyOrder() {
        UserDto user = employee("u1", Team.CREATIVE, "done", "backlog");

        List<StatusDefinitionDto> accessible = gate.accessibleStatuses(user, creativeStatuses());

        assertThat(accessible).extracting(StatusDefinitionDto::code).containsExactly("backlog", "done");
    }

    @Test
    void assigneeMustBeActiveAndAllowed() {
        UserDto inactive = new UserDto("u2", "Gone", UserRole.EMPLOYEE, Team.CREATIVE, false, Set.of("backlog"));

        assertThat(gate.canAssign(null, "backlog", Team.CREATIVE)).isTrue();
        assertThat(gate.canAssign(employee("u1", Team.CREATIVE, "backlog"), "backlog", Team.CREATIVE)).isTrue();
        assertThat(gate.canAssign(employee("u1", Team.CREATIVE, "backlog"), "done", Team.CREATIVE)).isFalse();
        assertThat(gate.canAssign(inactive, "backlog", Team.CREATIVE)).isFalse();
    }
}
