package io.github.drompincen.taskboard.protocol.api;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TaskDtoTest {

    @Test
    void withStatusChangesOnlyStatus() {
        TaskDto task = new TaskDto("t1", "Logo", "Draft logo", Team.CREATIVE, "scripting",
                TaskPriority.HIGH, "u1", "c1", LocalDate.of(2026, 1, 15), Instant.EPOCH, "u2");

        TaskDto moved = task.withStatus("approved");

        assertThat(moved.status()).isEqualTo("approved");
        assertThat(moved.withStatus("scripting")).isEqualTo(task);
    }

    @Test
    void userAllowedStatusesAreImmutableAndNeverNull() {
        UserDto user = new UserDto("u1", "Ana", UserRole.EMPLOYEE, Team.WEB, true, null);

        assertThat(user.allowedStatuses()).isEmpty();
        assertThat(user.isAdmin()).isFalse();
        assertThat(new UserDto("u2", "Root", UserRole.ADMIN, Team.WEB, true, Set.of("testing")).isAdmin()).isTrue();
    }
}
