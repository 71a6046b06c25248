package io.github.drompincen.taskboard.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskFilterTest {

    @Test
    void blankValuesAreNormalized() {
        TaskFilter filter = new TaskFilter(Team.WEB, " ", "", "  logo  ", null);

        assertThat(filter.clientId()).isNull();
        assertThat(filter.assigneeId()).isNull();
        assertThat(filter.searchQuery()).isEqualTo("logo");
        assertThat(filter.sortBy()).isEqualTo(TaskSortOrder.NONE);
    }

    @Test
    void teamIsRequired() {
        assertThatThrownBy(() -> TaskFilter.forTeam(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void withersKeepOtherFields() {
        TaskFilter filter = TaskFilter.forTeam(Team.CREATIVE)
                .withClientId("c1")
                .withAssigneeId("u1")
                .withSearchQuery("shoot")
                .withSortBy(TaskSortOrder.DUE_DATE);

        assertThat(filter).isEqualTo(new TaskFilter(Team.CREATIVE, "c1", "u1", "shoot", TaskSortOrder.DUE_DATE));
    }
}
