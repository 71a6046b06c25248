package io.github.drompincen.taskboard.runtime.status;

import io.github.drompincen.taskboard.persistence.document.StatusDefinitionDocument;
import io.github.drompincen.taskboard.persistence.repository.StatusDefinitionRepository;
import io.github.drompincen.taskboard.persistence.repository.TaskRepository;
import io.github.drompincen.taskboard.protocol.api.StatusDefinitionDto;
import io.github.drompincen.taskboard.protocol.api.StatusDefinitionRequest;
import io.github.drompincen.taskboard.protocol.api.Team;
import io.github.drompincen.taskboard.runtime.task.TaskRejectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StatusServiceTest {

    @Mock
    private StatusDefinitionRepository statusRepository;

    @Mock
    private TaskRepository taskRepository;

    private StatusService statusService;

    @BeforeEach
    void setUp() {
        statusService = new StatusService(statusRepository, taskRepository);
    }

    @Test
    void createAppendsAtEndWhenNoPositionGiven() {
        when(statusRepository.existsByTeamAndCode(Team.WEB, "staging")).thenReturn(false);
        when(statusRepository.countByTeam(Team.WEB)).thenReturn(10L);
        when(statusRepository.save(any(StatusDefinitionDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        StatusDefinitionDto created = statusService.create(Team.WEB,
                new StatusDefinitionRequest("staging", "Staging", "#000000", null));

        assertThat(created.position()).isEqualTo(10);
        assertThat(created.team()).isEqualTo(Team.WEB);
    }

    @Test
    void createDuplicateIsRejected() {
        when(statusRepository.existsByTeamAndCode(Team.WEB, "testing")).thenReturn(true);

        assertThatThrownBy(() -> statusService.create(Team.WEB,
                new StatusDefinitionRequest("testing", "Testing", null, null)))
                .isInstanceOf(TaskRejectedException.class);
    }

    @Test
    void updateChangesOnlyGivenFields() {
        StatusDefinitionDocument doc = createStatus(Team.CREATIVE, "scripting", 1);
        when(statusRepository.findByTeamAndCode(Team.CREATIVE, "scripting")).thenReturn(Optional.of(doc));
        when(statusRepository.save(any(StatusDefinitionDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        StatusDefinitionDto updated = statusService.update(Team.CREATIVE, "scripting",
                new StatusDefinitionRequest(null, null, "#ffffff", null));

        assertThat(updated.color()).isEqualTo("#ffffff");
        assertThat(updated.name()).isEqualTo("Scripting");
        assertThat(updated.position()).isEqualTo(1);
    }

    @Test
    void updateUnknownStatusThrows() {
        when(statusRepository.findByTeamAndCode(Team.WEB, "nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> statusService.update(Team.WEB, "nope", new StatusDefinitionRequest(null, "x", null, null)))
                .isInstanceOf(StatusNotFoundException.class);
    }

    @Test
    void deleteRefusedWhileTasksUseStatus() {
        when(statusRepository.findByTeamAndCode(Team.CREATIVE, "scripting"))
                .thenReturn(Optional.of(createStatus(Team.CREATIVE, "scripting", 1)));
        when(taskRepository.existsByTeamAndStatus(Team.CREATIVE, "scripting")).thenReturn(true);

        assertThatThrownBy(() -> statusService.delete(Team.CREATIVE, "scripting"))
                .isInstanceOf(TaskRejectedException.class);
        verify(statusRepository, never()).delete(any());
    }

    @Test
    void deleteUnusedStatus() {
        StatusDefinitionDocument doc = createStatus(Team.CREATIVE, "scripting", 1);
        when(statusRepository.findByTeamAndCode(Team.CREATIVE, "scripting")).thenReturn(Optional.of(doc));
        when(taskRepository.existsByTeamAndStatus(Team.CREATIVE, "scripting")).thenReturn(false);

        statusService.delete(Team.CREATIVE, "scripting");

        verify(statusRepository).delete(doc);
    }

    @Test
    void seedDefaultsSkipsTeamsThatHaveStatuses() {
        when(statusRepository.countByTeam(Team.CREATIVE)).thenReturn(3L);
        when(statusRepository.countByTeam(Team.WEB)).thenReturn(0L);

        int inserted = statusService.seedDefaults();

        assertThat(inserted).isEqualTo(10);
        verify(statusRepository, times(10)).save(any(StatusDefinitionDocument.class));
    }

    private StatusDefinitionDocument createStatus(Team team, String code, int position) {
        StatusDefinitionDocument doc = new StatusDefinitionDocument();
        doc.setId(team.code() + "_" + code);
        doc.setTeam(team);
        doc.setCode(code);
        doc.setName("Scripting");
        doc.setColor("#a78bfa");
        doc.setPosition(position);
        return doc;
    }
}
