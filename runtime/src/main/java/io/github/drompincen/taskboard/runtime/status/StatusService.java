package io.github.drompincen.taskboard.runtime.status;

import io.github.drompincen.taskboard.persistence.document.StatusDefinitionDocument;
import io.github.drompincen.taskboard.persistence.repository.StatusDefinitionRepository;
import io.github.drompincen.taskboard.persistence.repository.TaskRepository;
import io.github.drompincen.taskboard.protocol.api.StatusDefinitionDto;
import io.github.drompincen.taskboard.protocol.api.StatusDefinitionRequest;
import io.github.drompincen.taskboard.protocol.api.Team;
import io.github.drompincen.taskboard.runtime.task.TaskRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Manages each team's status vocabulary, which also defines the team's board columns.
 */
@Service
public class StatusService {

    private static final Logger log = LoggerFactory.getLogger(StatusService.class);

    private final StatusDefinitionRepository statusRepository;
    private final TaskRepository taskRepository;

    public StatusService(StatusDefinitionRepository statusRepository, TaskRepository taskRepository) {
        this.statusRepository = statusRepository;
        this.taskRepository = taskRepository;
    }

    public List<StatusDefinitionDto> listByTeam(Team team) {
        return statusRepository.findByTeamOrderByPosition(team).stream().map(StatusService::toDto).toList();
    }

    public boolean isKnown(Team team, String code) {
        return code != null && statusRepository.existsByTeamAndCode(team, code);
    }

    public StatusDefinitionDto create(Team team, StatusDefinitionRequest request) {
        if (request.code() == null || request.code().isBlank()) {
            throw new TaskRejectedException("Status code is required");
        }
        String code = request.code().trim();
        if (statusRepository.existsByTeamAndCode(team, code)) {
            throw new TaskRejectedException("Status " + code + " already exists for team " + team.code());
        }
        StatusDefinitionDocument doc = new StatusDefinitionDocument();
        doc.setId(team.code() + "_" + code);
        doc.setTeam(team);
        doc.setCode(code);
        doc.setName(request.name() != null && !request.name().isBlank() ? request.name() : code);
        doc.setColor(request.color());
        doc.setPosition(request.position() != null ? request.position() : (int) statusRepository.countByTeam(team));
        doc.setCreatedAt(Instant.now());
        StatusDefinitionDocument saved = statusRepository.save(doc);
        log.info("Added status {} to {} at position {}", code, team.code(), saved.getPosition());
        return toDto(saved);
    }

    public StatusDefinitionDto update(Team team, String code, StatusDefinitionRequest request) {
        StatusDefinitionDocument doc = statusRepository.findByTeamAndCode(team, code)
                .orElseThrow(() -> new StatusNotFoundException(team, code));
        if (request.name() != null) doc.setName(request.name());
        if (request.color() != null) doc.setColor(request.color());
        if (request.position() != null) doc.setPosition(request.position());
        return toDto(statusRepository.save(doc));
    }

    public void delete(Team team, String code) {
        StatusDefinitionDocument doc = statusRepository.findByTeamAndCode(team, code)
                .orElseThrow(() -> new StatusNotFoundException(team, code));
        if (taskRepository.existsByTeamAndStatus(team, code)) {
            throw new TaskRejectedException("Status " + code + " is still used by tasks of team " + team.code());
        }
        statusRepository.delete(doc);
        log.info("Removed status {} from {}", code, team.code());
    }

    /**
     * Inserts the default vocabulary for every team that has none yet.
     *
     * @return number of statuses inserted
     */
    public int seedDefaults() {
        int inserted = 0;
        for (Team team : Team.values()) {
            if (statusRepository.countByTeam(team) > 0) {
                continue;
            }
            List<StatusDefinitionDto> defaults = DefaultStatuses.forTeam(team);
            for (StatusDefinitionDto def : defaults) {
                StatusDefinitionDocument doc = new StatusDefinitionDocument();
                doc.setId(team.code() + "_" + def.code());
                doc.setTeam(team);
                doc.setCode(def.code());
                doc.setName(def.name());
                doc.setColor(def.color());
                doc.setPosition(def.position());
                doc.setCreatedAt(Instant.now());
                statusRepository.save(doc);
            }
            inserted += defaults.size();
            log.info("Seeded {} default statuses for {}", defaults.size(), team.code());
        }
        return inserted;
    }

    public static StatusDefinitionDto toDto(StatusDefinitionDocument doc) {
        return new StatusDefinitionDto(doc.getCode(), doc.getTeam(), doc.getName(), doc.getColor(), doc.getPosition());
    }
}
