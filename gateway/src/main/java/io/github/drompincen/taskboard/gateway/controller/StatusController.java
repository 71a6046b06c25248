package io.github.drompincen.taskboard.gateway.controller;

import io.github.drompincen.taskboard.protocol.api.StatusDefinitionDto;
import io.github.drompincen.taskboard.protocol.api.StatusDefinitionRequest;
import io.github.drompincen.taskboard.protocol.api.Team;
import io.github.drompincen.taskboard.runtime.status.StatusNotFoundException;
import io.github.drompincen.taskboard.runtime.status.StatusService;
import io.github.drompincen.taskboard.runtime.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/teams/{team}/statuses")
public class StatusController {

    private final StatusService statusService;

    public StatusController(StatusService statusService) {
        this.statusService = statusService;
    }

    @GetMapping
    public ResponseEntity<List<StatusDefinitionDto>> list(@PathVariable String team) {
        return TeamPaths.parse(team)
                .map(t -> ResponseEntity.ok(statusService.listByTeam(t)))
                .orElse(ResponseEntity.badRequest().build());
    }

    @PostMapping
    public ResponseEntity<StatusDefinitionDto> create(@PathVariable String team,
                                                      @RequestBody StatusDefinitionRequest request) {
        Optional<Team> parsed = TeamPaths.parse(team);
        if (parsed.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(statusService.create(parsed.get(), request));
        } catch (TaskRejectedException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    @PutMapping("/{code}")
    public ResponseEntity<StatusDefinitionDto> update(@PathVariable String team, @PathVariable String code,
                                                      @RequestBody StatusDefinitionRequest request) {
        Optional<Team> parsed = TeamPaths.parse(team);
        if (parsed.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        try {
            return ResponseEntity.ok(statusService.update(parsed.get(), code, request));
        } catch (StatusNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @DeleteMapping("/{code}")
    public ResponseEntity<Void> delete(@PathVariable String team, @PathVariable String code) {
        Optional<Team> parsed = TeamPaths.parse(team);
        if (parsed.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        try {
            statusService.delete(parsed.get(), code);
            return ResponseEntity.noContent().build();
        } catch (StatusNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (TaskRejectedException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }
}
