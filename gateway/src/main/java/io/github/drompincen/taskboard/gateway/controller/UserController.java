package io.github.drompincen.taskboard.gateway.controller;

import io.github.drompincen.taskboard.protocol.api.UserDto;
import io.github.drompincen.taskboard.runtime.user.UserService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping("/users/{userId}")
    public ResponseEntity<UserDto> get(@PathVariable String userId) {
        return userService.findById(userId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/teams/{team}/users")
    public ResponseEntity<List<UserDto>> listByTeam(@PathVariable String team) {
        return TeamPaths.parse(team)
                .map(t -> ResponseEntity.ok(userService.listByTeam(t)))
                .orElse(ResponseEntity.badRequest().build());
    }
}
