package io.github.drompincen.taskboard.runtime.config;

import io.github.drompincen.taskboard.engine.board.PermissionGate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The server enforces the same permission rules the board client checks before a move.
 */
@Configuration
public class BoardRulesConfig {

    @Bean
    public PermissionGate permissionGate() {
        return new PermissionGate();
    }
}
