package io.github.drompincen.taskboard.gateway.controller;

import io.github.drompincen.taskboard.protocol.api.Team;

import java.util.Optional;

final class TeamPaths {

    private TeamPaths() {}

    static Optional<Team> parse(String code) {
        try {
            return Optional.of(Team.fromCode(code));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
