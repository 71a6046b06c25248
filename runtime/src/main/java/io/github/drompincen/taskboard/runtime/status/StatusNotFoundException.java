package io.github.drompincen.taskboard.runtime.status;

import io.github.drompincen.taskboard.protocol.api.Team;

public class StatusNotFoundException extends RuntimeException {

    public StatusNotFoundException(Team team, String code) {
        super("Status not found: " + team.code() + "_" + code);
    }
}
