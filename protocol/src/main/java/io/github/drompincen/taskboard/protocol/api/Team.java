package io.github.drompincen.taskboard.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Team {
    CREATIVE("creative"),
    WEB("web");

    private final String code;

    Team(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static Team fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Team code cannot be null");
        }
        for (Team team : values()) {
            if (team.code.equalsIgnoreCase(code) || team.name().equalsIgnoreCase(code)) {
                return team;
            }
        }
        throw new IllegalArgumentException("Unknown team code: " + code);
    }
}
