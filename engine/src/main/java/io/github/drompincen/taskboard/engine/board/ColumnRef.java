package io.github.drompincen.taskboard.engine.board;

import io.github.drompincen.taskboard.protocol.api.Team;

import java.util.Objects;
import java.util.Optional;

/**
 * Identity of a column: a team plus a status code, written as {@code <team code>_<status code>}.
 * Status codes may themselves contain underscores, so only the first one separates the team.
 */
public record ColumnRef(Team team, String statusCode) {

    public ColumnRef {
        Objects.requireNonNull(team, "team");
        Objects.requireNonNull(statusCode, "statusCode");
    }

    public String id() {
        return team.code() + "_" + statusCode;
    }

    public static Optional<ColumnRef> parse(String columnId) {
        if (columnId == null) {
            return Optional.empty();
        }
        int sep = columnId.indexOf('_');
        if (sep <= 0 || sep == columnId.length() - 1) {
            return Optional.empty();
        }
        try {
            Team team = Team.fromCode(columnId.substring(0, sep));
            return Optional.of(new ColumnRef(team, columnId.substring(sep + 1)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
