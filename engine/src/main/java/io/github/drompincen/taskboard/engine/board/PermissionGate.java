package io.github.drompincen.taskboard.engine.board;

import io.github.drompincen.taskboard.protocol.api.StatusDefinitionDto;
import io.github.drompincen.taskboard.protocol.api.Team;
import io.github.drompincen.taskboard.protocol.api.UserDto;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-user rights on the board. Reading is open for every column of the user's team; only write
 * actions (creating a task in a column, moving a task into it) are restricted to the user's
 * allowed statuses. Admins may act anywhere.
 */
public class PermissionGate {

    public boolean canViewColumn(UserDto user, Team team, String statusCode) {
        if (user == null || team == null) {
            return false;
        }
        return user.isAdmin() || team == user.team();
    }

    public boolean canAct(UserDto user, String statusCode, Team team) {
        if (user == null) {
            return false;
        }
        if (user.isAdmin()) {
            return true;
        }
        return team != null && team == user.team()
                && statusCode != null && user.allowedStatuses().contains(statusCode);
    }

    public List<StatusDefinitionDto> accessibleStatuses(UserDto user, List<StatusDefinitionDto> statusDefs) {
        return statusDefs.stream()
                .filter(def -> canAct(user, def.code(), def.team()))
                .collect(Collectors.toList());
    }

    /**
     * Whether a task in {@code statusCode} may be assigned to {@code assignee}: the assignee has to be
     * active and allowed to work in that status. No assignee at all is always fine.
     */
    public boolean canAssign(UserDto assignee, String statusCode, Team team) {
        if (assignee == null) {
            return true;
        }
        return assignee.active() && canAct(assignee, statusCode, team);
    }
}
