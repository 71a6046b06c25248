package io.github.drompincen.taskboard.engine.board;

import io.github.drompincen.taskboard.protocol.api.TaskDto;
import io.github.drompincen.taskboard.protocol.api.UserDto;

/**
 * Decides whether a task may move into a column. Rules are checked in order: team boundary,
 * then the user's right to act on the destination, then whether the move changes anything.
 */
public class TransitionValidator {

    private final PermissionGate permissionGate;

    public TransitionValidator(PermissionGate permissionGate) {
        this.permissionGate = permissionGate;
    }

    public TransitionDecision validate(TaskDto task, ColumnRef destColumn, UserDto user) {
        if (task.team() != destColumn.team()) {
            return TransitionDecision.reject(RejectionReason.CROSS_TEAM);
        }
        if (!permissionGate.canAct(user, destColumn.statusCode(), destColumn.team())) {
            return TransitionDecision.reject(RejectionReason.PERMISSION_DENIED);
        }
        if (destColumn.statusCode().equals(task.status())) {
            return TransitionDecision.noChange(task.status());
        }
        return TransitionDecision.accept(destColumn.statusCode());
    }
}
