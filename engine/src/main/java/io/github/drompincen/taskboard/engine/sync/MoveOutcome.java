package io.github.drompincen.taskboard.engine.sync;

public record MoveOutcome(
        String taskId,
        Result result,
        String fromStatus,
        String toStatus,
        String reason
) {
    public enum Result {
        COMMITTED, ROLLED_BACK, REJECTED, NO_CHANGE, CANCELLED
    }

    public static MoveOutcome committed(String taskId, String fromStatus, String toStatus) {
        return new MoveOutcome(taskId, Result.COMMITTED, fromStatus, toStatus, null);
    }

    public static MoveOutcome rolledBack(String taskId, String fromStatus, String toStatus, String reason) {
        return new MoveOutcome(taskId, Result.ROLLED_BACK, fromStatus, toStatus, reason);
    }

    public static MoveOutcome rejected(String taskId, String fromStatus, String toStatus, String reason) {
        return new MoveOutcome(taskId, Result.REJECTED, fromStatus, toStatus, reason);
    }

    public static MoveOutcome noChange(String taskId, String status) {
        return new MoveOutcome(taskId, Result.NO_CHANGE, status, status, null);
    }

    public static MoveOutcome cancelled(String taskId, String fromStatus, String toStatus) {
        return new MoveOutcome(taskId, Result.CANCELLED, fromStatus, toStatus, "TASK_DELETED");
    }
}
