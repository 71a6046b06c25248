package io.github.drompincen.taskboard.protocol.event;

import java.time.Instant;

/**
 * State change of a single move request, published for UI feedback.
 *
 * @param reason rejection or failure reason; null for VALIDATING, APPLIED and COMMITTED
 */
public record BoardEvent(
        BoardEventType type,
        String taskId,
        String fromStatus,
        String toStatus,
        String reason,
        Instant timestamp
) {
    public static BoardEvent of(BoardEventType type, String taskId, String fromStatus, String toStatus) {
        return new BoardEvent(type, taskId, fromStatus, toStatus, null, Instant.now());
    }

    public static BoardEvent withReason(BoardEventType type, String taskId, String fromStatus,
                                        String toStatus, String reason) {
        return new BoardEvent(type, taskId, fromStatus, toStatus, reason, Instant.now());
    }
}
