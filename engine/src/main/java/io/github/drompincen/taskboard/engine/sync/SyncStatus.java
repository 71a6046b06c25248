package io.github.drompincen.taskboard.engine.sync;

import java.time.Instant;

/**
 * Health of the polling loop. How many consecutive failures warrant telling the user is up to the UI.
 */
public record SyncStatus(
        long appliedGeneration,
        int consecutiveFailures,
        Instant lastSuccessAt,
        String lastError
) {
    public boolean healthy() {
        return consecutiveFailures == 0;
    }
}
