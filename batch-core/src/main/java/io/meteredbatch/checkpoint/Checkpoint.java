package io.meteredbatch.checkpoint;

import java.time.Instant;

/**
 * Cumulative progress of a batch, written at chunk boundaries and on abnormal termination.
 *
 * @param schemaVersion  layout version of the document, currently {@link #SCHEMA_VERSION}
 * @param processedCount items dispatched so far (success plus failed; skipped items excluded)
 */
public record Checkpoint(
        int schemaVersion,
        String batchId,
        Instant timestamp,
        int processedCount,
        CheckpointResults results,
        double totalCost,
        CheckpointReason reason
) {
    public static final int SCHEMA_VERSION = 1;

    public static Checkpoint of(String batchId, Instant timestamp, int processedCount,
                                CheckpointResults results, double totalCost, CheckpointReason reason) {
        return new Checkpoint(SCHEMA_VERSION, batchId, timestamp, processedCount, results, totalCost, reason);
    }
}
