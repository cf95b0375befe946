package io.meteredbatch.checkpoint;

import java.util.Map;

/**
 * Per-item line of a checkpoint or summary. {@code reason} is the registry decision that
 * scheduled or skipped the item; {@code error} and {@code outputs} are set by the outcome.
 */
public record ItemResult(
        String identity,
        int index,
        String runId,
        String reason,
        String error,
        Map<String, String> outputs
) {
    public static ItemResult success(String identity, int index, String runId, String reason, Map<String, String> outputs) {
        return new ItemResult(identity, index, runId, reason, null, outputs == null ? Map.of() : Map.copyOf(outputs));
    }

    public static ItemResult failed(String identity, int index, String runId, String reason, String error) {
        return new ItemResult(identity, index, runId, reason, error, null);
    }

    public static ItemResult skipped(String identity, int index, String runId, String reason) {
        return new ItemResult(identity, index, runId, reason, null, null);
    }
}
