package io.meteredbatch.runtime;

import io.meteredbatch.budget.CostLedger;
import io.meteredbatch.checkpoint.ItemResult;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Outcome of a batch, returned on completion or budget stop and attached to
 * {@link BatchAbortedException} otherwise.
 *
 * @param loaded             items returned by the job source (after the limit was applied)
 * @param processedCount     items dispatched to the job function
 * @param checkpointLocation latest checkpoint, or {@code null} when none was written
 * @param stopMessage        what triggered a budget or fatal stop; {@code null} on completion
 */
public record BatchSummary(
        String batchId,
        BatchState state,
        StopReason stopReason,
        int loaded,
        List<ItemResult> success,
        List<ItemResult> failed,
        List<ItemResult> skipped,
        int processedCount,
        Duration elapsed,
        CostLedger cost,
        Path checkpointLocation,
        String stopMessage
) {
    public BatchSummary {
        success = List.copyOf(success);
        failed = List.copyOf(failed);
        skipped = List.copyOf(skipped);
    }

    public boolean completed() {
        return stopReason == StopReason.COMPLETED;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "Batch %s %s", batchId, completed() ? "COMPLETE" : "STOPPED (" + stopReason + ")"));
        sb.append(String.format(Locale.ROOT, "%n  Success: %d", success.size()));
        sb.append(String.format(Locale.ROOT, "%n  Failed:  %d", failed.size()));
        sb.append(String.format(Locale.ROOT, "%n  Skipped: %d", skipped.size()));
        sb.append(String.format(Locale.ROOT, "%n  Elapsed: %.1fs", elapsed.toMillis() / 1000.0));
        if (!failed.isEmpty()) {
            sb.append(String.format(Locale.ROOT, "%n  Failed items:"));
            for (ItemResult r : failed.subList(0, Math.min(10, failed.size()))) {
                sb.append(String.format(Locale.ROOT, "%n    - %s: %s", r.identity(), r.error()));
            }
            if (failed.size() > 10) {
                sb.append(String.format(Locale.ROOT, "%n    ... and %d more", failed.size() - 10));
            }
        }
        if (!completed()) {
            if (stopMessage != null) sb.append(String.format(Locale.ROOT, "%n  Cause: %s", stopMessage));
            if (checkpointLocation != null) {
                sb.append(String.format(Locale.ROOT, "%n  Resume from checkpoint: %s", checkpointLocation));
            }
        }
        sb.append(System.lineSeparator()).append(cost.describe());
        return sb.toString();
    }
}
