package io.meteredbatch.core;

import java.time.Duration;

/**
 * Per-attempt handle given to a {@link JobFunction}: the run id plus access to the shared rate
 * limiters and cost meter of the batch.
 */
public interface JobContext {
    String runId();

    /** Blocks until the named dependency's limiter grants a token; returns the time waited. */
    Duration acquire(String dependency) throws InterruptedException;

    /** Records metered usage; throws {@link io.meteredbatch.budget.BudgetExceededException} once the ceiling is met. */
    void record(String kind, long quantity);
}
