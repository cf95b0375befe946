package io.meteredbatch.core;

import java.util.Set;

/**
 * The unit of work applied to each item. Implementations report usage through the context and
 * surface their own timeouts as {@link JobOutcome#failure(String)}.
 *
 * <p>A thrown exception is treated as a per-item failure (subject to the retry policy), except
 * {@link io.meteredbatch.budget.BudgetExceededException}, which also stops further dispatch.
 */
public interface JobFunction {
    JobOutcome process(WorkItem item, JobContext context) throws Exception;

    /** Rate-limited dependencies the worker acquires one token from before each invocation. */
    default Set<String> dependencies() {
        return Set.of();
    }
}
