package io.meteredbatch.runtime;

import java.nio.file.Path;

/**
 * Raised by {@link BatchOrchestrator#run()} when a job reports a fatal outcome or the work items
 * cannot be loaded. Work already dispatched has drained and, where a chunk ran, a final
 * checkpoint has been attempted before this is thrown.
 */
public class BatchAbortedException extends RuntimeException {
    private final BatchSummary summary;

    public BatchAbortedException(String message, BatchSummary summary, Throwable cause) {
        super(message, cause);
        this.summary = summary;
    }

    public BatchSummary summary() { return summary; }

    public StopReason stopReason() { return summary.stopReason(); }

    /** Where the last checkpoint was written, or {@code null} if none was. */
    public Path checkpointLocation() { return summary.checkpointLocation(); }
}
