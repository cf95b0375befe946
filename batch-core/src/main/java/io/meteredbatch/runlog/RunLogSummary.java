package io.meteredbatch.runlog;

/**
 * Event counts for one batch, read back from the structured trail.
 */
public record RunLogSummary(int start, int skip, int success, int fail, double totalDurationSeconds) {
    public static final RunLogSummary EMPTY = new RunLogSummary(0, 0, 0, 0, 0.0);
}
