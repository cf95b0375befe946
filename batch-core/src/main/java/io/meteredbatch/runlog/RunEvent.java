package io.meteredbatch.runlog;

import java.time.Instant;

/**
 * One entry of the run trail. Duration is set on terminal events only.
 */
public record RunEvent(
        String runId,
        RunEventKind kind,
        String identity,
        Instant timestamp,
        Double durationSeconds,
        String details
) {}
