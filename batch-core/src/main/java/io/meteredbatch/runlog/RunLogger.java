package io.meteredbatch.runlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only trail of item attempts. Each run id gets exactly one {@code start} followed by
 * exactly one of {@code skip}, {@code success} or {@code fail}; a terminal call for an unknown
 * or already finished run id is logged and ignored.
 *
 * <p>Every event goes to the daily human log and to the per-batch JSON Lines stream. Write
 * failures on either sink are logged and do not interrupt the batch.
 */
public class RunLogger {
    private static final Logger log = LoggerFactory.getLogger(RunLogger.class);
    private static final DateTimeFormatter BATCH_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final int MAX_ERROR_DETAIL = 200;

    private final String batchTimestamp;
    private final Clock clock;
    private final RunEventSink humanSink;
    private final JsonLinesRunEventSink structuredSink;
    private final Map<String, InFlight> runs = new ConcurrentHashMap<>();

    private record InFlight(String identity, Instant startedAt) {}

    public RunLogger(String batchTimestamp, Clock clock, RunEventSink humanSink, JsonLinesRunEventSink structuredSink) {
        this.batchTimestamp = batchTimestamp;
        this.clock = clock;
        this.humanSink = humanSink;
        this.structuredSink = structuredSink;
    }

    /**
     * Daily log and {@code run_<batch timestamp>.jsonl} under {@code logsDir}. When another batch
     * started in the same second already owns that file, the timestamp gets a {@code -2},
     * {@code -3}, ... suffix so run ids and the structured trail stay per batch.
     */
    public static RunLogger create(Path logsDir, Instant batchStart, Clock clock) throws IOException {
        String ts = claimBatchTimestamp(logsDir, batchTimestamp(batchStart, clock));
        RunLogger logger = new RunLogger(ts, clock,
                new DailyTextRunEventSink(logsDir, clock),
                new JsonLinesRunEventSink(logsDir.resolve("run_" + ts + ".jsonl")));
        log.info("Daily run log: {}", logger.dailyLog());
        log.info("Structured run log: {}", logger.structuredLog());
        return logger;
    }

    private static String claimBatchTimestamp(Path logsDir, String base) throws IOException {
        Files.createDirectories(logsDir);
        String ts = base;
        for (int n = 2; ; n++) {
            try {
                Files.createFile(logsDir.resolve("run_" + ts + ".jsonl"));
                return ts;
            } catch (FileAlreadyExistsException e) {
                ts = base + "-" + n;
            }
        }
    }

    public static String batchTimestamp(Instant at, Clock clock) {
        return BATCH_TIMESTAMP.format(LocalDateTime.ofInstant(at, clock.getZone()));
    }

    public String batchTimestamp() {
        return batchTimestamp;
    }

    /**
     * Opens a run for the item at {@code index} (its position in the batch) and returns its id.
     */
    public String start(String identity, int index, String details) {
        String runId = RunIds.of(batchTimestamp, index, identity);
        Instant now = clock.instant();
        runs.put(runId, new InFlight(identity, now));
        write(new RunEvent(runId, RunEventKind.START, identity, now, null, details));
        log.debug("[START] run_id={}", runId);
        return runId;
    }

    public void skip(String runId, String reason) {
        InFlight run = finish(runId);
        if (run == null) return;
        write(terminal(runId, RunEventKind.SKIP, run, "reason=" + reason));
        log.debug("[SKIP] {} {}", run.identity(), reason);
    }

    public void success(String runId, Map<String, String> outputs) {
        InFlight run = finish(runId);
        if (run == null) return;
        double seconds = secondsSince(run.startedAt());
        String details = String.format(Locale.ROOT, "duration=%.2fs", seconds);
        if (outputs != null && !outputs.isEmpty()) {
            details += " | outputs=" + outputs.size();
        }
        write(terminal(runId, RunEventKind.SUCCESS, run, details));
        log.info("[SUCCESS] {} in {}s", run.identity(), String.format(Locale.ROOT, "%.2f", seconds));
    }

    public void fail(String runId, String error) {
        InFlight run = finish(runId);
        if (run == null) return;
        String text = error == null ? "unknown error" : error;
        String shortError = text.length() > MAX_ERROR_DETAIL ? text.substring(0, MAX_ERROR_DETAIL) : text;
        double seconds = secondsSince(run.startedAt());
        String details = String.format(Locale.ROOT, "duration=%.2fs | error=%s", seconds, shortError);
        write(terminal(runId, RunEventKind.FAIL, run, details));
        log.warn("[FAIL] {} after {}s: {}", run.identity(), String.format(Locale.ROOT, "%.2f", seconds), shortError);
    }

    /** Runs started but not yet terminated. */
    public int inFlight() {
        return runs.size();
    }

    public Path dailyLog() {
        return humanSink.location();
    }

    public Path structuredLog() {
        return structuredSink.location();
    }

    /** Counts events of this batch by re-reading the structured stream. */
    public RunLogSummary summary() {
        int start = 0, skip = 0, success = 0, fail = 0;
        double duration = 0.0;
        List<RunEvent> events;
        try {
            events = structuredSink.readAll();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to read structured log {} for summary: {}", structuredSink.location(), e.toString());
            return RunLogSummary.EMPTY;
        }
        for (RunEvent e : events) {
            switch (e.kind()) {
                case START -> start++;
                case SKIP -> skip++;
                case SUCCESS -> success++;
                case FAIL -> fail++;
            }
            if ((e.kind() == RunEventKind.SUCCESS || e.kind() == RunEventKind.FAIL) && e.durationSeconds() != null) {
                duration += e.durationSeconds();
            }
        }
        return new RunLogSummary(start, skip, success, fail, duration);
    }

    private InFlight finish(String runId) {
        InFlight run = runId == null ? null : runs.remove(runId);
        if (run == null) {
            log.warn("Unknown run_id: {}", runId);
        }
        return run;
    }

    private RunEvent terminal(String runId, RunEventKind kind, InFlight run, String details) {
        Instant now = clock.instant();
        double seconds = Math.round(Duration.between(run.startedAt(), now).toMillis() / 10.0) / 100.0;
        return new RunEvent(runId, kind, run.identity(), now, seconds, details);
    }

    private double secondsSince(Instant startedAt) {
        return Duration.between(startedAt, clock.instant()).toMillis() / 1000.0;
    }

    private void write(RunEvent event) {
        try {
            humanSink.write(event);
        } catch (IOException e) {
            log.warn("Failed to write daily log {}: {}", humanSink.location(), e.toString());
        }
        try {
            structuredSink.write(event);
        } catch (IOException e) {
            log.warn("Failed to write structured log {}: {}", structuredSink.location(), e.toString());
        }
    }
}
