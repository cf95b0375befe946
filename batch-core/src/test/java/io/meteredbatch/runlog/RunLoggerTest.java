package io.meteredbatch.runlog;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RunLoggerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:00Z"), ZoneOffset.UTC);

    @Test
    void writes_start_and_one_terminal_event_to_both_sinks() throws Exception {
        Path dir = Files.createTempDirectory("runlog-test");
        RunLogger logger = RunLogger.create(dir, CLOCK.instant(), CLOCK);
        assertEquals("20240501_101500", logger.batchTimestamp());
        assertEquals(dir.resolve("run_20240501_101500.jsonl"), logger.structuredLog());
        assertEquals(dir.resolve("batch_20240501.log"), logger.dailyLog());

        String ok = logger.start("Acme Corp", 1, "reason=new_item");
        assertEquals("20240501_101500_001_acme-corp", ok);
        assertEquals(1, logger.inFlight());
        logger.success(ok, Map.of("output", "acme.json"));
        assertEquals(0, logger.inFlight());

        String bad = logger.start("globex", 2, null);
        logger.fail(bad, "HTTP 500");

        List<RunEvent> events = new JsonLinesRunEventSink(logger.structuredLog()).readAll();
        assertEquals(4, events.size());
        assertEquals(RunEventKind.START, events.get(0).kind());
        assertNull(events.get(0).durationSeconds());
        assertEquals(RunEventKind.SUCCESS, events.get(1).kind());
        assertEquals(0.0, events.get(1).durationSeconds(), 0.0);
        assertEquals(RunEventKind.FAIL, events.get(3).kind());
        assertTrue(events.get(3).details().contains("error=HTTP 500"));

        List<String> lines = Files.readAllLines(logger.dailyLog(), StandardCharsets.UTF_8);
        assertEquals(4, lines.size());
        assertEquals("[2024-05-01 10:15:00] [20240501_101500_001_acme-corp] [START   ] Acme Corp | reason=new_item", lines.get(0));
        assertTrue(lines.get(1).startsWith("[2024-05-01 10:15:00] [20240501_101500_001_acme-corp] [SUCCESS ] Acme Corp | duration=0.00s"), lines.get(1));

        String json = Files.readAllLines(logger.structuredLog(), StandardCharsets.UTF_8).get(1);
        assertTrue(json.contains("\"run_id\":\"20240501_101500_001_acme-corp\""), json);
        assertTrue(json.contains("\"kind\":\"success\""), json);
    }

    @Test
    void batches_started_in_the_same_second_get_separate_trails() throws Exception {
        Path dir = Files.createTempDirectory("runlog-test");
        RunLogger first = RunLogger.create(dir, CLOCK.instant(), CLOCK);
        first.success(first.start("acme", 1, null), Map.of());

        RunLogger second = RunLogger.create(dir, CLOCK.instant(), CLOCK);
        assertEquals("20240501_101500-2", second.batchTimestamp());
        assertEquals(dir.resolve("run_20240501_101500-2.jsonl"), second.structuredLog());
        String runId = second.start("acme", 1, null);
        assertEquals("20240501_101500-2_001_acme", runId);
        second.fail(runId, "timeout");

        assertEquals(new RunLogSummary(1, 0, 1, 0, 0.0), first.summary());
        assertEquals(new RunLogSummary(1, 0, 0, 1, 0.0), second.summary());
        assertEquals("20240501_101500-3", RunLogger.create(dir, CLOCK.instant(), CLOCK).batchTimestamp());
    }

    @Test
    void second_terminal_event_and_unknown_ids_are_ignored() throws Exception {
        RunLogger logger = RunLogger.create(Files.createTempDirectory("runlog-test"), CLOCK.instant(), CLOCK);
        String id = logger.start("acme", 1, null);
        logger.skip(id, "already_processed");
        logger.success(id, Map.of());
        logger.fail("no-such-run", "boom");
        logger.fail(null, "boom");

        RunLogSummary summary = logger.summary();
        assertEquals(new RunLogSummary(1, 1, 0, 0, 0.0), summary);
    }

    @Test
    void fail_details_are_truncated() throws Exception {
        RunLogger logger = RunLogger.create(Files.createTempDirectory("runlog-test"), CLOCK.instant(), CLOCK);
        String id = logger.start("acme", 1, null);
        logger.fail(id, "e".repeat(1_000));
        RunEvent fail = new JsonLinesRunEventSink(logger.structuredLog()).readAll().get(1);
        assertTrue(fail.details().endsWith("error=" + "e".repeat(RunLogger.MAX_ERROR_DETAIL)), fail.details());
    }

    @Test
    void summary_counts_every_kind() throws Exception {
        RunLogger logger = RunLogger.create(Files.createTempDirectory("runlog-test"), CLOCK.instant(), CLOCK);
        for (int i = 1; i <= 5; i++) {
            String id = logger.start("item-" + i, i, null);
            if (i <= 2) logger.success(id, Map.of());
            else if (i == 3) logger.fail(id, "x");
            else logger.skip(id, "already_processed");
        }
        RunLogSummary s = logger.summary();
        assertEquals(5, s.start());
        assertEquals(2, s.success());
        assertEquals(1, s.fail());
        assertEquals(2, s.skip());
    }
}
