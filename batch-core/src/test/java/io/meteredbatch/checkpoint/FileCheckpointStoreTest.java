package io.meteredbatch.checkpoint;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class FileCheckpointStoreTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:00Z"), ZoneOffset.UTC);

    @Test
    void save_writes_latest_and_a_backup_per_call() throws Exception {
        Path dir = Files.createTempDirectory("checkpoint-test").resolve("checkpoints");
        FileCheckpointStore store = new FileCheckpointStore(dir, CLOCK);
        assertTrue(store.loadLatest().isEmpty());

        CheckpointResults first = new CheckpointResults(
                List.of(ItemResult.success("acme", 1, "r1", "new_item", Map.of("output", "a"))),
                List.of(),
                List.of(ItemResult.skipped("globex", 2, "r2", "already_processed")));
        Path latest = store.save(Checkpoint.of("20240501_101500", CLOCK.instant(), 1, first, 0.25, CheckpointReason.CHUNK_COMPLETE));
        assertEquals(dir.resolve("checkpoint_latest.json"), latest);

        CheckpointResults second = new CheckpointResults(first.success(),
                List.of(ItemResult.failed("initech", 3, "r3", "retry_failed", "HTTP 500")), first.skipped());
        store.save(Checkpoint.of("20240501_101500", CLOCK.instant(), 2, second, 0.50, CheckpointReason.COMPLETE));

        try (Stream<Path> files = Files.list(dir)) {
            List<String> names = files.map(p -> p.getFileName().toString()).sorted().toList();
            assertEquals(List.of("checkpoint_20240501_101500_000.json", "checkpoint_20240501_101500_000_1.json",
                    "checkpoint_latest.json"), names);
        }

        Optional<Checkpoint> loaded = store.loadLatest();
        assertTrue(loaded.isPresent());
        Checkpoint cp = loaded.get();
        assertEquals(Checkpoint.SCHEMA_VERSION, cp.schemaVersion());
        assertEquals(2, cp.processedCount());
        assertEquals(CheckpointReason.COMPLETE, cp.reason());
        assertEquals(0.50, cp.totalCost(), 1e-9);
        assertEquals("HTTP 500", cp.results().failed().get(0).error());
        assertEquals(1, cp.results().skipped().size());

        String json = Files.readString(latest, StandardCharsets.UTF_8);
        assertTrue(json.contains("\"reason\" : \"complete\""), json);
        assertTrue(json.contains("\"processed_count\" : 2"), json);
    }

    @Test
    void unreadable_latest_is_ignored() throws Exception {
        Path dir = Files.createTempDirectory("checkpoint-test");
        Files.writeString(dir.resolve("checkpoint_latest.json"), "garbage", StandardCharsets.UTF_8);
        assertTrue(new FileCheckpointStore(dir, CLOCK).loadLatest().isEmpty());
    }
}
