package io.meteredbatch.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.meteredbatch.core.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Writes {@code checkpoint_latest.json} plus a timestamped backup per save into one directory.
 */
public class FileCheckpointStore implements CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);
    private static final DateTimeFormatter BACKUP_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    static final String LATEST = "checkpoint_latest.json";

    private final Path dir;
    private final Clock clock;
    private final ObjectMapper mapper = Json.mapper();

    public FileCheckpointStore(Path dir, Clock clock) {
        this.dir = dir;
        this.clock = clock;
    }

    @Override
    public synchronized Path save(Checkpoint checkpoint) throws IOException {
        Files.createDirectories(dir);
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(checkpoint);
        Path latest = dir.resolve(LATEST);
        Path tmp = dir.resolve(LATEST + ".tmp");
        Files.writeString(tmp, json, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, latest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, latest, StandardCopyOption.REPLACE_EXISTING);
        }
        String suffix = BACKUP_SUFFIX.format(LocalDateTime.ofInstant(clock.instant(), clock.getZone()));
        Path backup = dir.resolve("checkpoint_" + suffix + ".json");
        for (int n = 1; Files.exists(backup); n++) {
            backup = dir.resolve("checkpoint_" + suffix + "_" + n + ".json");
        }
        Files.writeString(backup, json, StandardCharsets.UTF_8);
        log.info("[CHECKPOINT] Saved at {} items ({})", checkpoint.processedCount(), checkpoint.reason());
        return latest;
    }

    @Override
    public Optional<Checkpoint> loadLatest() {
        Path latest = dir.resolve(LATEST);
        if (!Files.exists(latest)) return Optional.empty();
        try {
            return Optional.of(mapper.readValue(Files.readString(latest, StandardCharsets.UTF_8), Checkpoint.class));
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring unreadable checkpoint {}: {}", latest, e.toString());
            return Optional.empty();
        }
    }

    @Override
    public Path latestLocation() {
        return dir.resolve(LATEST);
    }
}
