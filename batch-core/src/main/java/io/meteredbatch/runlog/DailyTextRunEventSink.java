package io.meteredbatch.runlog;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Human-readable trail, one file per calendar day ({@code batch_yyyyMMdd.log}):
 * <pre>[2024-05-01 10:15:30] [20240501_101500_001_acme] [SUCCESS ] acme | duration=3.20s</pre>
 */
public class DailyTextRunEventSink implements RunEventSink {
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path dir;
    private final Clock clock;

    public DailyTextRunEventSink(Path dir, Clock clock) throws IOException {
        this.dir = dir;
        this.clock = clock;
        Files.createDirectories(dir);
    }

    @Override
    public synchronized void write(RunEvent event) throws IOException {
        LocalDateTime at = LocalDateTime.ofInstant(event.timestamp(), clock.getZone());
        StringBuilder line = new StringBuilder()
                .append('[').append(TIME.format(at)).append("] ")
                .append('[').append(event.runId()).append("] ")
                .append('[').append(String.format(Locale.ROOT, "%-8s", event.kind().name())).append("] ")
                .append(event.identity());
        if (event.details() != null) {
            line.append(" | ").append(event.details());
        }
        line.append(System.lineSeparator());
        Files.writeString(fileFor(at), line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private Path fileFor(LocalDateTime at) {
        return dir.resolve("batch_" + DAY.format(at) + ".log");
    }

    @Override
    public Path location() {
        return fileFor(LocalDateTime.now(clock));
    }
}
