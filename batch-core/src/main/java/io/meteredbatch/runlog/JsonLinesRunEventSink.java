package io.meteredbatch.runlog;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.meteredbatch.core.Json;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Machine-readable trail for one batch: one JSON record per line, keyed by {@code run_id}.
 */
public class JsonLinesRunEventSink implements RunEventSink {
    private final Path file;
    private final ObjectMapper mapper = Json.mapper();

    public JsonLinesRunEventSink(Path file) throws IOException {
        this.file = file;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    @Override
    public synchronized void write(RunEvent event) throws IOException {
        String line = mapper.writeValueAsString(event);
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            w.write(line);
            w.newLine();
        }
    }

    /** Reads every event back; blank lines are ignored. */
    public synchronized List<RunEvent> readAll() throws IOException {
        List<RunEvent> out = new ArrayList<>();
        if (!Files.exists(file)) return out;
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                if (line.isBlank()) continue;
                out.add(mapper.readValue(line, RunEvent.class));
            }
        }
        return out;
    }

    @Override
    public Path location() {
        return file;
    }
}
