package io.meteredbatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.meteredbatch.core.JobSource;
import io.meteredbatch.core.Json;
import io.meteredbatch.core.WorkItem;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads work items from a JSON Lines file, one object per line.
 *
 * <p>A line either carries {@code {"identity": ..., "payload": {...}}} or is flat, in which case
 * every field other than {@code identity} becomes a payload field. Non-text values are kept as
 * their JSON text. Blank lines are ignored; a malformed line fails the whole load.
 */
public class JsonLinesItemSource implements JobSource {
    private final Path file;
    private final ObjectMapper mapper = Json.mapper();

    public JsonLinesItemSource(Path file) {
        this.file = file;
    }

    @Override
    public List<WorkItem> load() throws IOException {
        List<WorkItem> items = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                items.add(parse(line, lineNo));
            }
        }
        return items;
    }

    private WorkItem parse(String line, int lineNo) throws IOException {
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new IOException(file + ":" + lineNo + ": invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IOException(file + ":" + lineNo + ": expected a JSON object");
        }
        JsonNode identity = node.get("identity");
        if (identity == null || !identity.isValueNode() || identity.asText().isBlank()) {
            throw new IOException(file + ":" + lineNo + ": missing 'identity'");
        }
        JsonNode fields = node.has("payload") ? node.get("payload") : node;
        Map<String, String> payload = new LinkedHashMap<>();
        if (fields.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> f = it.next();
                if (fields == node && f.getKey().equals("identity")) continue;
                payload.put(f.getKey(), text(f.getValue()));
            }
        }
        return new WorkItem(identity.asText(), payload);
    }

    private static String text(JsonNode value) {
        if (value.isNull()) return null;
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
