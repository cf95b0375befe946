package io.meteredbatch.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.meteredbatch.core.Json;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Registry persisted as one JSON document:
 * <pre>{"schema_version": 1, "records": {"&lt;identity&gt;": {...}}}</pre>
 *
 * <p>Unversioned files (a bare identity to record map using {@code last_fail_at} and
 * {@code outputs}) are read as schema 0 and migrated in memory; the next save rewrites them in
 * the current layout. Saves go through a temp file and a rename so a crash never leaves a torn
 * document behind.
 */
public class JsonFileRegistryStore implements RegistryStore {
    public static final int SCHEMA_VERSION = 1;
    private static final Pattern OFFSET_SUFFIX = Pattern.compile("[+-]\\d{2}:\\d{2}$");

    private final Path file;
    private final ObjectMapper mapper = Json.mapper();

    public JsonFileRegistryStore(Path file) {
        this.file = file;
    }

    @Override
    public RegistryLoad load() {
        if (!Files.exists(file)) {
            return RegistryLoad.missing();
        }
        try {
            JsonNode root = mapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
            if (root == null || !root.isObject()) {
                return RegistryLoad.degraded("registry " + file + " is not a JSON object");
            }
            JsonNode version = root.get("schema_version");
            if (version == null) {
                return RegistryLoad.loaded(readRecords((ObjectNode) root, 0));
            }
            if (!version.canConvertToInt() || version.asInt() > SCHEMA_VERSION) {
                return RegistryLoad.degraded("registry " + file + " has unsupported schema_version " + version);
            }
            JsonNode records = root.path("records");
            if (!records.isObject()) {
                return RegistryLoad.degraded("registry " + file + " has no records object");
            }
            return RegistryLoad.loaded(readRecords((ObjectNode) records, version.asInt()));
        } catch (Exception e) {
            return RegistryLoad.degraded("failed to read registry " + file + ": " + e.getMessage());
        }
    }

    private Map<String, RegistryRecord> readRecords(ObjectNode records, int version) throws IOException {
        Map<String, RegistryRecord> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = records.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getValue().isObject()) {
                throw new IOException("record for '" + e.getKey() + "' is not an object");
            }
            ObjectNode node = ((ObjectNode) e.getValue()).deepCopy();
            if (version == 0) migrateFromV0(node);
            if (!node.hasNonNull("identity")) node.put("identity", e.getKey());
            out.put(e.getKey(), mapper.treeToValue(node, RegistryRecord.class));
        }
        return out;
    }

    private static void migrateFromV0(ObjectNode node) {
        rename(node, "last_fail_at", "last_failure_at");
        rename(node, "outputs", "last_outputs");
        assumeUtc(node, "last_success_at");
        assumeUtc(node, "last_failure_at");
    }

    // schema 0 wrote naive UTC timestamps such as 2024-05-01T10:15:30.123456
    private static void assumeUtc(ObjectNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) return;
        String text = value.asText();
        if (!text.endsWith("Z") && !OFFSET_SUFFIX.matcher(text).find()) {
            node.put(field, text + "Z");
        }
    }

    private static void rename(ObjectNode node, String from, String to) {
        JsonNode value = node.remove(from);
        if (value != null && !node.has(to)) node.set(to, value);
    }

    @Override
    public void save(Map<String, RegistryRecord> records) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        ObjectNode root = mapper.createObjectNode();
        root.put("schema_version", SCHEMA_VERSION);
        root.set("records", mapper.valueToTree(records));
        Path tmp = file.resolveSibling(file.getFileName().toString() + ".tmp");
        Files.writeString(tmp, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root), StandardCharsets.UTF_8);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public String location() {
        return file.toString();
    }

    public Path file() {
        return file;
    }
}
