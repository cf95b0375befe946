package io.meteredbatch.cli;

import io.meteredbatch.core.WorkItem;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsonLinesItemSourceTest {
    @Test
    void reads_nested_and_flat_lines_skipping_blanks() throws Exception {
        Path file = Files.createTempDirectory("items-test").resolve("items.jsonl");
        Files.writeString(file,
                "{\"identity\": \"acme\", \"payload\": {\"url\": \"https://acme.example\", \"employees\": 120}}\n" +
                "\n" +
                "{\"identity\": \"globex\", \"url\": \"https://globex.example\", \"tags\": [\"a\", \"b\"], \"note\": null}\n",
                StandardCharsets.UTF_8);

        List<WorkItem> items = new JsonLinesItemSource(file).load();

        assertEquals(2, items.size());
        WorkItem acme = items.get(0);
        assertEquals("acme", acme.identity());
        assertEquals("https://acme.example", acme.field("url"));
        assertEquals("120", acme.field("employees"));
        WorkItem globex = items.get(1);
        assertEquals("https://globex.example", globex.field("url"));
        assertEquals("[\"a\",\"b\"]", globex.field("tags"));
        assertTrue(globex.payload().containsKey("note"));
        assertNull(globex.field("note"));
        assertFalse(globex.payload().containsKey("identity"));
    }

    @Test
    void malformed_line_fails_with_its_line_number() throws Exception {
        Path file = Files.createTempDirectory("items-test").resolve("items.jsonl");
        Files.writeString(file, "{\"identity\": \"a\"}\n{\"payload\": {}}\n", StandardCharsets.UTF_8);
        IOException e = assertThrows(IOException.class, () -> new JsonLinesItemSource(file).load());
        assertTrue(e.getMessage().contains(":2:"), e.getMessage());

        Files.writeString(file, "not json\n", StandardCharsets.UTF_8);
        e = assertThrows(IOException.class, () -> new JsonLinesItemSource(file).load());
        assertTrue(e.getMessage().contains(":1: invalid JSON"), e.getMessage());
    }
}
