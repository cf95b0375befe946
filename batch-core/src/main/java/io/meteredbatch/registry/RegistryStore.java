package io.meteredbatch.registry;

import java.io.IOException;
import java.util.Map;

/**
 * Durable backing for the item registry: one serialized mapping, rewritten in full on every save.
 */
public interface RegistryStore {
    RegistryLoad load();

    void save(Map<String, RegistryRecord> records) throws IOException;

    /** Human-readable location for logs and summaries. */
    String location();
}
