package io.meteredbatch.registry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the registry in memory only; used for dry runs and tests.
 */
public class InMemoryRegistryStore implements RegistryStore {
    private volatile Map<String, RegistryRecord> saved;
    private final AtomicInteger saves = new AtomicInteger();

    public InMemoryRegistryStore() {
        this(null);
    }

    public InMemoryRegistryStore(Map<String, RegistryRecord> initial) {
        this.saved = initial == null ? null : new LinkedHashMap<>(initial);
    }

    @Override
    public RegistryLoad load() {
        Map<String, RegistryRecord> current = saved;
        return current == null ? RegistryLoad.missing() : RegistryLoad.loaded(current);
    }

    @Override
    public void save(Map<String, RegistryRecord> records) {
        saved = new LinkedHashMap<>(records);
        saves.incrementAndGet();
    }

    @Override
    public String location() {
        return "memory";
    }

    public int saveCount() {
        return saves.get();
    }
}
