package io.meteredbatch.registry;

import io.meteredbatch.core.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Incremental-processing ledger: identity to last outcome, loaded once and written through to
 * the store on every mutation.
 *
 * <p>This class never throws for storage problems. A missing or unreadable store starts an
 * empty registry, and a failed save is logged while the in-memory state stays authoritative.
 */
public class ItemRegistry {
    private static final Logger log = LoggerFactory.getLogger(ItemRegistry.class);

    static final int MAX_ERROR_LENGTH = 500;

    private final RegistryStore store;
    private final Clock clock;
    private final Map<String, RegistryRecord> records;
    private final RegistryLoad.Status loadStatus;

    public ItemRegistry(RegistryStore store) {
        this(store, Clock.systemUTC());
    }

    public ItemRegistry(RegistryStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        RegistryLoad load = store.load();
        this.loadStatus = load.status();
        switch (load.status()) {
            case LOADED -> log.info("Loaded registry with {} items from {}", load.records().size(), store.location());
            case MISSING -> log.info("No existing registry at {}, starting fresh", store.location());
            case DEGRADED -> log.warn("Registry unreadable, starting empty: {}", load.diagnostic());
        }
        this.records = new LinkedHashMap<>(load.records());
    }

    public synchronized ProcessingDecision needsProcessing(WorkItem item, boolean force) {
        if (force) {
            return ProcessingDecision.process(ProcessingReason.FORCED);
        }
        RegistryRecord existing = records.get(item.identity());
        if (existing == null) {
            return ProcessingDecision.process(ProcessingReason.NEW_ITEM);
        }
        if (!CanonicalHash.of(item).equals(existing.lastInputHash())) {
            return ProcessingDecision.process(ProcessingReason.INPUTS_CHANGED);
        }
        if (existing.status() == RegistryStatus.FAILED) {
            return ProcessingDecision.process(ProcessingReason.RETRY_FAILED);
        }
        return ProcessingDecision.skip(ProcessingReason.ALREADY_PROCESSED);
    }

    public synchronized RegistryRecord recordSuccess(WorkItem item, String runId, Map<String, String> outputs) {
        RegistryRecord record = new RegistryRecord(
                item.identity(),
                CanonicalHash.of(item),
                RegistryStatus.SUCCESS,
                Instant.now(clock),
                null,
                runId,
                null,
                outputs == null ? Map.of() : outputs
        );
        records.put(item.identity(), record);
        persist();
        log.debug("Recorded success for {}", item.identity());
        return record;
    }

    public synchronized RegistryRecord recordFailure(WorkItem item, String runId, String error) {
        RegistryRecord previous = records.get(item.identity());
        RegistryRecord record = new RegistryRecord(
                item.identity(),
                CanonicalHash.of(item),
                RegistryStatus.FAILED,
                previous == null ? null : previous.lastSuccessAt(),
                Instant.now(clock),
                runId,
                truncate(error == null ? "unknown error" : error, MAX_ERROR_LENGTH),
                null
        );
        records.put(item.identity(), record);
        persist();
        log.debug("Recorded failure for {}", item.identity());
        return record;
    }

    public synchronized Optional<RegistryRecord> get(String identity) {
        return Optional.ofNullable(records.get(identity));
    }

    public synchronized RegistryStats stats() {
        int success = 0;
        int failed = 0;
        for (RegistryRecord r : records.values()) {
            if (r.status() == RegistryStatus.SUCCESS) success++;
            else if (r.status() == RegistryStatus.FAILED) failed++;
        }
        return new RegistryStats(records.size(), success, failed);
    }

    /** Forget one item so the next batch treats it as new. Returns whether it was known. */
    public synchronized boolean reset(String identity) {
        boolean removed = records.remove(identity) != null;
        if (removed) persist();
        return removed;
    }

    public synchronized void clear() {
        records.clear();
        persist();
        log.info("Registry cleared");
    }

    public synchronized Map<String, RegistryRecord> snapshot() {
        return Map.copyOf(records);
    }

    public RegistryLoad.Status loadStatus() {
        return loadStatus;
    }

    public String location() {
        return store.location();
    }

    private void persist() {
        try {
            store.save(new LinkedHashMap<>(records));
        } catch (Exception e) {
            log.warn("Failed to save registry to {}: {}", store.location(), e.toString());
        }
    }

    static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
