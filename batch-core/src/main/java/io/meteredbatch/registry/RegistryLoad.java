package io.meteredbatch.registry;

import java.util.Map;

/**
 * Outcome of reading the registry's backing store. A degraded load carries the diagnostic that
 * explains why the store could not be read; callers decide how loudly to report it.
 */
public final class RegistryLoad {
    public enum Status { LOADED, MISSING, DEGRADED }

    private final Status status;
    private final Map<String, RegistryRecord> records;
    private final String diagnostic;

    private RegistryLoad(Status status, Map<String, RegistryRecord> records, String diagnostic) {
        this.status = status;
        this.records = records;
        this.diagnostic = diagnostic;
    }

    public static RegistryLoad loaded(Map<String, RegistryRecord> records) {
        return new RegistryLoad(Status.LOADED, Map.copyOf(records), null);
    }

    public static RegistryLoad missing() {
        return new RegistryLoad(Status.MISSING, Map.of(), null);
    }

    public static RegistryLoad degraded(String diagnostic) {
        return new RegistryLoad(Status.DEGRADED, Map.of(), diagnostic);
    }

    public Status status() { return status; }

    /** Loaded records; always empty unless the status is {@link Status#LOADED}. */
    public Map<String, RegistryRecord> records() { return records; }

    public String diagnostic() { return diagnostic; }

    public boolean isDegraded() { return status == Status.DEGRADED; }
}
