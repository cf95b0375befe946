package io.meteredbatch.core;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A single unit of work. The identity is unique within a batch; the payload fields feed the
 * registry's canonical input hash, so they should hold only identifying inputs.
 */
public final class WorkItem {
    private final String identity;
    private final Map<String, String> payload;

    public WorkItem(String identity, Map<String, String> payload) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity must not be blank");
        }
        this.identity = identity;
        // null values are kept: they hash the same as empty strings
        this.payload = payload == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(payload));
    }

    public static WorkItem of(String identity) {
        return new WorkItem(identity, Map.of());
    }

    public String identity() { return identity; }
    public Map<String, String> payload() { return payload; }

    public String field(String name) { return payload.get(name); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkItem that)) return false;
        return identity.equals(that.identity) && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, payload);
    }

    @Override
    public String toString() {
        return "WorkItem{" +
                "identity='" + identity + '\'' +
                ", payload=" + payload +
                '}';
    }
}
