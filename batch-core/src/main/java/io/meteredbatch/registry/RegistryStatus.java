package io.meteredbatch.registry;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RegistryStatus {
    SUCCESS("success"),
    FAILED("failed");

    private final String wireName;

    RegistryStatus(String wireName) { this.wireName = wireName; }

    @JsonValue
    public String wireName() { return wireName; }
}
