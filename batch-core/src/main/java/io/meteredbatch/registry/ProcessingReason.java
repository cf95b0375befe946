package io.meteredbatch.registry;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProcessingReason {
    FORCED("forced"),
    NEW_ITEM("new_item"),
    INPUTS_CHANGED("inputs_changed"),
    RETRY_FAILED("retry_failed"),
    ALREADY_PROCESSED("already_processed");

    private final String wireName;

    ProcessingReason(String wireName) { this.wireName = wireName; }

    @JsonValue
    public String wireName() { return wireName; }

    @Override
    public String toString() { return wireName; }
}
