package io.meteredbatch.runtime;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StopReason {
    COMPLETED("completed"),
    BUDGET("budget"),
    FATAL_ERROR("fatal_error");

    private final String wireName;

    StopReason(String wireName) { this.wireName = wireName; }

    @JsonValue
    public String wireName() { return wireName; }

    @Override
    public String toString() { return wireName; }
}
