package io.meteredbatch.checkpoint;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CheckpointReason {
    CHUNK_COMPLETE("chunk_complete"),
    COMPLETE("complete"),
    BUDGET("budget"),
    FATAL_ERROR("fatal_error");

    private final String wireName;

    CheckpointReason(String wireName) { this.wireName = wireName; }

    @JsonValue
    public String wireName() { return wireName; }

    @Override
    public String toString() { return wireName; }
}
