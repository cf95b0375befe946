package io.meteredbatch.runlog;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunEventKind {
    START("start"),
    SKIP("skip"),
    SUCCESS("success"),
    FAIL("fail");

    private final String wireName;

    RunEventKind(String wireName) { this.wireName = wireName; }

    @JsonValue
    public String wireName() { return wireName; }

    public boolean isTerminal() { return this != START; }
}
