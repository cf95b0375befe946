package io.meteredbatch.core;

import java.util.Map;
import java.util.Objects;

/**
 * Result of one job invocation: success with output references, a recoverable failure, or a
 * fatal signal that aborts the whole batch once the current chunk drains.
 */
public final class JobOutcome {
    public enum Kind { SUCCESS, FAILURE, FATAL }

    private final Kind kind;
    private final Map<String, String> outputs;
    private final String error;

    private JobOutcome(Kind kind, Map<String, String> outputs, String error) {
        this.kind = kind;
        this.outputs = outputs;
        this.error = error;
    }

    public static JobOutcome success(Map<String, String> outputs) {
        return new JobOutcome(Kind.SUCCESS, outputs == null ? Map.of() : Map.copyOf(outputs), null);
    }

    public static JobOutcome success(String outputRef) {
        return success(outputRef == null ? Map.of() : Map.of("output", outputRef));
    }

    public static JobOutcome failure(String error) {
        return new JobOutcome(Kind.FAILURE, Map.of(), error == null ? "unknown error" : error);
    }

    public static JobOutcome fatal(String error) {
        return new JobOutcome(Kind.FATAL, Map.of(), error == null ? "fatal error" : error);
    }

    public Kind kind() { return kind; }
    public Map<String, String> outputs() { return outputs; }
    public String error() { return error; }

    public boolean isSuccess() { return kind == Kind.SUCCESS; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobOutcome that)) return false;
        return kind == that.kind && outputs.equals(that.outputs) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, outputs, error);
    }

    @Override
    public String toString() {
        return "JobOutcome{" +
                "kind=" + kind +
                ", outputs=" + outputs +
                ", error='" + error + '\'' +
                '}';
    }
}
