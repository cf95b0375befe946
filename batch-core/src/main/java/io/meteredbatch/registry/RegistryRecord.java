package io.meteredbatch.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Last known processing outcome of one item. {@code lastInputHash} always reflects the inputs of
 * the most recent attempt, whether it succeeded or failed.
 *
 * <p>Optional fields are null when absent: a success carries no error or failure time, a failure
 * carries no outputs but keeps the time of the last earlier success.
 */
public record RegistryRecord(
        String identity,
        String lastInputHash,
        RegistryStatus status,
        Instant lastSuccessAt,
        Instant lastFailureAt,
        String lastRunId,
        String lastError,
        Map<String, String> lastOutputs
) {
    public RegistryRecord {
        lastOutputs = lastOutputs == null ? null : withoutNullValues(lastOutputs);
    }

    private static Map<String, String> withoutNullValues(Map<String, String> outputs) {
        Map<String, String> kept = new LinkedHashMap<>();
        outputs.forEach((name, location) -> {
            if (name != null && location != null) kept.put(name, location);
        });
        return Collections.unmodifiableMap(kept);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == RegistryStatus.SUCCESS;
    }
}
