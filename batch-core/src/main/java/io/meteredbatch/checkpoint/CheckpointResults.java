package io.meteredbatch.checkpoint;

import java.util.List;

public record CheckpointResults(List<ItemResult> success, List<ItemResult> failed, List<ItemResult> skipped) {
    public CheckpointResults {
        success = success == null ? List.of() : List.copyOf(success);
        failed = failed == null ? List.of() : List.copyOf(failed);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public static CheckpointResults empty() {
        return new CheckpointResults(List.of(), List.of(), List.of());
    }
}
