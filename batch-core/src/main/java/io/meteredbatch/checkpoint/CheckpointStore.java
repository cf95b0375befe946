package io.meteredbatch.checkpoint;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public interface CheckpointStore {
    /** Persists the checkpoint and returns where the latest snapshot lives. */
    Path save(Checkpoint checkpoint) throws IOException;

    Optional<Checkpoint> loadLatest();

    Path latestLocation();
}
