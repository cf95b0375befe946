package io.meteredbatch.runlog;

import java.io.IOException;
import java.nio.file.Path;

public interface RunEventSink {
    void write(RunEvent event) throws IOException;

    /** File currently written to. */
    Path location();
}
