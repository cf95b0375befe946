package io.meteredbatch.core;

import java.util.List;

/**
 * Produces the finite, ordered list of items for one batch invocation.
 */
public interface JobSource {
    List<WorkItem> load() throws Exception;
}
