package io.meteredbatch.core;

import java.util.List;

/**
 * Emits a fixed list of items.
 */
public class ListJobSource implements JobSource {
    private final List<WorkItem> items;

    public ListJobSource(List<WorkItem> items) {
        this.items = List.copyOf(items);
    }

    @Override
    public List<WorkItem> load() {
        return items;
    }
}
