package io.meteredbatch.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin facade over a Dropwizard registry; every batch metric name is prefixed here.
 */
public class Metrics {
    public static final String ITEM_TIME = "batch.item.time";
    public static final String ITEM_SUCCESS = "batch.item.success";
    public static final String ITEM_FAILED = "batch.item.failed";
    public static final String ITEM_SKIPPED = "batch.item.skipped";
    public static final String ITEM_RETRIED = "batch.item.retried";
    public static final String CHUNK_TIME = "batch.chunk.time";
    public static final String CHECKPOINT_FAILURES = "batch.checkpoint.failures";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }
}
