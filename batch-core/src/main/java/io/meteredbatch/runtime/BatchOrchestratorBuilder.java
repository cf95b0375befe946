package io.meteredbatch.runtime;

import com.codahale.metrics.MetricRegistry;
import io.meteredbatch.budget.CostMeter;
import io.meteredbatch.budget.RateLimiters;
import io.meteredbatch.checkpoint.CheckpointStore;
import io.meteredbatch.config.BatchConfig;
import io.meteredbatch.core.JobFunction;
import io.meteredbatch.core.JobSource;
import io.meteredbatch.metrics.Metrics;
import io.meteredbatch.registry.ItemRegistry;
import io.meteredbatch.retry.ExponentialBackoffRetryPolicy;
import io.meteredbatch.retry.RetryPolicy;
import io.meteredbatch.runlog.RunLogger;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

public class BatchOrchestratorBuilder {
    private JobSource source;
    private JobFunction job;
    private ItemRegistry registry;
    private RunLogger runLogger;
    private CheckpointStore checkpoints;
    private CostMeter costMeter = CostMeter.unlimited(Map.of());
    private RateLimiters rateLimiters = RateLimiters.none();
    private RetryPolicy retryPolicy = RetryPolicy.none();
    private int workers = 8;
    private int chunkSize = 50;
    private boolean force;
    private int limit;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private Clock clock = Clock.systemUTC();

    public BatchOrchestratorBuilder source(JobSource s) { this.source = s; return this; }
    public BatchOrchestratorBuilder job(JobFunction j) { this.job = j; return this; }
    public BatchOrchestratorBuilder registry(ItemRegistry r) { this.registry = r; return this; }
    public BatchOrchestratorBuilder runLogger(RunLogger r) { this.runLogger = r; return this; }
    public BatchOrchestratorBuilder checkpoints(CheckpointStore c) { this.checkpoints = c; return this; }
    public BatchOrchestratorBuilder costMeter(CostMeter c) { this.costMeter = c; return this; }
    public BatchOrchestratorBuilder rateLimiters(RateLimiters r) { this.rateLimiters = r; return this; }
    public BatchOrchestratorBuilder retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public BatchOrchestratorBuilder workers(int w) { this.workers = Math.max(1, w); return this; }
    public BatchOrchestratorBuilder chunkSize(int n) { this.chunkSize = Math.max(1, n); return this; }
    public BatchOrchestratorBuilder force(boolean f) { this.force = f; return this; }
    public BatchOrchestratorBuilder limit(int n) { this.limit = Math.max(0, n); return this; }
    public BatchOrchestratorBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public BatchOrchestratorBuilder clock(Clock c) { this.clock = c; return this; }

    /** Copies the run settings (workers, chunk size, force, limit, retry attempts) from a config. */
    public BatchOrchestratorBuilder config(BatchConfig config) {
        workers(config.workers());
        chunkSize(config.chunkSize());
        force(config.force());
        limit(config.limit());
        if (config.maxAttempts() > 1) {
            retry(new ExponentialBackoffRetryPolicy(config.maxAttempts(), 200, 5_000));
        }
        return this;
    }

    public BatchOrchestrator build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(runLogger, "runLogger");
        Objects.requireNonNull(checkpoints, "checkpoints");
        return new BatchOrchestrator(source, job, registry, runLogger, checkpoints, costMeter, rateLimiters,
                retryPolicy, workers, chunkSize, force, limit, new Metrics(metricRegistry), clock);
    }
}
