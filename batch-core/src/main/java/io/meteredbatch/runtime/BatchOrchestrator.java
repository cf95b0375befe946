package io.meteredbatch.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.meteredbatch.budget.BudgetExceededException;
import io.meteredbatch.budget.CostMeter;
import io.meteredbatch.budget.RateLimiters;
import io.meteredbatch.checkpoint.Checkpoint;
import io.meteredbatch.checkpoint.CheckpointReason;
import io.meteredbatch.checkpoint.CheckpointResults;
import io.meteredbatch.checkpoint.CheckpointStore;
import io.meteredbatch.checkpoint.ItemResult;
import io.meteredbatch.core.JobContext;
import io.meteredbatch.core.JobFunction;
import io.meteredbatch.core.JobOutcome;
import io.meteredbatch.core.JobSource;
import io.meteredbatch.core.WorkItem;
import io.meteredbatch.metrics.Metrics;
import io.meteredbatch.registry.ItemRegistry;
import io.meteredbatch.registry.ProcessingDecision;
import io.meteredbatch.registry.ProcessingReason;
import io.meteredbatch.retry.RetryPolicy;
import io.meteredbatch.runlog.RunLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives a finite list of work items through a job function with bounded concurrency.
 *
 * <p>Items already processed with identical inputs are skipped via the registry. The rest are
 * split into chunks; each chunk is dispatched to a fixed pool of workers, collected in
 * completion order and followed by a checkpoint. A budget stop or a fatal job outcome stops
 * dispatch of further chunks once the current one has drained. Budget stops return normally with
 * {@link StopReason#BUDGET}; fatal stops throw {@link BatchAbortedException}.
 *
 * <p>An instance runs once.
 */
public class BatchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final JobSource source;
    private final JobFunction job;
    private final ItemRegistry registry;
    private final RunLogger runLogger;
    private final CheckpointStore checkpoints;
    private final CostMeter costMeter;
    private final RateLimiters rateLimiters;
    private final RetryPolicy retryPolicy;
    private final int workers;
    private final int chunkSize;
    private final boolean force;
    private final int limit;
    private final Metrics metrics;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean budgetHit = new AtomicBoolean(false);
    private final AtomicReference<String> fatalMessage = new AtomicReference<>();
    private final AtomicReference<Throwable> fatalCause = new AtomicReference<>();
    private volatile BatchState state = BatchState.PENDING;

    private final Timer itemTimer;
    private final Timer chunkTimer;
    private final Meter successMeter;
    private final Meter failedMeter;
    private final Meter skippedMeter;
    private final Meter retriedMeter;

    /** An item that passed the registry filter, with its 1-based position in the batch. */
    private record Pending(WorkItem item, int index, ProcessingReason reason) {}

    private record Completed(ItemResult result, boolean success) {}

    public BatchOrchestrator(JobSource source,
                             JobFunction job,
                             ItemRegistry registry,
                             RunLogger runLogger,
                             CheckpointStore checkpoints,
                             CostMeter costMeter,
                             RateLimiters rateLimiters,
                             RetryPolicy retryPolicy,
                             int workers,
                             int chunkSize,
                             boolean force,
                             int limit,
                             Metrics metrics,
                             Clock clock) {
        this.source = Objects.requireNonNull(source);
        this.job = Objects.requireNonNull(job);
        this.registry = Objects.requireNonNull(registry);
        this.runLogger = Objects.requireNonNull(runLogger);
        this.checkpoints = Objects.requireNonNull(checkpoints);
        this.costMeter = Objects.requireNonNull(costMeter);
        this.rateLimiters = Objects.requireNonNull(rateLimiters);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.workers = Math.max(1, workers);
        this.chunkSize = Math.max(1, chunkSize);
        this.force = force;
        this.limit = Math.max(0, limit);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
        this.itemTimer = metrics.timer(Metrics.ITEM_TIME);
        this.chunkTimer = metrics.timer(Metrics.CHUNK_TIME);
        this.successMeter = metrics.meter(Metrics.ITEM_SUCCESS);
        this.failedMeter = metrics.meter(Metrics.ITEM_FAILED);
        this.skippedMeter = metrics.meter(Metrics.ITEM_SKIPPED);
        this.retriedMeter = metrics.meter(Metrics.ITEM_RETRIED);
    }

    public BatchState state() { return state; }

    /**
     * Runs the batch to completion, budget stop or fatal abort.
     *
     * @throws BatchAbortedException on a fatal job outcome or when the job source fails
     * @throws IllegalStateException if this orchestrator already ran
     */
    public BatchSummary run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("batch already started");
        }
        Instant startedAt = clock.instant();
        String batchId = runLogger.batchTimestamp();
        List<ItemResult> success = new ArrayList<>();
        List<ItemResult> failed = new ArrayList<>();
        List<ItemResult> skipped = new ArrayList<>();

        state = BatchState.LOADING_ITEMS;
        checkpoints.loadLatest().ifPresent(cp -> log.info(
                "Previous checkpoint: batch {} stopped at {} items ({})", cp.batchId(), cp.processedCount(), cp.reason()));

        List<WorkItem> items;
        try {
            items = uniqueByIdentity(source.load());
        } catch (Exception e) {
            state = BatchState.ABORTED;
            String msg = "Failed to load work items: " + e.getMessage();
            log.error(msg, e);
            BatchSummary summary = summary(batchId, StopReason.FATAL_ERROR, 0, success, failed, skipped, 0, startedAt, null, msg);
            throw new BatchAbortedException(msg, summary, e);
        }
        if (limit > 0 && items.size() > limit) {
            log.info("Limiting batch to first {} of {} items", limit, items.size());
            items = items.subList(0, limit);
        }

        List<Pending> pending = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            WorkItem item = items.get(i);
            int index = i + 1;
            ProcessingDecision decision = registry.needsProcessing(item, force);
            if (decision.needed()) {
                pending.add(new Pending(item, index, decision.reason()));
            } else {
                String runId = runLogger.start(item.identity(), index, "reason=" + decision.reason());
                runLogger.skip(runId, decision.reason().wireName());
                skipped.add(ItemResult.skipped(item.identity(), index, runId, decision.reason().wireName()));
                skippedMeter.mark();
            }
        }
        logEstimate(items.size(), pending.size(), skipped.size());

        if (pending.isEmpty()) {
            state = BatchState.DONE;
            log.info("Nothing to process: all {} items are up to date", items.size());
            return summary(batchId, StopReason.COMPLETED, items.size(), success, failed, skipped, 0, startedAt, null, null);
        }

        state = BatchState.CHUNKING;
        List<List<Pending>> chunks = new ArrayList<>();
        for (int from = 0; from < pending.size(); from += chunkSize) {
            chunks.add(pending.subList(from, Math.min(pending.size(), from + chunkSize)));
        }

        ExecutorService workerPool = Executors.newFixedThreadPool(workers);
        int processed = 0;
        Path checkpointLocation = null;
        try {
            for (int c = 0; c < chunks.size(); c++) {
                List<Pending> chunk = chunks.get(c);
                try (Timer.Context ignored = chunkTimer.time()) {
                    state = BatchState.DISPATCHING;
                    ExecutorCompletionService<Completed> completion = new ExecutorCompletionService<>(workerPool);
                    for (Pending p : chunk) {
                        completion.submit(() -> process(p));
                    }

                    state = BatchState.AWAITING_WORKERS;
                    boolean interrupted = false;
                    for (int n = 0; n < chunk.size() && !interrupted; n++) {
                        try {
                            Completed done = completion.take().get();
                            if (done.success()) success.add(done.result());
                            else failed.add(done.result());
                            processed++;
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            markFatal("interrupted while awaiting workers", null);
                            interrupted = true;
                        } catch (ExecutionException e) {
                            // process() turns job errors into outcomes; this is a failure in its own bookkeeping
                            log.error("Worker failed outside the job function", e.getCause());
                            markFatal("worker failed: " + describe(e.getCause()), e.getCause());
                        }
                    }
                }

                boolean last = c == chunks.size() - 1;
                boolean overBudget = budgetHit.get() || costMeter.isExceeded();
                CheckpointReason reason = fatalMessage.get() != null ? CheckpointReason.FATAL_ERROR
                        : overBudget ? CheckpointReason.BUDGET
                        : last ? CheckpointReason.COMPLETE
                        : CheckpointReason.CHUNK_COMPLETE;

                state = BatchState.CHECKPOINTING;
                Path saved = saveCheckpoint(batchId, processed, success, failed, skipped, reason);
                if (saved != null) checkpointLocation = saved;
                log.info("[PROGRESS] Chunk {}/{}: {} ok, {} failed, {} skipped | cost {}",
                        c + 1, chunks.size(), success.size(), failed.size(), skipped.size(), costMeter.progress());

                if (reason == CheckpointReason.FATAL_ERROR || reason == CheckpointReason.BUDGET) {
                    int notDispatched = pending.size() - processed;
                    if (notDispatched > 0) {
                        log.warn("Stopping dispatch: {} items not dispatched", notDispatched);
                    }
                    break;
                }
            }
        } finally {
            workerPool.shutdown();
        }

        String fatal = fatalMessage.get();
        if (fatal != null) {
            state = BatchState.ABORTED;
            BatchSummary summary = summary(batchId, StopReason.FATAL_ERROR, items.size(), success, failed, skipped,
                    processed, startedAt, checkpointLocation, fatal);
            log.error("[FATAL] Batch aborted: {}", fatal);
            throw new BatchAbortedException("Batch aborted: " + fatal, summary, fatalCause.get());
        }
        if (budgetHit.get() || costMeter.isExceeded()) {
            state = BatchState.ABORTED;
            String msg = "Budget limit reached: " + costMeter.progress();
            log.warn("[BUDGET] {}", msg);
            return summary(batchId, StopReason.BUDGET, items.size(), success, failed, skipped,
                    processed, startedAt, checkpointLocation, msg);
        }
        state = BatchState.DONE;
        return summary(batchId, StopReason.COMPLETED, items.size(), success, failed, skipped,
                processed, startedAt, checkpointLocation, null);
    }

    private Completed process(Pending p) {
        WorkItem item = p.item();
        String runId = runLogger.start(item.identity(), p.index(), "reason=" + p.reason());
        JobContext context = new WorkerContext(runId);
        try (Timer.Context ignored = itemTimer.time()) {
            int attempt = 0;
            while (true) {
                attempt++;
                try {
                    for (String dependency : job.dependencies()) {
                        rateLimiters.acquire(dependency);
                    }
                    JobOutcome outcome = job.process(item, context);
                    return finish(p, runId, outcome == null ? JobOutcome.failure("job returned no outcome") : outcome);
                } catch (BudgetExceededException e) {
                    budgetHit.set(true);
                    return finish(p, runId, JobOutcome.failure(e.getMessage()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return finish(p, runId, JobOutcome.failure("interrupted"));
                } catch (Exception e) {
                    if (retryPolicy.shouldRetry(attempt, e)) {
                        retriedMeter.mark();
                        log.warn("Attempt {} for {} failed, retrying: {}", attempt, item.identity(), describe(e));
                        if (!sleepQuiet(retryPolicy.backoffMillis(attempt))) {
                            return finish(p, runId, JobOutcome.failure("interrupted during retry backoff"));
                        }
                        continue;
                    }
                    return finish(p, runId, JobOutcome.failure(describe(e)));
                } catch (Error e) {
                    log.error("Job function threw for {}", item.identity(), e);
                    return finish(p, runId, JobOutcome.fatal(describe(e)), e);
                }
            }
        }
    }

    private Completed finish(Pending p, String runId, JobOutcome outcome) {
        return finish(p, runId, outcome, null);
    }

    private Completed finish(Pending p, String runId, JobOutcome outcome, Throwable cause) {
        WorkItem item = p.item();
        String reason = p.reason().wireName();
        switch (outcome.kind()) {
            case SUCCESS -> {
                registry.recordSuccess(item, runId, outcome.outputs());
                runLogger.success(runId, outcome.outputs());
                successMeter.mark();
                return new Completed(ItemResult.success(item.identity(), p.index(), runId, reason, outcome.outputs()), true);
            }
            case FATAL -> {
                String error = "FATAL: " + outcome.error();
                registry.recordFailure(item, runId, error);
                runLogger.fail(runId, error);
                failedMeter.mark();
                if (markFatal(item.identity() + ": " + outcome.error(), cause)) {
                    log.error("Fatal outcome for {}: {}; no further chunks will be dispatched", item.identity(), outcome.error());
                }
                return new Completed(ItemResult.failed(item.identity(), p.index(), runId, reason, error), false);
            }
            default -> {
                registry.recordFailure(item, runId, outcome.error());
                runLogger.fail(runId, outcome.error());
                failedMeter.mark();
                return new Completed(ItemResult.failed(item.identity(), p.index(), runId, reason, outcome.error()), false);
            }
        }
    }

    private boolean markFatal(String message, Throwable cause) {
        if (!fatalMessage.compareAndSet(null, message)) return false;
        if (cause != null) fatalCause.compareAndSet(null, cause);
        return true;
    }

    private Path saveCheckpoint(String batchId, int processed, List<ItemResult> success, List<ItemResult> failed,
                                List<ItemResult> skipped, CheckpointReason reason) {
        Checkpoint checkpoint = Checkpoint.of(batchId, clock.instant(), processed,
                new CheckpointResults(success, failed, skipped), costMeter.total(), reason);
        try {
            return checkpoints.save(checkpoint);
        } catch (IOException | RuntimeException e) {
            metrics.counter(Metrics.CHECKPOINT_FAILURES).inc();
            log.warn("Failed to write checkpoint to {}: {}", checkpoints.latestLocation(), e.toString());
            return null;
        }
    }

    private void logEstimate(int loaded, int toProcess, int skipped) {
        log.info("[ESTIMATE] {} items loaded, {} to process, {} skipped | {} workers, chunk size {}",
                loaded, toProcess, skipped, workers, chunkSize);
        if (costMeter.budgetLimit() > 0) {
            log.warn("[BUDGET] Limit ${}; dispatch stops at the first chunk boundary after it is reached",
                    String.format(Locale.ROOT, "%.2f", costMeter.budgetLimit()));
        }
    }

    private BatchSummary summary(String batchId, StopReason reason, int loaded, List<ItemResult> success,
                                 List<ItemResult> failed, List<ItemResult> skipped, int processed,
                                 Instant startedAt, Path checkpointLocation, String message) {
        return new BatchSummary(batchId, state, reason, loaded, success, failed, skipped, processed,
                Duration.between(startedAt, clock.instant()), costMeter.snapshot(), checkpointLocation, message);
    }

    private static List<WorkItem> uniqueByIdentity(List<WorkItem> loaded) {
        if (loaded == null) return List.of();
        Set<String> seen = new LinkedHashSet<>();
        List<WorkItem> out = new ArrayList<>(loaded.size());
        for (WorkItem item : loaded) {
            if (seen.add(item.identity())) {
                out.add(item);
            } else {
                log.warn("Duplicate identity '{}' in job source; keeping first occurrence", item.identity());
            }
        }
        return out;
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static boolean sleepQuiet(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private final class WorkerContext implements JobContext {
        private final String runId;

        private WorkerContext(String runId) { this.runId = runId; }

        @Override
        public String runId() { return runId; }

        @Override
        public Duration acquire(String dependency) throws InterruptedException {
            return rateLimiters.acquire(dependency);
        }

        @Override
        public void record(String kind, long quantity) {
            costMeter.record(kind, quantity);
        }
    }
}
