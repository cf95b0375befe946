package io.meteredbatch.cli;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.meteredbatch.budget.RateLimitSpec;
import io.meteredbatch.budget.RateLimiter;
import io.meteredbatch.budget.RateLimiters;
import io.meteredbatch.config.BatchConfig;
import io.meteredbatch.registry.ItemRegistry;
import io.meteredbatch.registry.RegistryStats;
import io.meteredbatch.runlog.RunLogSummary;
import io.meteredbatch.runlog.RunLogger;
import io.meteredbatch.runtime.BatchAbortedException;
import io.meteredbatch.runtime.BatchOrchestrator;
import io.meteredbatch.runtime.BatchSummary;
import picocli.CommandLine;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Runs one metered batch: items from a JSON Lines file, each posted to an HTTP endpoint.
 * Options left unset fall back to {@code batch.*} system properties and {@code BATCH_*}
 * environment variables.
 */
@CommandLine.Command(name = "batch-run", mixinStandardHelpOptions = true,
        description = "Process work items against a metered HTTP endpoint with budget and checkpoints")
public final class BatchRunMain implements Callable<Integer> {
    @CommandLine.Option(names = {"-i", "--items"}, required = true, description = "JSON Lines file of work items")
    Path items;

    @CommandLine.Option(names = {"-e", "--endpoint"}, required = true, description = "URL each item is POSTed to")
    URI endpoint;

    @CommandLine.Option(names = {"-w", "--workers"}, description = "Concurrent workers (default 8)")
    Integer workers;

    @CommandLine.Option(names = {"-c", "--chunk-size"}, description = "Items per checkpointed chunk (default 50)")
    Integer chunkSize;

    @CommandLine.Option(names = {"-b", "--budget"}, description = "Cost ceiling; 0 for none")
    Double budget;

    @CommandLine.Option(names = {"-f", "--force"}, description = "Reprocess items even if already done")
    Boolean force;

    @CommandLine.Option(names = {"-l", "--limit"}, description = "Only the first N items (dry runs)")
    Integer limit;

    @CommandLine.Option(names = "--state-dir", description = "Registry and checkpoint directory (default state)")
    Path stateDir;

    @CommandLine.Option(names = "--logs-dir", description = "Run log directory (default logs)")
    Path logsDir;

    @CommandLine.Option(names = "--rate-limit", description = "Per-dependency limit as name=capacity:refillPerSecond, e.g. http=10:2")
    Map<String, String> rateLimits = new LinkedHashMap<>();

    @CommandLine.Option(names = "--price", description = "Unit price as kind=price, e.g. request=0.002")
    Map<String, Double> prices = new LinkedHashMap<>();

    @CommandLine.Option(names = "--max-attempts", description = "Attempts per item when the request throws (default 1)")
    Integer maxAttempts;

    @CommandLine.Option(names = "--timeout-seconds", description = "Per-request timeout", defaultValue = "30")
    long timeoutSeconds;

    public static void main(String[] args) {
        int code = new CommandLine(new BatchRunMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        BatchConfig config;
        try {
            config = resolveConfig(BatchConfig.fromEnv());
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return 2;
        }
        if (!Files.isRegularFile(items)) {
            System.err.println("Items file not found: " + items);
            return 2;
        }

        Injector injector = Guice.createInjector(new BatchModule(config, items, endpoint, Duration.ofSeconds(Math.max(1, timeoutSeconds))));
        BatchOrchestrator orchestrator = injector.getInstance(BatchOrchestrator.class);
        RunLogger runLogger = injector.getInstance(RunLogger.class);
        RateLimiters limiters = injector.getInstance(RateLimiters.class);
        ItemRegistry registry = injector.getInstance(ItemRegistry.class);

        int code;
        try {
            BatchSummary summary = orchestrator.run();
            System.out.println(summary.describe());
            code = 0;
        } catch (BatchAbortedException e) {
            System.err.println(e.summary().describe());
            code = 1;
        }
        printRunLog(runLogger.summary());
        for (RateLimiter.Stats s : limiters.stats()) {
            System.out.println(String.format(Locale.ROOT, "Rate limiter %s: %d calls, waited %.2fs total (%.3fs avg)",
                    s.name(), s.totalCalls(), s.totalWait().toMillis() / 1000.0, s.averageWait().toMillis() / 1000.0));
        }
        RegistryStats stats = registry.stats();
        System.out.println("Registry: " + stats.total() + " items (" + stats.success() + " success, " + stats.failed() + " failed)");
        return code;
    }

    BatchConfig resolveConfig(BatchConfig base) {
        Map<String, RateLimitSpec> limits = new LinkedHashMap<>(base.rateLimits());
        rateLimits.forEach((name, spec) -> limits.put(name, RateLimitSpec.parse(spec)));
        Map<String, Double> unitPrices = new LinkedHashMap<>(base.unitPrices());
        unitPrices.putAll(prices);
        return new BatchConfig(
                workers != null ? workers : base.workers(),
                chunkSize != null ? chunkSize : base.chunkSize(),
                budget != null ? budget : base.budgetLimit(),
                force != null ? force : base.force(),
                limit != null ? limit : base.limit(),
                stateDir != null ? stateDir : base.stateDir(),
                logsDir != null ? logsDir : base.logsDir(),
                limits,
                unitPrices,
                maxAttempts != null ? maxAttempts : base.maxAttempts());
    }

    private static void printRunLog(RunLogSummary s) {
        System.out.println(String.format(Locale.ROOT, "Run log: %d started, %d skipped, %d succeeded, %d failed (%.1fs in jobs)",
                s.start(), s.skip(), s.success(), s.fail(), s.totalDurationSeconds()));
    }
}
