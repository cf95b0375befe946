package io.meteredbatch.cli;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.meteredbatch.budget.CostMeter;
import io.meteredbatch.budget.RateLimiters;
import io.meteredbatch.checkpoint.CheckpointStore;
import io.meteredbatch.checkpoint.FileCheckpointStore;
import io.meteredbatch.config.BatchConfig;
import io.meteredbatch.core.JobFunction;
import io.meteredbatch.core.JobSource;
import io.meteredbatch.metrics.Metrics;
import io.meteredbatch.registry.ItemRegistry;
import io.meteredbatch.registry.JsonFileRegistryStore;
import io.meteredbatch.runlog.RunLogger;
import io.meteredbatch.runtime.BatchOrchestrator;
import io.meteredbatch.runtime.BatchOrchestratorBuilder;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public class BatchModule extends AbstractModule {
    private final BatchConfig config;
    private final Path itemsFile;
    private final URI endpoint;
    private final Duration requestTimeout;

    public BatchModule(BatchConfig config, Path itemsFile, URI endpoint, Duration requestTimeout) {
        this.config = config;
        this.itemsFile = itemsFile;
        this.endpoint = endpoint;
        this.requestTimeout = requestTimeout;
    }

    @Override
    protected void configure() {
        bind(BatchConfig.class).toInstance(config);
    }

    @Provides @Singleton Clock clock() { return Clock.systemDefaultZone(); }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton CostMeter costMeter() {
        Map<String, Double> prices = new LinkedHashMap<>(config.unitPrices());
        // the HTTP job always reports requests, priced or not
        prices.putIfAbsent(HttpJobFunction.USAGE_KIND, 0.0);
        return new CostMeter(prices, config.budgetLimit());
    }

    @Provides @Singleton RateLimiters rateLimiters(MetricRegistry registry) { return new RateLimiters(config.rateLimits(), new Metrics(registry)); }

    @Provides @Singleton ItemRegistry itemRegistry() { return new ItemRegistry(new JsonFileRegistryStore(config.registryFile())); }

    @Provides @Singleton RunLogger runLogger(Clock clock) throws IOException { return RunLogger.create(config.logsDir(), clock.instant(), clock); }

    @Provides @Singleton CheckpointStore checkpoints(Clock clock) { return new FileCheckpointStore(config.stateDir().resolve("checkpoints"), clock); }

    @Provides @Singleton HttpClient httpClient() { return HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(); }

    @Provides JobSource source() { return new JsonLinesItemSource(itemsFile); }

    @Provides JobFunction job(HttpClient client) { return new HttpJobFunction(client, endpoint, requestTimeout); }

    @Provides @Singleton BatchOrchestrator orchestrator(JobSource source, JobFunction job, ItemRegistry registry, RunLogger runLogger,
                                                        CheckpointStore checkpoints, CostMeter costMeter, RateLimiters rateLimiters,
                                                        MetricRegistry metrics, Clock clock) {
        return new BatchOrchestratorBuilder()
                .source(source)
                .job(job)
                .registry(registry)
                .runLogger(runLogger)
                .checkpoints(checkpoints)
                .costMeter(costMeter)
                .rateLimiters(rateLimiters)
                .config(config)
                .metrics(metrics)
                .clock(clock)
                .build();
    }
}
