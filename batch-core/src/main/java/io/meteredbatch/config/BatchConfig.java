package io.meteredbatch.config;

import io.meteredbatch.budget.RateLimitSpec;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of one batch invocation.
 *
 * @param budgetLimit ceiling on metered cost; {@code 0} means unlimited
 * @param limit       process only the first {@code limit} items (dry runs); {@code 0} means all
 * @param maxAttempts attempts per item when the job function throws
 */
public record BatchConfig(
        int workers,
        int chunkSize,
        double budgetLimit,
        boolean force,
        int limit,
        Path stateDir,
        Path logsDir,
        Map<String, RateLimitSpec> rateLimits,
        Map<String, Double> unitPrices,
        int maxAttempts
) {
    public BatchConfig {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1: " + workers);
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1: " + chunkSize);
        if (budgetLimit < 0) throw new IllegalArgumentException("budgetLimit must be >= 0: " + budgetLimit);
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0: " + limit);
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        unitPrices.forEach((k, v) -> {
            if (v == null || v < 0) throw new IllegalArgumentException("price for '" + k + "' must be >= 0");
        });
        rateLimits = Map.copyOf(rateLimits);
        unitPrices = Map.copyOf(unitPrices);
    }

    public static BatchConfig fromEnv() {
        int workers = Integer.parseInt(prop("batch.workers", "BATCH_WORKERS", "8"));
        int chunk = Integer.parseInt(prop("batch.chunkSize", "BATCH_CHUNK_SIZE", "50"));
        double budget = Double.parseDouble(prop("batch.budget", "BATCH_BUDGET", "0"));
        boolean force = Boolean.parseBoolean(prop("batch.force", "BATCH_FORCE", "false"));
        int limit = Integer.parseInt(prop("batch.limit", "BATCH_LIMIT", "0"));
        Path state = Path.of(prop("batch.stateDir", "BATCH_STATE_DIR", "state"));
        Path logs = Path.of(prop("batch.logsDir", "BATCH_LOGS_DIR", "logs"));
        Map<String, RateLimitSpec> limits = parseRateLimits(prop("batch.rateLimits", "BATCH_RATE_LIMITS", ""));
        Map<String, Double> prices = parsePrices(prop("batch.prices", "BATCH_PRICES", ""));
        int attempts = Integer.parseInt(prop("batch.maxAttempts", "BATCH_MAX_ATTEMPTS", "1"));
        return new BatchConfig(workers, chunk, budget, force, limit, state, logs, limits, prices, attempts);
    }

    public boolean hasBudget() {
        return budgetLimit > 0;
    }

    public Path registryFile() {
        return stateDir.resolve("registry.json");
    }

    /** {@code name=capacity:refillPerSecond} pairs, comma separated. */
    public static Map<String, RateLimitSpec> parseRateLimits(String text) {
        Map<String, RateLimitSpec> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : pairs(text).entrySet()) {
            out.put(e.getKey(), RateLimitSpec.parse(e.getValue()));
        }
        return out;
    }

    /** {@code kind=price} pairs, comma separated. */
    public static Map<String, Double> parsePrices(String text) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : pairs(text).entrySet()) {
            out.put(e.getKey(), Double.parseDouble(e.getValue()));
        }
        return out;
    }

    private static Map<String, String> pairs(String text) {
        Map<String, String> out = new LinkedHashMap<>();
        if (text == null || text.isBlank()) return out;
        for (String part : text.split(",")) {
            if (part.isBlank()) continue;
            String[] kv = part.split("=", 2);
            if (kv.length != 2 || kv[0].isBlank()) {
                throw new IllegalArgumentException("expected name=value but got '" + part.trim() + "'");
            }
            out.put(kv[0].trim(), kv[1].trim());
        }
        return out;
    }

    private static String prop(String key, String env, String def) {
        return System.getProperty(key, System.getenv().getOrDefault(env, def));
    }
}
