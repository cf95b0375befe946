package io.meteredbatch.budget;

import io.meteredbatch.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * One limiter per external dependency, looked up by name. Dependencies without a configured
 * limit are not throttled.
 */
public class RateLimiters {
    private static final Logger log = LoggerFactory.getLogger(RateLimiters.class);

    private final Map<String, RateLimiter> limiters;
    private final Metrics metrics;
    private final Set<String> warnedUnknown = ConcurrentHashMap.newKeySet();

    public RateLimiters(Map<String, RateLimitSpec> specs, Metrics metrics) {
        Map<String, RateLimiter> m = new LinkedHashMap<>();
        specs.forEach((name, spec) -> m.put(name, new TokenBucketRateLimiter(name, spec)));
        this.limiters = Collections.unmodifiableMap(m);
        this.metrics = metrics;
    }

    public static RateLimiters none() {
        return new RateLimiters(Map.of(), null);
    }

    public Duration acquire(String dependency) throws InterruptedException {
        RateLimiter limiter = limiters.get(dependency);
        if (limiter == null) {
            if (warnedUnknown.add(dependency)) {
                log.warn("No rate limit configured for dependency '{}'; calls are not throttled", dependency);
            }
            return Duration.ZERO;
        }
        Duration waited = limiter.acquire();
        if (metrics != null) {
            metrics.timer("ratelimit." + dependency + ".wait").update(waited.toNanos(), TimeUnit.NANOSECONDS);
        }
        return waited;
    }

    public RateLimiter get(String dependency) {
        return limiters.get(dependency);
    }

    public Set<String> names() {
        return limiters.keySet();
    }

    public List<RateLimiter.Stats> stats() {
        List<RateLimiter.Stats> out = new ArrayList<>();
        for (RateLimiter l : limiters.values()) out.add(l.stats());
        return out;
    }
}
