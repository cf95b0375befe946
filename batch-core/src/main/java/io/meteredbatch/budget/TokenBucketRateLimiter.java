package io.meteredbatch.budget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token bucket with fractional tokens. All state is read and written under the instance lock,
 * including the refill wait, so concurrent callers are serialized in lock-acquisition order and
 * the global call rate holds regardless of how many workers share the limiter.
 */
public class TokenBucketRateLimiter implements RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);
    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final String name;
    private final double capacity;
    private final double refillPerSecond;
    private final LongSupplier nanoTime;

    private double tokens;
    private long lastRefillNanos;
    private long totalCalls;
    private long totalWaitNanos;

    public TokenBucketRateLimiter(String name, RateLimitSpec spec) {
        this(name, spec, System::nanoTime);
    }

    TokenBucketRateLimiter(String name, RateLimitSpec spec, LongSupplier nanoTime) {
        this.name = name;
        this.capacity = spec.capacity();
        this.refillPerSecond = spec.refillPerSecond();
        this.nanoTime = nanoTime;
        this.tokens = capacity; // initial burst
        this.lastRefillNanos = nanoTime.getAsLong();
    }

    @Override
    public synchronized Duration acquire() throws InterruptedException {
        long waited = 0;
        refill();
        while (tokens < 1.0) {
            long deficitNanos = (long) Math.ceil((1.0 - tokens) / refillPerSecond * NANOS_PER_SECOND);
            long t0 = nanoTime.getAsLong();
            TimeUnit.NANOSECONDS.sleep(Math.max(1, deficitNanos));
            waited += nanoTime.getAsLong() - t0;
            refill();
        }
        tokens -= 1.0;
        totalCalls++;
        totalWaitNanos += waited;
        if (waited > 0 && log.isDebugEnabled()) {
            log.debug("Rate limiter {} waited {} ms", name, TimeUnit.NANOSECONDS.toMillis(waited));
        }
        return Duration.ofNanos(waited);
    }

    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) return;
        tokens = Math.min(capacity, tokens + elapsed / NANOS_PER_SECOND * refillPerSecond);
        lastRefillNanos = now;
    }

    public String name() { return name; }

    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    @Override
    public synchronized Stats stats() {
        return new Stats(name, totalCalls, Duration.ofNanos(totalWaitNanos), tokens, capacity);
    }

    public synchronized void resetStats() {
        totalCalls = 0;
        totalWaitNanos = 0;
    }
}
