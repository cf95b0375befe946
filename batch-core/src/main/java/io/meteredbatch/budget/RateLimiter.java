package io.meteredbatch.budget;

import java.time.Duration;

/**
 * Bounds the call rate to one external dependency. Shared by every worker calling it.
 */
public interface RateLimiter {
    /** Block until a call is permitted; returns how long the caller waited. */
    Duration acquire() throws InterruptedException;

    Stats stats();

    record Stats(String name, long totalCalls, Duration totalWait, double currentTokens, double capacity) {
        public Duration averageWait() {
            return totalCalls == 0 ? Duration.ZERO : totalWait.dividedBy(totalCalls);
        }
    }
}
