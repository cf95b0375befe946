package io.meteredbatch.budget;

/**
 * Token bucket parameters for one dependency: burst capacity and refill rate in tokens/second.
 */
public record RateLimitSpec(double capacity, double refillPerSecond) {
    public RateLimitSpec {
        if (!(capacity >= 1)) throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        if (!(refillPerSecond > 0)) throw new IllegalArgumentException("refillPerSecond must be > 0: " + refillPerSecond);
    }

    public static RateLimitSpec perMinute(int callsPerMinute, int burst) {
        return new RateLimitSpec(burst, callsPerMinute / 60.0);
    }

    /** Parses {@code capacity:refillPerSecond}, e.g. {@code 10:1.5}. */
    public static RateLimitSpec parse(String text) {
        String[] parts = text.trim().split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("expected capacity:refillPerSecond but got '" + text + "'");
        }
        return new RateLimitSpec(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
    }
}
