package io.meteredbatch.retry;

/**
 * Decides whether a job invocation that threw should be attempted again within the same run.
 */
public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);
    long backoffMillis(int attempt);

    static RetryPolicy none() {
        return new ExponentialBackoffRetryPolicy(1, 1, 1);
    }
}
