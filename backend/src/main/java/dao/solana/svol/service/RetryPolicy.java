package dao.solana.svol.service;

import dao.solana.svol.config.SchedulerProperties;

/**
 * Exponential backoff between transfer attempts.
 */
public final class RetryPolicy {

    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;

    public RetryPolicy(int maxRetries, long baseDelayMs, long maxDelayMs) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (baseDelayMs < 0 || maxDelayMs < 0) throw new IllegalArgumentException("delays must be >= 0");
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public static RetryPolicy from(SchedulerProperties.ExecutionConfig cfg) {
        return new RetryPolicy(cfg.getMaxRetries(), cfg.getRetryBackoffMs(), cfg.getMaxBackoffMs());
    }

    /**
     * Delay before the given one-based retry.
     * Formula: baseDelay * 2^(retry - 1), capped at maxDelay.
     */
    public long delayMs(int retry) {
        if (retry <= 0) return 0;
        int exponent = Math.min(retry - 1, 20);
        long exponential = baseDelayMs * (1L << exponent);
        if (exponential < 0 || exponential > maxDelayMs) return maxDelayMs;
        return exponential;
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
