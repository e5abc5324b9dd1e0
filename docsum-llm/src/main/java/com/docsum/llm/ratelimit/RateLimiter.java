package com.docsum.llm.ratelimit;

/**
 * Process-wide request budget for the generation service.
 */
public interface RateLimiter {

    /**
     * Blocks the calling thread until a permit is granted, then consumes it.
     *
     * @throws InterruptedException if the thread is interrupted while waiting; the
     *                              reserved permit is returned to the bucket
     */
    void acquire() throws InterruptedException;

    /**
     * Consumes a permit only if one is available right now and nobody is queued ahead.
     */
    boolean tryAcquire();

    /**
     * Permits that could be granted immediately, for monitoring.
     */
    double getAvailableTokens();
}
