package com.spiderhub.core.optimizer;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: the base delay doubles per attempt and is capped at the maximum.
 * Jitter is drawn from the gap up to the next attempt's delay, so delays never decrease
 * as the attempt number grows, whatever the random draws.
 */
public final class RetryBackoff {

    private static final int MAX_EXPONENT = 20;

    private RetryBackoff() {
    }

    /**
     * @param attempt 1 for the first retry
     */
    public static long computeDelay(long baseDelayMs, long maxDelayMs, int attempt) {
        long normalizedBase = Math.max(0L, baseDelayMs);
        long normalizedMax = Math.max(normalizedBase, maxDelayMs);
        int exponent = Math.max(0, Math.min(MAX_EXPONENT, attempt - 1));

        long delay = normalizedBase == 0L ? 0L : (normalizedBase * (1L << exponent));
        return Math.min(delay, normalizedMax);
    }

    public static long jitteredDelay(long baseDelayMs, long maxDelayMs, int attempt) {
        return jitteredDelay(baseDelayMs, maxDelayMs, attempt, ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random a draw in [0, 1)
     */
    static long jitteredDelay(long baseDelayMs, long maxDelayMs, int attempt, double random) {
        long delay = computeDelay(baseDelayMs, maxDelayMs, attempt);
        long next = computeDelay(baseDelayMs, maxDelayMs, Math.max(1, attempt) + 1);
        double r = Math.min(Math.max(random, 0.0), Math.nextDown(1.0));
        return delay + (long) (r * (next - delay));
    }

    /**
     * @throws InterruptedException if the retrying call was cancelled while waiting
     */
    public static void sleep(long delayMs) throws InterruptedException {
        if (delayMs > 0L) {
            Thread.sleep(delayMs);
        }
    }
}
