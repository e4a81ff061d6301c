package com.spiderhub.core.optimizer;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling window of a site's most recent call outcomes.
 * <p>
 * Once enough samples are in, an error rate above the threshold marks the site
 * {@link HealthState#DEGRADED}; it returns to {@link HealthState#HEALTHY} only when the
 * rate falls to half the threshold or below.
 */
public class SiteHealth {
    private final int window;
    private final int minSamples;
    private final double errorRateThreshold;

    private final Deque<Boolean> outcomes = new ArrayDeque<>();
    private int failures;
    private HealthState state = HealthState.HEALTHY;

    public SiteHealth(int window, int minSamples, double errorRateThreshold) {
        this.window = Math.max(1, window);
        this.minSamples = Math.max(1, Math.min(minSamples, this.window));
        this.errorRateThreshold = errorRateThreshold;
    }

    /**
     * @return the state after recording
     */
    public synchronized HealthState record(boolean success) {
        if (outcomes.size() == window && !outcomes.removeFirst()) {
            failures--;
        }
        outcomes.addLast(success);
        if (!success) failures++;

        if (outcomes.size() >= minSamples) {
            double rate = errorRate();
            if (state == HealthState.HEALTHY && rate > errorRateThreshold) {
                state = HealthState.DEGRADED;
            } else if (state == HealthState.DEGRADED && rate <= errorRateThreshold / 2) {
                state = HealthState.HEALTHY;
            }
        }
        return state;
    }

    public synchronized double errorRate() {
        return outcomes.isEmpty() ? 0.0 : (double) failures / outcomes.size();
    }

    public synchronized int samples() {
        return outcomes.size();
    }

    public synchronized HealthState getState() {
        return state;
    }

    public synchronized void reset() {
        outcomes.clear();
        failures = 0;
        state = HealthState.HEALTHY;
    }
}
