package com.spiderhub.core.aggregate;

import com.spiderhub.common.model.SiteResult;

/**
 * Receives per-site results as they arrive, in completion order, and one final summary.
 * Callbacks run on worker or timer threads.
 */
public interface AggregateListener {

    void onResult(SiteResult result);

    default void onComplete(AggregateSummary summary) {
    }

    AggregateListener NONE = result -> {
    };
}
