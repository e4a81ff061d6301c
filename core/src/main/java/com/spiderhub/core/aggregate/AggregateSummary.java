package com.spiderhub.core.aggregate;

public record AggregateSummary(String queryId, int sites, int succeeded, int failed, int timedOut,
                               int cancelled, int items, long wallTimeMs) {
}
