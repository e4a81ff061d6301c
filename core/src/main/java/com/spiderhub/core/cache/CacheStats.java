package com.spiderhub.core.cache;

public record CacheStats(long memoryEntries, long memoryWeightBytes, long diskEntries,
                         long memoryHits, long diskHits, long misses, long puts,
                         long loads, long sharedLoads, long errors) {

    public double hitRate() {
        long lookups = memoryHits + diskHits + misses;
        return lookups == 0 ? 0.0 : (double) (memoryHits + diskHits) / lookups;
    }
}
