package com.gigpulse.service.cache;

public record CacheStats(
        long hits,
        long misses,
        long computations,
        long sharedWaits,
        long failures,
        long evictions,
        int size
) {
}
