package com.gamerank.leaderboard.model;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time cache counters. Rates are percentages.
 */
@Value
@Builder
public class CacheStats {
    boolean enabled;
    long hits;
    long misses;
    double hitRate;
    int size;
    int capacity;
    double utilization;

    public static CacheStats disabled() {
        return CacheStats.builder().enabled(false).build();
    }
}
