package com.example.placecache.util;

/**
 * Store composition figures. {@code hitRateEstimate} is the share of provider-sourced
 * records in the store, not a ratio of cache hits over lookups.
 */
public record CacheStats(long total,
                         long externalSourced,
                         long manualSourced,
                         double hitRateEstimate) {
  public static CacheStats empty() {
    return new CacheStats(0, 0, 0, 0.0);
  }
}
