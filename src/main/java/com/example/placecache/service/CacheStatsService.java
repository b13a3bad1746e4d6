package com.example.placecache.service;

import com.example.placecache.domain.RecordSource;
import com.example.placecache.store.CacheStore;
import com.example.placecache.util.CacheStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class CacheStatsService {
  private final CacheStore cacheStore;

  /**
   * Counts records by source. The hit rate estimate is {@code externalSourced / total}: how much
   * of the store came from the provider, not how often lookups were served from cache.
   */
  public CacheStats snapshot() {
    try {
      long total = cacheStore.count();
      long external = cacheStore.countBySource(RecordSource.EXTERNAL);
      long manual = cacheStore.countBySource(RecordSource.MANUAL);
      double hitRateEstimate = (double) external / Math.max(total, 1);
      return new CacheStats(total, external, manual, hitRateEstimate);
    } catch (RuntimeException ex) {
      log.error("Failed to compute cache stats", ex);
      return CacheStats.empty();
    }
  }
}
