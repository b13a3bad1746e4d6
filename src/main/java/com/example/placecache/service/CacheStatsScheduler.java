package com.example.placecache.service;

import com.example.placecache.util.CacheStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class CacheStatsScheduler {
  private final CacheStatsService cacheStatsService;

  @Scheduled(cron = "${place-cache.stats-cron:0 0 * * * *}")
  public void reportStats() {
    CacheStats stats = cacheStatsService.snapshot();
    log.info("Restaurant cache: total={}, external={}, manual={}, hitRateEstimate={}",
        stats.total(), stats.externalSourced(), stats.manualSourced(),
        String.format(Locale.ROOT, "%.2f", stats.hitRateEstimate()));
  }
}
