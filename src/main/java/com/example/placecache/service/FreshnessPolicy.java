package com.example.placecache.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether provider data synced at a given moment can still be trusted.
 */
@Component
public class FreshnessPolicy {
  public static final Duration DEFAULT_TTL = Duration.ofDays(7);

  private final Clock clock;
  private final Duration ttl;

  public FreshnessPolicy(Clock clock, @Value("${place-cache.ttl-days:7}") long ttlDays) {
    this.clock = clock;
    this.ttl = Duration.ofDays(Math.max(0, ttlDays));
  }

  public boolean isFresh(Instant lastSyncedAt) {
    return isFresh(lastSyncedAt, ttl, clock.instant());
  }

  /**
   * A null timestamp means the record was never synced and is never fresh.
   */
  public static boolean isFresh(Instant lastSyncedAt, Duration ttl, Instant now) {
    if (lastSyncedAt == null) {
      return false;
    }
    return Duration.between(lastSyncedAt, now).compareTo(ttl) < 0;
  }

  public Duration getTtl() {
    return ttl;
  }
}
