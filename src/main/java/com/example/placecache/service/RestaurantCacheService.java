package com.example.placecache.service;

import com.example.placecache.domain.Restaurant;
import com.example.placecache.provider.PlaceProvider;
import com.example.placecache.store.CacheStore;
import com.example.placecache.util.ExternalPlace;
import com.example.placecache.util.PlaceSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Cache-aside access to restaurants backed by the place provider.
 *
 * <p>A fresh cached record is returned without calling the provider. Otherwise the provider is
 * asked once; its data is written back and returned. When the provider fails or has nothing,
 * the cached record is served as it is, however old, and only a cold miss yields empty.
 * Provider errors never reach the caller.
 *
 * <p>If write-back fails after a successful fetch, the fetched data is returned unsaved.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RestaurantCacheService {
  private final CacheStore cacheStore;
  private final FreshnessPolicy freshnessPolicy;
  private final RestaurantMapper restaurantMapper;
  private final PlaceProvider defaultProvider;
  private final Clock clock;

  public Optional<Restaurant> fetchOrCache(String externalId) {
    return fetchOrCache(externalId, defaultProvider);
  }

  public Optional<Restaurant> fetchOrCache(String externalId, PlaceProvider provider) {
    if (externalId == null || externalId.isBlank()) {
      return Optional.empty();
    }

    Optional<Restaurant> cached = lookup(externalId);
    if (cached.isPresent() && freshnessPolicy.isFresh(cached.get().getLastSyncedAt())) {
      log.info("Cache hit for placeId='{}', restaurantId={}", externalId, cached.get().getId());
      return cached;
    }
    log.info("Cache miss for placeId='{}' (cached={}), asking provider", externalId, cached.isPresent());

    Optional<ExternalPlace> fetched;
    try {
      fetched = provider.fetch(externalId);
    } catch (RuntimeException ex) {
      log.warn("Provider failed for placeId='{}': {}", externalId, ex.getMessage());
      return fallback(externalId, cached);
    }
    if (fetched == null || fetched.isEmpty()) {
      log.warn("Provider returned nothing for placeId='{}'", externalId);
      return fallback(externalId, cached);
    }

    PlaceSnapshot snapshot = restaurantMapper.toSnapshot(fetched.get());
    Instant now = clock.instant();
    Long existingId = cached.map(Restaurant::getId).orElse(null);
    try {
      Restaurant stored;
      if (existingId != null) {
        stored = cacheStore.updateById(existingId, snapshot, now);
        log.info("Refreshed restaurant {} from provider, placeId='{}'", existingId, externalId);
      } else {
        stored = cacheStore.upsertByExternalId(externalId, snapshot, now);
        log.info("Cached restaurant {} from provider, placeId='{}'", stored.getId(), externalId);
      }
      return Optional.of(stored);
    } catch (RuntimeException ex) {
      log.warn("Write-back failed for placeId='{}', returning unsaved provider data: {}", externalId, ex.getMessage());
      return Optional.of(restaurantMapper.toUnsavedRestaurant(cached.orElse(null), externalId, snapshot, now));
    }
  }

  private Optional<Restaurant> lookup(String externalId) {
    try {
      return cacheStore.findByExternalId(externalId);
    } catch (RuntimeException ex) {
      log.warn("Cache lookup failed for placeId='{}', treating as miss: {}", externalId, ex.getMessage());
      return Optional.empty();
    }
  }

  private Optional<Restaurant> fallback(String externalId, Optional<Restaurant> cached) {
    if (cached.isPresent()) {
      log.warn("Serving stale cache for placeId='{}', last synced at {}", externalId, cached.get().getLastSyncedAt());
    }
    return cached;
  }
}
