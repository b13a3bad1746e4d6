package com.example.placecache.service;

import com.example.placecache.domain.RecordSource;
import com.example.placecache.domain.Restaurant;
import com.example.placecache.provider.PlaceProvider;
import com.example.placecache.store.CacheStore;
import com.example.placecache.util.ExternalPlace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.Optional;

/**
 * Fire-and-forget refresh of restaurants already known to be stale. Callers never wait and never
 * see a failure; failures go to the {@link RefreshFailureHandler}. There is no retry and no limit
 * on how many refreshes may be in flight.
 */
@Service
@Slf4j
public class BackgroundRefresher {
  private final CacheStore cacheStore;
  private final RestaurantMapper restaurantMapper;
  private final FreshnessPolicy freshnessPolicy;
  private final TaskExecutor executor;
  private final RefreshFailureHandler failureHandler;
  private final Clock clock;

  public BackgroundRefresher(CacheStore cacheStore,
                             RestaurantMapper restaurantMapper,
                             FreshnessPolicy freshnessPolicy,
                             @Qualifier("refreshExecutor") TaskExecutor executor,
                             RefreshFailureHandler failureHandler,
                             Clock clock) {
    this.cacheStore = cacheStore;
    this.restaurantMapper = restaurantMapper;
    this.freshnessPolicy = freshnessPolicy;
    this.executor = executor;
    this.failureHandler = failureHandler;
    this.clock = clock;
  }

  public void refresh(Long restaurantId, String externalId, PlaceProvider provider) {
    try {
      executor.execute(() -> runRefresh(restaurantId, externalId, provider));
    } catch (RuntimeException ex) {
      notifyFailure(restaurantId, externalId, ex);
    }
  }

  /**
   * Triggers a refresh for every provider-sourced record whose data is no longer fresh.
   *
   * @return how many refreshes were triggered
   */
  public int refreshStale(Collection<Restaurant> restaurants, PlaceProvider provider) {
    int triggered = 0;
    for (Restaurant restaurant : restaurants) {
      if (restaurant.getSource() != RecordSource.EXTERNAL) {
        continue;
      }
      String externalId = restaurant.getExternalId();
      if (externalId == null || externalId.isBlank()) {
        continue;
      }
      if (freshnessPolicy.isFresh(restaurant.getLastSyncedAt())) {
        continue;
      }
      refresh(restaurant.getId(), externalId, provider);
      triggered++;
    }
    if (triggered > 0) {
      log.info("Triggered {} background refreshes", triggered);
    }
    return triggered;
  }

  private void runRefresh(Long restaurantId, String externalId, PlaceProvider provider) {
    try {
      Optional<ExternalPlace> fetched = provider.fetch(externalId);
      if (fetched == null || fetched.isEmpty()) {
        log.info("Background refresh skipped for restaurant {}: provider returned nothing for placeId='{}'",
            restaurantId, externalId);
        return;
      }
      cacheStore.updateById(restaurantId, restaurantMapper.toSnapshot(fetched.get()), clock.instant());
      log.info("Background refresh updated restaurant {}", restaurantId);
    } catch (RuntimeException ex) {
      notifyFailure(restaurantId, externalId, ex);
    }
  }

  private void notifyFailure(Long restaurantId, String externalId, Throwable error) {
    try {
      failureHandler.onFailure(restaurantId, externalId, error);
    } catch (RuntimeException handlerError) {
      log.error("Refresh failure handler threw for restaurant {}", restaurantId, handlerError);
    }
  }
}
