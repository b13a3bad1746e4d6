package com.example.placecache.store;

import com.example.placecache.domain.RecordSource;
import com.example.placecache.domain.Restaurant;
import com.example.placecache.repository.RestaurantRepository;
import com.example.placecache.util.PlaceSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
@ConditionalOnProperty(name = "place-cache.store", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaCacheStore implements CacheStore {
  private final RestaurantRepository restaurantRepository;
  private final Clock clock;

  @Override
  public Optional<Restaurant> findByExternalId(String externalId) {
    return restaurantRepository.findFirstByExternalId(externalId);
  }

  @Override
  public Optional<Restaurant> findById(Long id) {
    return restaurantRepository.findById(id);
  }

  @Override
  public Restaurant insert(Restaurant restaurant) {
    Instant now = clock.instant();
    restaurant.setId(null);
    restaurant.setCreatedAt(now);
    restaurant.setUpdatedAt(now);
    return restaurantRepository.saveAndFlush(restaurant);
  }

  @Override
  public Restaurant updateById(Long id, PlaceSnapshot snapshot, Instant syncedAt) {
    Restaurant restaurant = restaurantRepository.findById(id)
        .orElseThrow(() -> new RecordNotFoundException(id));
    return update(restaurant, snapshot, syncedAt);
  }

  @Override
  public Restaurant upsertByExternalId(String externalId, PlaceSnapshot snapshot, Instant syncedAt) {
    Optional<Restaurant> existing = restaurantRepository.findFirstByExternalId(externalId);
    if (existing.isPresent()) {
      return update(existing.get(), snapshot, syncedAt);
    }

    Restaurant created = new Restaurant();
    created.setExternalId(externalId);
    snapshot.applyTo(created, syncedAt);
    try {
      return insert(created);
    } catch (DataAccessException ex) {
      // SQLite reports the unique external_id violation as JpaSystemException, not DataIntegrityViolationException
      Optional<Restaurant> winner = restaurantRepository.findFirstByExternalId(externalId);
      if (winner.isEmpty()) {
        throw ex;
      }
      log.info("Concurrent insert detected for externalId='{}', updating restaurant {}", externalId, winner.get().getId());
      return update(winner.get(), snapshot, syncedAt);
    }
  }

  @Override
  public List<Restaurant> findAll() {
    return restaurantRepository.findAll();
  }

  @Override
  public long count() {
    return restaurantRepository.count();
  }

  @Override
  public long countBySource(RecordSource source) {
    return restaurantRepository.countBySource(source);
  }

  private Restaurant update(Restaurant restaurant, PlaceSnapshot snapshot, Instant syncedAt) {
    snapshot.applyTo(restaurant, syncedAt);
    restaurant.setUpdatedAt(clock.instant());
    return restaurantRepository.saveAndFlush(restaurant);
  }
}
