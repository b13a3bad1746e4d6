package com.example.placecache.store;

import com.example.placecache.domain.RecordSource;
import com.example.placecache.domain.Restaurant;
import com.example.placecache.util.PlaceSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for cached restaurants, keyed by the provider's place id.
 *
 * <p>{@link #findByExternalId} followed by {@link #insert} is not atomic. Writers that create
 * records for a provider id use {@link #upsertByExternalId} instead.
 */
public interface CacheStore {

  Optional<Restaurant> findByExternalId(String externalId);

  Optional<Restaurant> findById(Long id);

  /**
   * Stores a new record. The store assigns the id and the audit timestamps.
   */
  Restaurant insert(Restaurant restaurant);

  /**
   * Writes provider data onto an existing record.
   *
   * @throws RecordNotFoundException when no record has this id
   */
  Restaurant updateById(Long id, PlaceSnapshot snapshot, Instant syncedAt);

  /**
   * Inserts a record for {@code externalId}, or updates the one that already exists.
   * Concurrent callers for the same id end up sharing one record.
   */
  Restaurant upsertByExternalId(String externalId, PlaceSnapshot snapshot, Instant syncedAt);

  List<Restaurant> findAll();

  long count();

  long countBySource(RecordSource source);
}
