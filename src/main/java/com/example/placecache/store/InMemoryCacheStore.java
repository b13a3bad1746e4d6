package com.example.placecache.store;

import com.example.placecache.domain.GeoCoordinates;
import com.example.placecache.domain.RecordSource;
import com.example.placecache.domain.Restaurant;
import com.example.placecache.util.PlaceSnapshot;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed store for local runs and tests. Callers always receive copies, so a returned
 * record does not change when the store is written to later.
 */
@Component
@ConditionalOnProperty(name = "place-cache.store", havingValue = "memory")
public class InMemoryCacheStore implements CacheStore {
  private final Map<Long, Restaurant> records = new ConcurrentHashMap<>();
  private final Map<String, Long> idsByExternalId = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final Clock clock;

  public InMemoryCacheStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<Restaurant> findByExternalId(String externalId) {
    if (externalId == null) {
      return Optional.empty();
    }
    Long id = idsByExternalId.get(externalId);
    return id == null ? Optional.empty() : findById(id);
  }

  @Override
  public Optional<Restaurant> findById(Long id) {
    Restaurant stored = records.get(id);
    return stored == null ? Optional.empty() : Optional.of(copy(stored));
  }

  @Override
  public synchronized Restaurant insert(Restaurant restaurant) {
    Restaurant stored = copy(restaurant);
    Instant now = clock.instant();
    stored.setId(sequence.incrementAndGet());
    stored.setCreatedAt(now);
    stored.setUpdatedAt(now);
    String externalId = stored.getExternalId();
    if (externalId != null && idsByExternalId.containsKey(externalId)) {
      throw new IllegalStateException("Duplicate externalId: " + externalId);
    }
    records.put(stored.getId(), stored);
    if (externalId != null) {
      idsByExternalId.put(externalId, stored.getId());
    }
    return copy(stored);
  }

  @Override
  public synchronized Restaurant updateById(Long id, PlaceSnapshot snapshot, Instant syncedAt) {
    Restaurant stored = records.get(id);
    if (stored == null) {
      throw new RecordNotFoundException(id);
    }
    snapshot.applyTo(stored, syncedAt);
    stored.setUpdatedAt(clock.instant());
    return copy(stored);
  }

  @Override
  public synchronized Restaurant upsertByExternalId(String externalId, PlaceSnapshot snapshot, Instant syncedAt) {
    Long id = idsByExternalId.get(externalId);
    if (id != null) {
      return updateById(id, snapshot, syncedAt);
    }
    Restaurant created = new Restaurant();
    created.setExternalId(externalId);
    snapshot.applyTo(created, syncedAt);
    return insert(created);
  }

  @Override
  public List<Restaurant> findAll() {
    List<Restaurant> all = new ArrayList<>();
    for (Restaurant stored : records.values()) {
      all.add(copy(stored));
    }
    all.sort(Comparator.comparing(Restaurant::getId));
    return all;
  }

  @Override
  public long count() {
    return records.size();
  }

  @Override
  public long countBySource(RecordSource source) {
    return records.values().stream()
        .filter(r -> r.getSource() == source)
        .count();
  }

  private Restaurant copy(Restaurant source) {
    Restaurant target = new Restaurant();
    target.setId(source.getId());
    target.setExternalId(source.getExternalId());
    target.setName(source.getName());
    target.setAddress(source.getAddress());
    target.setPhone(source.getPhone());
    target.setCuisine(source.getCuisine());
    target.setCuisines(new LinkedHashSet<>(source.getCuisines()));
    GeoCoordinates coordinates = source.getCoordinates();
    if (coordinates != null) {
      GeoCoordinates copied = new GeoCoordinates();
      copied.setLat(coordinates.getLat());
      copied.setLng(coordinates.getLng());
      copied.setLatitude(coordinates.getLatitude());
      copied.setLongitude(coordinates.getLongitude());
      target.setCoordinates(copied);
    }
    target.setSource(source.getSource());
    target.setLastSyncedAt(source.getLastSyncedAt());
    target.setPhotoReference(source.getPhotoReference());
    target.setWebsite(source.getWebsite());
    target.setPriceLevel(source.getPriceLevel());
    target.setRating(source.getRating());
    target.setCreatedAt(source.getCreatedAt());
    target.setUpdatedAt(source.getUpdatedAt());
    return target;
  }
}
