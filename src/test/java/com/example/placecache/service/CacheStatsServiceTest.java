package com.example.placecache.service;

import com.example.placecache.MutableClock;
import com.example.placecache.domain.RecordSource;
import com.example.placecache.domain.Restaurant;
import com.example.placecache.store.CacheStore;
import com.example.placecache.store.InMemoryCacheStore;
import com.example.placecache.util.CacheStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CacheStatsServiceTest {

  private final InMemoryCacheStore store = new InMemoryCacheStore(new MutableClock(Instant.parse("2026-03-10T12:00:00Z")));
  private final CacheStatsService statsService = new CacheStatsService(store);

  private void seed(RecordSource source, int count) {
    for (int i = 0; i < count; i++) {
      Restaurant restaurant = new Restaurant();
      restaurant.setName(source.getValue() + "-" + i);
      restaurant.setSource(source);
      store.insert(restaurant);
    }
  }

  @Test
  @DisplayName("Seven of ten provider-sourced records give a 0.7 estimate")
  void sevenOfTen() {
    seed(RecordSource.EXTERNAL, 7);
    seed(RecordSource.MANUAL, 3);

    CacheStats stats = statsService.snapshot();

    assertEquals(10, stats.total());
    assertEquals(7, stats.externalSourced());
    assertEquals(3, stats.manualSourced());
    assertEquals(0.7, stats.hitRateEstimate(), 1e-9);
  }

  @Test
  @DisplayName("Empty store gives zeros without dividing by zero")
  void emptyStore() {
    assertEquals(new CacheStats(0, 0, 0, 0.0), statsService.snapshot());
  }

  @Test
  @DisplayName("Store failure gives an empty snapshot")
  void storeFailure() {
    CacheStore broken = mock(CacheStore.class);
    when(broken.count()).thenThrow(new IllegalStateException("offline"));

    assertEquals(CacheStats.empty(), new CacheStatsService(broken).snapshot());
  }

  @Test
  @DisplayName("Scheduled report reads a snapshot")
  void schedulerReadsSnapshot() {
    CacheStatsService mocked = mock(CacheStatsService.class);
    when(mocked.snapshot()).thenReturn(new CacheStats(4, 3, 1, 0.75));

    new CacheStatsScheduler(mocked).reportStats();

    verify(mocked).snapshot();
  }
}
