package com.example.placecache.store;

import com.example.placecache.domain.Cuisine;
import com.example.placecache.domain.GeoCoordinates;
import com.example.placecache.domain.RecordSource;
import com.example.placecache.domain.Restaurant;
import com.example.placecache.repository.RestaurantRepository;
import com.example.placecache.util.PlaceSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Runs the JPA store against a SQLite file, the same database the service ships with.
 */
@SpringBootTest(properties = {
    "place-cache.store=jpa",
    "google.places.api-key="
})
class JpaCacheStoreSqliteTest {

  private static final Instant SYNCED_AT = Instant.parse("2026-03-10T12:00:00Z");
  private static final Path DB_DIR = createDbDir();

  @Autowired
  private JpaCacheStore store;

  @Autowired
  private RestaurantRepository restaurantRepository;

  @Autowired
  private Clock clock;

  @DynamicPropertySource
  static void sqliteUrl(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", () -> "jdbc:sqlite:" + DB_DIR.resolve("place-cache-test.db"));
  }

  private static Path createDbDir() {
    try {
      return Files.createTempDirectory("place-cache-sqlite");
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  private static PlaceSnapshot snapshot(String name) {
    Set<Cuisine> cuisines = new LinkedHashSet<>();
    cuisines.add(Cuisine.VIETNAMESE);
    return new PlaceSnapshot(name, "5 Pho Lane", "555-0123", Cuisine.VIETNAMESE, cuisines,
        GeoCoordinates.of(21.03, 105.85), "photo-ref", "https://pho.test", 2, 4.4);
  }

  private long rowsFor(String externalId) {
    return restaurantRepository.findAll().stream()
        .filter(r -> externalId.equals(r.getExternalId()))
        .count();
  }

  @Test
  @DisplayName("Upserted record round-trips through SQLite")
  void roundTrip() {
    Restaurant saved = store.upsertByExternalId("round-trip", snapshot("Pho House"), SYNCED_AT);

    Restaurant loaded = store.findByExternalId("round-trip").orElseThrow();

    assertNotNull(saved.getId());
    assertEquals(saved.getId(), loaded.getId());
    assertEquals("Pho House", loaded.getName());
    assertEquals(Cuisine.VIETNAMESE, loaded.getCuisine());
    assertEquals(Set.of(Cuisine.VIETNAMESE), loaded.getCuisines());
    assertEquals(RecordSource.EXTERNAL, loaded.getSource());
    assertEquals(SYNCED_AT, loaded.getLastSyncedAt());
    assertEquals(21.03, loaded.getCoordinates().getLat());
    assertEquals(105.85, loaded.getCoordinates().getLng());
    assertEquals(21.03, loaded.getCoordinates().getLatitude());
    assertEquals(105.85, loaded.getCoordinates().getLongitude());
    assertEquals("photo-ref", loaded.getPhotoReference());
    assertEquals(Integer.valueOf(2), loaded.getPriceLevel());
    assertEquals(Double.valueOf(4.4), loaded.getRating());
    assertNotNull(loaded.getCreatedAt());
  }

  @Test
  @DisplayName("A second insert for the same provider id is rejected by the unique column")
  void duplicateInsertRejected() {
    Restaurant first = new Restaurant();
    first.setName("First");
    first.setExternalId("duplicate");
    store.insert(first);

    Restaurant second = new Restaurant();
    second.setName("Second");
    second.setExternalId("duplicate");

    assertThrows(DataAccessException.class, () -> store.insert(second));
    assertEquals(1, rowsFor("duplicate"));
  }

  @Test
  @DisplayName("Losing a first-insert race returns the winner's record")
  void lostRaceUpdatesWinner() {
    Restaurant winner = new Restaurant();
    winner.setName("Winner");
    winner.setExternalId("lost-race");
    Restaurant stored = store.insert(winner);

    // the loser's lookup ran before the winner committed
    RestaurantRepository lateReader = mock(RestaurantRepository.class);
    when(lateReader.findFirstByExternalId("lost-race"))
        .thenReturn(Optional.empty())
        .thenAnswer(inv -> restaurantRepository.findFirstByExternalId("lost-race"));
    when(lateReader.saveAndFlush(any(Restaurant.class)))
        .thenAnswer(inv -> restaurantRepository.saveAndFlush(inv.<Restaurant>getArgument(0)));
    JpaCacheStore loser = new JpaCacheStore(lateReader, clock);

    Restaurant result = loser.upsertByExternalId("lost-race", snapshot("Loser Data"), SYNCED_AT);

    assertEquals(stored.getId(), result.getId());
    assertEquals(1, rowsFor("lost-race"));
    Restaurant reloaded = store.findById(stored.getId()).orElseThrow();
    assertEquals("Loser Data", reloaded.getName());
    assertEquals(RecordSource.EXTERNAL, reloaded.getSource());
  }

  @Test
  @DisplayName("Concurrent upserts leave one row per provider id")
  void concurrentUpserts() throws Exception {
    int writers = 8;
    List<String> keys = List.of("race-a", "race-b", "race-c", "race-d");
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Restaurant>> results = new ArrayList<>();
      List<String> resultKeys = new ArrayList<>();
      for (String key : keys) {
        for (int i = 0; i < writers; i++) {
          String name = key + "-writer-" + i;
          Callable<Restaurant> task = () -> {
            start.await();
            return store.upsertByExternalId(key, snapshot(name), SYNCED_AT);
          };
          results.add(pool.submit(task));
          resultKeys.add(key);
        }
      }
      start.countDown();

      List<Restaurant> returned = new ArrayList<>();
      for (Future<Restaurant> result : results) {
        returned.add(result.get(30, TimeUnit.SECONDS));
      }

      for (String key : keys) {
        Long id = store.findByExternalId(key).orElseThrow().getId();
        for (int i = 0; i < returned.size(); i++) {
          if (resultKeys.get(i).equals(key)) {
            assertEquals(id, returned.get(i).getId());
          }
        }
        assertEquals(1, rowsFor(key));
      }
    } finally {
      pool.shutdownNow();
    }
  }
}
