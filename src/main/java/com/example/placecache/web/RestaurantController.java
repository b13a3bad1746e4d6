package com.example.placecache.web;

import com.example.placecache.domain.Restaurant;
import com.example.placecache.provider.PlaceProvider;
import com.example.placecache.service.BackgroundRefresher;
import com.example.placecache.service.RestaurantCacheService;
import com.example.placecache.store.CacheStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/restaurants")
@RequiredArgsConstructor
public class RestaurantController {
  private final RestaurantCacheService restaurantCacheService;
  private final BackgroundRefresher backgroundRefresher;
  private final CacheStore cacheStore;
  private final PlaceProvider placeProvider;

  /**
   * Restaurant selection: resolves a provider place id to a stored restaurant.
   */
  @GetMapping("/places/{placeId}")
  public ResponseEntity<Restaurant> byPlaceId(@PathVariable String placeId) {
    return restaurantCacheService.fetchOrCache(placeId, placeProvider)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  /**
   * Listing: returns what is stored now and refreshes stale entries in the background.
   */
  @GetMapping
  public List<Restaurant> list() {
    List<Restaurant> restaurants = cacheStore.findAll();
    backgroundRefresher.refreshStale(restaurants, placeProvider);
    return restaurants;
  }
}
