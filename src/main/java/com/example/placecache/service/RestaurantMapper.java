package com.example.placecache.service;

import com.example.placecache.domain.Cuisine;
import com.example.placecache.domain.GeoCoordinates;
import com.example.placecache.domain.Restaurant;
import com.example.placecache.util.ExternalPlace;
import com.example.placecache.util.GeoPoint;
import com.example.placecache.util.PlaceSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class RestaurantMapper {
  private final CuisineClassifier cuisineClassifier;

  public PlaceSnapshot toSnapshot(ExternalPlace place) {
    Cuisine cuisine = cuisineClassifier.classify(place.categoryTags());
    Set<Cuisine> cuisines = new LinkedHashSet<>();
    cuisines.add(cuisine);

    GeoPoint point = place.coordinates();
    GeoCoordinates coordinates = point == null
        ? GeoCoordinates.of(0.0, 0.0)
        : GeoCoordinates.of(point.lat(), point.lng());

    String photoReference = place.photoReferences().isEmpty() ? null : place.photoReferences().get(0);

    return new PlaceSnapshot(
        place.name() == null ? "" : place.name(),
        place.formattedAddress() == null ? "" : place.formattedAddress(),
        place.phone() == null ? "" : place.phone(),
        cuisine,
        cuisines,
        coordinates,
        photoReference,
        place.website(),
        place.priceLevel(),
        place.rating()
    );
  }

  /**
   * Builds an unsaved record from fresh provider data. Used when the data could not be persisted.
   * Identity and creation time come from {@code existing} when there is one.
   */
  public Restaurant toUnsavedRestaurant(Restaurant existing, String externalId, PlaceSnapshot snapshot, Instant syncedAt) {
    Restaurant restaurant = new Restaurant();
    restaurant.setId(existing == null ? null : existing.getId());
    restaurant.setExternalId(externalId);
    snapshot.applyTo(restaurant, syncedAt);
    restaurant.setCreatedAt(existing == null || existing.getCreatedAt() == null ? syncedAt : existing.getCreatedAt());
    restaurant.setUpdatedAt(syncedAt);
    return restaurant;
  }
}
