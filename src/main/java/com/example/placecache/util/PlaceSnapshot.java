package com.example.placecache.util;

import com.example.placecache.domain.Cuisine;
import com.example.placecache.domain.GeoCoordinates;
import com.example.placecache.domain.RecordSource;
import com.example.placecache.domain.Restaurant;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Normalized provider data, ready to be written onto a {@link Restaurant}.
 */
public record PlaceSnapshot(String name,
                            String address,
                            String phone,
                            Cuisine cuisine,
                            Set<Cuisine> cuisines,
                            GeoCoordinates coordinates,
                            String photoReference,
                            String website,
                            Integer priceLevel,
                            Double rating) {

  /**
   * Copies every provider field onto the record and marks it as synced from the provider.
   * Identity and audit fields are left to the store.
   */
  public void applyTo(Restaurant restaurant, Instant syncedAt) {
    restaurant.setName(name);
    restaurant.setAddress(address);
    restaurant.setPhone(phone);
    restaurant.setCuisine(cuisine);
    restaurant.setCuisines(new LinkedHashSet<>(cuisines));
    restaurant.setCoordinates(GeoCoordinates.of(coordinates.getLat(), coordinates.getLng()));
    restaurant.setPhotoReference(photoReference);
    restaurant.setWebsite(website);
    restaurant.setPriceLevel(priceLevel);
    restaurant.setRating(rating);
    restaurant.setSource(RecordSource.EXTERNAL);
    restaurant.setLastSyncedAt(syncedAt);
  }
}
