package com.example.placecache.util;

import java.util.List;

/**
 * Place details as returned by a {@link com.example.placecache.provider.PlaceProvider}.
 * Optional values are null when the provider omits them; lists are never null.
 */
public record ExternalPlace(String name,
                            String formattedAddress,
                            String phone,
                            List<String> categoryTags,
                            GeoPoint coordinates,
                            List<String> photoReferences,
                            String website,
                            Integer priceLevel,
                            Double rating) {
  public ExternalPlace {
    categoryTags = categoryTags == null ? List.of() : List.copyOf(categoryTags);
    photoReferences = photoReferences == null ? List.of() : List.copyOf(photoReferences);
  }

  public ExternalPlace(String name,
                       String formattedAddress,
                       String phone,
                       List<String> categoryTags,
                       GeoPoint coordinates,
                       List<String> photoReferences) {
    this(name, formattedAddress, phone, categoryTags, coordinates, photoReferences, null, null, null);
  }
}
