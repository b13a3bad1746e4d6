package com.example.placecache.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Stored position of a restaurant. Older readers expect {@code latitude}/{@code longitude}
 * while newer ones read {@code lat}/{@code lng}, so both pairs are persisted.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
public class GeoCoordinates {
  @Column(name = "lat")
  private double lat;

  @Column(name = "lng")
  private double lng;

  @Column(name = "latitude")
  private double latitude;

  @Column(name = "longitude")
  private double longitude;

  public static GeoCoordinates of(double lat, double lng) {
    GeoCoordinates coordinates = new GeoCoordinates();
    coordinates.setLat(lat);
    coordinates.setLng(lng);
    coordinates.setLatitude(lat);
    coordinates.setLongitude(lng);
    return coordinates;
  }
}
