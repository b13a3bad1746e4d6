package com.example.placecache.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "restaurants")
@Getter
@Setter
@NoArgsConstructor
public class Restaurant {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(unique = true)
  private String externalId;

  @Column(nullable = false)
  private String name;

  private String address = "";

  private String phone = "";

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private Cuisine cuisine = Cuisine.AMERICAN;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "restaurant_cuisines", joinColumns = @JoinColumn(name = "restaurant_id"))
  @Enumerated(EnumType.STRING)
  @Column(name = "cuisine")
  private Set<Cuisine> cuisines = new LinkedHashSet<>();

  @Embedded
  private GeoCoordinates coordinates;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private RecordSource source = RecordSource.MANUAL;

  private Instant lastSyncedAt;

  private String photoReference;

  private String website;

  private Integer priceLevel;

  private Double rating;

  @Column(nullable = false)
  private Instant createdAt = Instant.now();

  @Column(nullable = false)
  private Instant updatedAt = Instant.now();
}
