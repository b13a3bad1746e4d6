package com.example.placecache.repository;

import com.example.placecache.domain.RecordSource;
import com.example.placecache.domain.Restaurant;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface RestaurantRepository extends JpaRepository<Restaurant, Long> {
  Optional<Restaurant> findFirstByExternalId(String externalId);

  long countBySource(RecordSource source);
}
