package com.example.placecache.provider;

import com.example.placecache.util.ExternalPlace;

import java.util.Optional;

/**
 * Looks up a place at the third-party provider.
 */
@FunctionalInterface
public interface PlaceProvider {

  /**
   * @return the place, or empty when the provider has nothing for this id
   * @throws PlaceProviderException on transport errors, timeouts or error responses
   */
  Optional<ExternalPlace> fetch(String externalId);
}
