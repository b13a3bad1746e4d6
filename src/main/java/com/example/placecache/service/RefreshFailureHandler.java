package com.example.placecache.service;

/**
 * Receives background refresh failures. Implementations must not throw.
 */
@FunctionalInterface
public interface RefreshFailureHandler {
  void onFailure(Long restaurantId, String externalId, Throwable error);
}
