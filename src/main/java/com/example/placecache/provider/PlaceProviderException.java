package com.example.placecache.provider;

/**
 * The provider could not be reached or answered with an error.
 */
public class PlaceProviderException extends RuntimeException {
  public PlaceProviderException(String message) {
    super(message);
  }

  public PlaceProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
