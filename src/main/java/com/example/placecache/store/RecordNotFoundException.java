package com.example.placecache.store;

public class RecordNotFoundException extends RuntimeException {
  public RecordNotFoundException(Long id) {
    super("Restaurant not found: id=" + id);
  }
}
