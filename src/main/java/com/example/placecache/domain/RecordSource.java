package com.example.placecache.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecordSource {
  MANUAL("manual"),
  EXTERNAL("external");

  private final String value;

  RecordSource(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
