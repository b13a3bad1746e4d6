package com.example.placecache.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Cuisine {
  MEXICAN("mexican"),
  ITALIAN("italian"),
  CHINESE("chinese"),
  JAPANESE("japanese"),
  THAI("thai"),
  INDIAN("indian"),
  FRENCH("french"),
  MEDITERRANEAN("mediterranean"),
  MIDDLE_EASTERN("middle eastern"),
  SEAFOOD("seafood"),
  STEAKHOUSE("steakhouse"),
  AMERICAN("american"),
  PIZZA("pizza"),
  BBQ("bbq"),
  COFFEE("coffee"),
  BREAKFAST("breakfast"),
  BRUNCH("brunch"),
  FAST_FOOD("fast food"),
  KOREAN("korean"),
  VIETNAMESE("vietnamese"),
  GREEK("greek"),
  SPANISH("spanish"),
  TURKISH("turkish"),
  PORTUGUESE("portuguese"),
  BRAZILIAN("brazilian");

  private final String value;

  Cuisine(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
