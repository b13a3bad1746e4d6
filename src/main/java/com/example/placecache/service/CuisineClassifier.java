package com.example.placecache.service;

import com.example.placecache.domain.Cuisine;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps provider place types (for example {@code italian_restaurant}) to a single {@link Cuisine}.
 * Exact type matches win over keyword matches; within each pass the first tag decides.
 */
@Component
public class CuisineClassifier {
  public static final Cuisine DEFAULT_CUISINE = Cuisine.AMERICAN;

  private static final Map<String, Cuisine> TYPE_TO_CUISINE = Map.ofEntries(
      Map.entry("mexican_restaurant", Cuisine.MEXICAN),
      Map.entry("italian_restaurant", Cuisine.ITALIAN),
      Map.entry("chinese_restaurant", Cuisine.CHINESE),
      Map.entry("japanese_restaurant", Cuisine.JAPANESE),
      Map.entry("sushi_restaurant", Cuisine.JAPANESE),
      Map.entry("ramen_restaurant", Cuisine.JAPANESE),
      Map.entry("thai_restaurant", Cuisine.THAI),
      Map.entry("indian_restaurant", Cuisine.INDIAN),
      Map.entry("french_restaurant", Cuisine.FRENCH),
      Map.entry("mediterranean_restaurant", Cuisine.MEDITERRANEAN),
      Map.entry("middle_eastern_restaurant", Cuisine.MIDDLE_EASTERN),
      Map.entry("seafood_restaurant", Cuisine.SEAFOOD),
      Map.entry("steakhouse", Cuisine.STEAKHOUSE),
      Map.entry("american_restaurant", Cuisine.AMERICAN),
      Map.entry("pizza_restaurant", Cuisine.PIZZA),
      Map.entry("barbecue_restaurant", Cuisine.BBQ),
      Map.entry("cafe", Cuisine.COFFEE),
      Map.entry("coffee", Cuisine.COFFEE),
      Map.entry("breakfast_restaurant", Cuisine.BREAKFAST),
      Map.entry("brunch_restaurant", Cuisine.BRUNCH),
      Map.entry("fast_food_restaurant", Cuisine.FAST_FOOD),
      Map.entry("korean_restaurant", Cuisine.KOREAN),
      Map.entry("vietnamese_restaurant", Cuisine.VIETNAMESE),
      Map.entry("greek_restaurant", Cuisine.GREEK),
      Map.entry("spanish_restaurant", Cuisine.SPANISH),
      Map.entry("tapas_restaurant", Cuisine.SPANISH),
      Map.entry("turkish_restaurant", Cuisine.TURKISH),
      Map.entry("portuguese_restaurant", Cuisine.PORTUGUESE),
      Map.entry("brazilian_restaurant", Cuisine.BRAZILIAN)
  );

  // tried in order for each tag; the first matching rule decides
  private static final List<KeywordRule> KEYWORD_RULES = List.of(
      new KeywordRule(Cuisine.MEXICAN, "mexican"),
      new KeywordRule(Cuisine.ITALIAN, "italian"),
      new KeywordRule(Cuisine.CHINESE, "chinese"),
      new KeywordRule(Cuisine.JAPANESE, "japanese", "sushi"),
      new KeywordRule(Cuisine.THAI, "thai"),
      new KeywordRule(Cuisine.INDIAN, "indian"),
      new KeywordRule(Cuisine.FRENCH, "french"),
      new KeywordRule(Cuisine.MEDITERRANEAN, "mediterranean"),
      new KeywordRule(Cuisine.SEAFOOD, "seafood"),
      new KeywordRule(Cuisine.STEAKHOUSE, "steak"),
      new KeywordRule(Cuisine.BBQ, "bbq", "barbecue"),
      new KeywordRule(Cuisine.PIZZA, "pizza"),
      new KeywordRule(Cuisine.COFFEE, "coffee", "cafe"),
      new KeywordRule(Cuisine.KOREAN, "korean"),
      new KeywordRule(Cuisine.VIETNAMESE, "vietnamese"),
      new KeywordRule(Cuisine.GREEK, "greek"),
      new KeywordRule(Cuisine.SPANISH, "spanish", "tapas"),
      new KeywordRule(Cuisine.TURKISH, "turkish"),
      new KeywordRule(Cuisine.PORTUGUESE, "portuguese"),
      new KeywordRule(Cuisine.BRAZILIAN, "brazilian")
  );

  public Cuisine classify(List<String> tags) {
    if (tags == null || tags.isEmpty()) {
      return DEFAULT_CUISINE;
    }

    for (String tag : tags) {
      if (tag == null) {
        continue;
      }
      Cuisine exact = TYPE_TO_CUISINE.get(tag.toLowerCase(Locale.ROOT));
      if (exact != null) {
        return exact;
      }
    }

    for (String tag : tags) {
      if (tag == null) {
        continue;
      }
      String lower = tag.toLowerCase(Locale.ROOT);
      for (KeywordRule rule : KEYWORD_RULES) {
        if (rule.matches(lower)) {
          return rule.cuisine();
        }
      }
    }

    return DEFAULT_CUISINE;
  }

  private record KeywordRule(Cuisine cuisine, String... keywords) {
    boolean matches(String tag) {
      for (String keyword : keywords) {
        if (tag.contains(keyword)) {
          return true;
        }
      }
      return false;
    }
  }
}
