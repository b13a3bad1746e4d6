package com.example.placecache.provider;

import com.example.placecache.util.ExternalPlace;
import com.example.placecache.util.GeoPoint;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@Slf4j
public class GooglePlacesProvider implements PlaceProvider {
  static final String DETAILS_FIELDS = "place_id,name,formatted_address,formatted_phone_number,geometry,types,photos,website,price_level,rating";

  private final RestTemplate restTemplate;
  private final String apiKey;
  private final String baseUrl;

  public GooglePlacesProvider(RestTemplate restTemplate,
                              @Value("${google.places.api-key:}") String apiKey,
                              @Value("${google.places.base-url:https://maps.googleapis.com/maps/api/place}") String baseUrl) {
    this.restTemplate = restTemplate;
    this.apiKey = apiKey;
    this.baseUrl = baseUrl;
  }

  @Override
  public Optional<ExternalPlace> fetch(String externalId) {
    if (externalId == null || externalId.isBlank()) {
      return Optional.empty();
    }
    if (apiKey == null || apiKey.isBlank()) {
      log.warn("Place details skipped for placeId='{}': missing GOOGLE_PLACES_API_KEY", externalId);
      return Optional.empty();
    }

    String url = baseUrl + "/details/json?place_id={placeId}&fields={fields}&key={key}";
    JsonNode response;
    try {
      response = restTemplate.getForObject(url, JsonNode.class, externalId, DETAILS_FIELDS, apiKey);
    } catch (HttpStatusCodeException ex) {
      throw new PlaceProviderException("Place details HTTP " + ex.getStatusCode().value() + " for placeId=" + externalId, ex);
    } catch (RestClientException ex) {
      throw new PlaceProviderException("Place details request failed for placeId=" + externalId, ex);
    }

    if (response == null) {
      throw new PlaceProviderException("Empty place details response for placeId=" + externalId);
    }
    String status = response.path("status").asText("");
    switch (status) {
      case "OK" -> {
        return Optional.of(parse(response.path("result")));
      }
      case "ZERO_RESULTS", "NOT_FOUND" -> {
        log.info("Place details miss for placeId='{}': {}", externalId, status);
        return Optional.empty();
      }
      default -> {
        String message = response.path("error_message").asText("");
        throw new PlaceProviderException("Place details status " + status + " for placeId=" + externalId
            + (message.isEmpty() ? "" : ": " + message));
      }
    }
  }

  private ExternalPlace parse(JsonNode result) {
    List<String> types = new ArrayList<>();
    for (JsonNode type : result.path("types")) {
      types.add(type.asText());
    }

    List<String> photos = new ArrayList<>();
    for (JsonNode photo : result.path("photos")) {
      String reference = photo.path("photo_reference").asText("");
      if (!reference.isEmpty()) {
        photos.add(reference);
      }
    }

    GeoPoint coordinates = null;
    JsonNode location = result.path("geometry").path("location");
    if (location.has("lat") && location.has("lng")) {
      coordinates = new GeoPoint(location.path("lat").asDouble(), location.path("lng").asDouble());
    }

    return new ExternalPlace(
        result.path("name").asText(""),
        result.path("formatted_address").asText(""),
        textOrNull(result, "formatted_phone_number"),
        types,
        coordinates,
        photos,
        textOrNull(result, "website"),
        result.hasNonNull("price_level") ? result.get("price_level").asInt() : null,
        result.hasNonNull("rating") ? result.get("rating").asDouble() : null
    );
  }

  private String textOrNull(JsonNode node, String field) {
    String value = node.path(field).asText("");
    return value.isBlank() ? null : value;
  }
}
