package com.mealscout.integrations;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealscout.config.IntegrationProperties;
import com.mealscout.model.GeoLocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Places API (v1) text search and place details.
 */
@Component
@Slf4j
public class GooglePlacesClient implements PlacesClient {

    private static final TypeReference<List<Map<String, Object>>> LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String SEARCH_FIELD_MASK = Stream.concat(
                    PlaceFields.DEFAULT_SEARCH.stream().sorted().map(field -> "places." + field),
                    Stream.of("nextPageToken"))
            .collect(Collectors.joining(","));

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final IntegrationProperties.Google google;
    private final HttpCallPolicy policy;

    public GooglePlacesClient(@Qualifier("googlePlacesWebClient") WebClient webClient,
                              ObjectMapper objectMapper,
                              IntegrationProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.google = properties.getGoogle();
        IntegrationProperties.Client client = properties.getClient();
        this.policy = new HttpCallPolicy("Google Places", client.getTimeoutMs(),
                client.getRetryMaxAttempts(), client.getRetryBackoffMs());
    }

    @Override
    public List<Map<String, Object>> searchText(PlaceSearch search) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("textQuery", search.query());
        body.put("pageSize", search.clampedLimit());

        GeoLocation location = search.location();
        if (location != null && location.isComplete()) {
            log.debug("Adding location bias lat={} lng={} radius={}",
                    location.latitude(), location.longitude(), search.clampedRadius());
            body.put("locationBias", Map.of("circle", Map.of(
                    "center", Map.of("latitude", location.latitude(), "longitude", location.longitude()),
                    "radius", (double) search.clampedRadius())));
        }

        JsonNode data = null;
        int page = Math.max(0, search.page());
        for (int current = 0; current <= page; current++) {
            data = policy.await(webClient.post()
                    .uri(google.getSearchEndpoint())
                    .header("X-Goog-FieldMask", SEARCH_FIELD_MASK)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class));
            log.info("Places search query='{}' page {} returned {} result(s)",
                    search.query(), current, data == null ? 0 : data.path("places").size());
            if (current == page || data == null) {
                break;
            }
            String nextToken = data.path("nextPageToken").asText(null);
            if (nextToken == null || nextToken.isBlank()) {
                log.warn("No nextPageToken at page {}; returning results of that page", current);
                break;
            }
            body.put("pageToken", nextToken);
            pause();
        }

        if (data == null || !data.path("places").isArray()) {
            return List.of();
        }
        return objectMapper.convertValue(data.get("places"), LIST_TYPE);
    }

    @Override
    public Map<String, Object> details(String placeId, List<String> fields) {
        log.debug("Fetching place details placeId={} fields={}", placeId, fields);
        JsonNode data = policy.await(webClient.get()
                .uri(google.getPlacesEndpoint() + "/{placeId}", placeId)
                .header("X-Goog-FieldMask", String.join(",", fields))
                .retrieve()
                .bodyToMono(JsonNode.class));
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        return objectMapper.convertValue(data, MAP_TYPE);
    }

    @Override
    public String photoMediaUrl(String photoName) {
        return google.getPhotosEndpoint() + "/" + photoName
                + "/media?maxHeightPx=400&maxWidthPx=400&key=" + google.getApiKey();
    }

    private void pause() {
        // the next page token is not valid immediately after it is issued
        try {
            TimeUnit.MILLISECONDS.sleep(google.getPageDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException(policy.service(), "Interrupted while paging search results", e);
        }
    }
}
