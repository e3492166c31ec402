package com.mealscout.integrations;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealscout.config.IntegrationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class YelpReviewClient implements ReviewClient {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> LIST_TYPE = new TypeReference<>() {};

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final HttpCallPolicy policy;

    public YelpReviewClient(@Qualifier("yelpWebClient") WebClient webClient,
                            ObjectMapper objectMapper,
                            IntegrationProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        IntegrationProperties.Client client = properties.getClient();
        this.policy = new HttpCallPolicy("Yelp", client.getTimeoutMs(),
                client.getRetryMaxAttempts(), client.getRetryBackoffMs());
    }

    @Override
    public Optional<Map<String, Object>> matchBusiness(String name, double latitude, double longitude) {
        log.info("Searching businesses term='{}' at ({}, {})", name, latitude, longitude);
        JsonNode data = policy.await(webClient.get()
                .uri(uri -> uri.path("/businesses/search")
                        .queryParam("term", name)
                        .queryParam("sort_by", "best_match")
                        .queryParam("limit", 1)
                        .queryParam("latitude", latitude)
                        .queryParam("longitude", longitude)
                        .build())
                .retrieve()
                .bodyToMono(JsonNode.class));
        JsonNode businesses = data == null ? null : data.path("businesses");
        if (businesses == null || !businesses.isArray() || businesses.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.convertValue(businesses.get(0), MAP_TYPE));
    }

    @Override
    public List<Map<String, Object>> reviews(String businessId) {
        log.info("Fetching reviews businessId={}", businessId);
        JsonNode data = policy.await(webClient.get()
                .uri("/businesses/{id}/reviews", businessId)
                .retrieve()
                .bodyToMono(JsonNode.class));
        if (data == null || !data.path("reviews").isArray()) {
            return List.of();
        }
        return objectMapper.convertValue(data.get("reviews"), LIST_TYPE);
    }
}
