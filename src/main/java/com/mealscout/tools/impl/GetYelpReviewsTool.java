package com.mealscout.tools.impl;

import com.mealscout.integrations.ReviewClient;
import com.mealscout.service.ChatStore;
import com.mealscout.tools.AiTool;
import com.mealscout.tools.ToolArguments;
import com.mealscout.tools.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Matches a cached place to a Yelp business by name and coordinates and returns its rating and reviews.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GetYelpReviewsTool implements AiTool {

    private final ChatStore chatStore;
    private final ReviewClient reviewClient;

    @Override
    public String name() {
        return "get_yelp_reviews";
    }

    @Override
    public String description() {
        return "Get Yelp reviews and ratings for a specific place. Use this after finding a place through Google Maps to get additional customer feedback.";
    }

    @Override
    public Map<String, Object> openAiJsonSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "place_id", Map.of("type", "string",
                                "description", "The Google Maps place_id of the business to get reviews for")
                ),
                "required", List.of("place_id")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> args, String chatId) {
        String placeId = ToolArguments.string(args, "place_id", null);
        Optional<Map<String, Object>> place = chatStore.findPlace(placeId);
        if (place.isEmpty()) {
            return ToolResult.error(name(), "No place data found for place_id: " + placeId);
        }

        Double latitude = null;
        Double longitude = null;
        if (place.get().get("location") instanceof Map<?, ?> location) {
            latitude = asDouble(location.get("latitude"));
            longitude = asDouble(location.get("longitude"));
        }
        if (latitude == null || longitude == null) {
            return ToolResult.error(name(), "Invalid place data: Place has no location data");
        }
        String businessName = null;
        if (place.get().get("displayName") instanceof Map<?, ?> displayName && displayName.get("text") != null) {
            businessName = displayName.get("text").toString();
        }
        if (businessName == null || businessName.isBlank()) {
            return ToolResult.error(name(), "Invalid place data: Place has no display name");
        }

        Optional<Map<String, Object>> business = reviewClient.matchBusiness(businessName, latitude, longitude);
        if (business.isEmpty()) {
            log.warn("No business matching '{}' placeId={}", businessName, placeId);
            return ToolResult.error(name(), "No businesses found in Yelp search");
        }
        chatStore.updatePlaceField(placeId, "yelpData", business.get());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("yelp_rating", business.get().get("rating"));
        response.put("yelp_review_count", business.get().get("review_count"));

        Object businessId = business.get().get("id");
        if (businessId != null) {
            List<Map<String, Object>> reviews = reviewClient.reviews(businessId.toString());
            if (!reviews.isEmpty()) {
                chatStore.updatePlaceField(placeId, "yelpReviews", reviews);
            }
            response.put("yelp_reviews", reviews.stream()
                    .map(review -> review.get("text"))
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList());
            log.info("Retrieved {} review(s) placeId={}", reviews.size(), placeId);
        }
        return ToolResult.ok(name(), response);
    }

    private static Double asDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : null;
    }
}
