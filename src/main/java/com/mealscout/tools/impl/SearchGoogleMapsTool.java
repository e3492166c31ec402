package com.mealscout.tools.impl;

import com.mealscout.integrations.PlaceSearch;
import com.mealscout.integrations.PlacesClient;
import com.mealscout.model.ChatRecord;
import com.mealscout.model.GeoLocation;
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

@Slf4j
@Component
@RequiredArgsConstructor
public class SearchGoogleMapsTool implements AiTool {

    private final PlacesClient placesClient;
    private final ChatStore chatStore;

    @Override
    public String name() {
        return "search_google_maps";
    }

    @Override
    public String description() {
        return "Search Google Maps for a query. Include any relevant terms you think are necessary to get a better result";
    }

    @Override
    public Map<String, Object> openAiJsonSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of("type", "string",
                                "description", "The search query, e.g. 'pizza in new york'. The user's location will be attached to the query"),
                        "radius", Map.of("type", "number",
                                "description", "The search radius in meters (default: 5000). The radius must be between 0.0 and 50000.0, inclusive"),
                        "limit", Map.of("type", "number",
                                "description", "The maximum number of places to return (default: 5). The limit must be between 0 and 20, inclusive"),
                        "page", Map.of("type", "number",
                                "description", "The page of results to retrieve. The default is 0")
                ),
                "required", List.of("query")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> args, String chatId) {
        String query = ToolArguments.string(args, "query", null);
        if (query == null) {
            return ToolResult.error(name(), "query is required");
        }
        GeoLocation location = chatStore.findChat(chatId).map(ChatRecord::getLocation).orElse(null);
        PlaceSearch search = new PlaceSearch(
                query,
                location,
                ToolArguments.integer(args, "radius", PlaceSearch.DEFAULT_RADIUS),
                ToolArguments.integer(args, "limit", PlaceSearch.DEFAULT_LIMIT),
                ToolArguments.integer(args, "page", 0));
        log.info("Searching places query='{}' page={} chatId={}", query, search.page(), chatId);

        List<Map<String, Object>> places = placesClient.searchText(search);
        if (!places.isEmpty()) {
            chatStore.savePlaces(places);
            if (chatId != null) {
                List<String> ids = places.stream()
                        .map(place -> place.get("id"))
                        .filter(Objects::nonNull)
                        .map(Object::toString)
                        .toList();
                chatStore.appendPlaceIds(chatId, ids);
            }
        }

        // photos are large; describe_images reads them from the store
        List<Map<String, Object>> withoutPhotos = places.stream()
                .map(place -> {
                    Map<String, Object> copy = new LinkedHashMap<>(place);
                    copy.remove("photos");
                    return copy;
                })
                .toList();
        return ToolResult.ok(name(), withoutPhotos);
    }
}
