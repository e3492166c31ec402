package com.mealscout.tools.impl;

import com.mealscout.integrations.PlaceFields;
import com.mealscout.integrations.PlacesClient;
import com.mealscout.tools.AiTool;
import com.mealscout.tools.ToolArguments;
import com.mealscout.tools.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class DescribePlaceTool implements AiTool {

    private final PlacesClient placesClient;

    @Override
    public String name() {
        return "describe_place";
    }

    @Override
    public String description() {
        return "Use the google maps api to describe a place with the given place_id and fields to retrieve";
    }

    @Override
    public Map<String, Object> openAiJsonSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "place_id", Map.of("type", "string",
                                "description", "The place id, e.g. 'ChIJj61dQgK6j4AR4GeTYWZsKWw'."),
                        "fields", Map.of("type", "array",
                                "description", "A list of fields to return from the known available fields (e.g. takeout)",
                                "items", Map.of("type", "string", "enum", PlaceFields.nonDefault()))
                ),
                "required", List.of("place_id", "fields")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> args, String chatId) {
        List<String> fields = ToolArguments.strings(args, "fields");
        List<String> invalid = PlaceFields.invalid(fields);
        if (!invalid.isEmpty()) {
            return ToolResult.error(name(), "Invalid fields: " + PlaceFields.format(invalid));
        }
        String placeId = ToolArguments.string(args, "place_id", null);
        if (placeId == null) {
            return ToolResult.error(name(), "place_id is required");
        }
        if (fields.isEmpty()) {
            return ToolResult.error(name(), "At least one field is required");
        }

        log.info("Describing place placeId={} fields={}", placeId, fields);
        Map<String, Object> details = placesClient.details(placeId, fields);
        if (details.isEmpty()) {
            return ToolResult.error(name(), "No data returned for " + placeId);
        }
        return ToolResult.ok(name(), details);
    }
}
