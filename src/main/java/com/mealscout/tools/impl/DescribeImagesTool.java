package com.mealscout.tools.impl;

import com.mealscout.images.ImageBatchAnalyzer;
import com.mealscout.tools.AiTool;
import com.mealscout.tools.ToolArguments;
import com.mealscout.tools.ToolResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class DescribeImagesTool implements AiTool {

    private final ImageBatchAnalyzer analyzer;

    @Override
    public String name() {
        return "describe_images";
    }

    @Override
    public String description() {
        return "Apply a short description to each image (use this function to determine which images have menus associated)";
    }

    @Override
    public Map<String, Object> openAiJsonSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "place_id", Map.of("type", "string",
                                "description", "The place id, e.g. 'ChIJj61dQgK6j4AR4GeTYWZsKWw'.")
                ),
                "required", List.of("place_id")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> args, String chatId) {
        String placeId = ToolArguments.string(args, "place_id", null);
        if (placeId == null) {
            return ToolResult.error(name(), "place_id is required");
        }
        try {
            return ToolResult.ok(name(), analyzer.describePlacePhotos(placeId));
        } catch (IllegalArgumentException e) {
            return ToolResult.error(name(), e.getMessage());
        }
    }
}
