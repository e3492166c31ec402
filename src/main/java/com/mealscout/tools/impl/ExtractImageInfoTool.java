package com.mealscout.tools.impl;

import com.mealscout.images.ImageBatchAnalyzer;
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
public class ExtractImageInfoTool implements AiTool {

    private final ImageBatchAnalyzer analyzer;

    @Override
    public String name() {
        return "extract_image_info";
    }

    @Override
    public String description() {
        return "Extract information from one of the images (use this function to tell what items a restaurant has)";
    }

    @Override
    public Map<String, Object> openAiJsonSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "image_index", Map.of("type", "number",
                                "description", "The index of an image from the list of images associated with the place"),
                        "place_id", Map.of("type", "string",
                                "description", "The place id, e.g. 'ChIJj61dQgK6j4AR4GeTYWZsKWw'."),
                        "query", Map.of("type", "string",
                                "description", "A question that you have about the image that you want answered. (e.g. what are all the items on the menu)")
                ),
                "required", List.of("image_index", "place_id", "query")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> args, String chatId) {
        String placeId = ToolArguments.string(args, "place_id", "");
        String query = ToolArguments.string(args, "query", "");
        int imageIndex = ToolArguments.integer(args, "image_index", 0);
        try {
            String info = analyzer.extractImageInfo(placeId, imageIndex, query);
            return ToolResult.ok(name(), Map.of("info", info));
        } catch (IllegalArgumentException e) {
            return ToolResult.error(name(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error extracting image info placeId={} index={}", placeId, imageIndex, e);
            return ToolResult.error(name(), "Error extracting image info: " + e.getMessage());
        }
    }
}
