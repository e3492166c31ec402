package com.mealscout.tools.impl;

import com.mealscout.model.ChatRecord;
import com.mealscout.service.ChatStore;
import com.mealscout.tools.AiTool;
import com.mealscout.tools.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class GetStoredPlacesTool implements AiTool {

    private final ChatStore chatStore;

    @Override
    public String name() {
        return "get_stored_places_for_chat";
    }

    @Override
    public String description() {
        return "Retrieve all stored places for a given chat_id, returning place_id and editorialSummary.";
    }

    @Override
    public Map<String, Object> openAiJsonSchema() {
        return Map.of("type", "object", "properties", Map.of(), "required", List.of());
    }

    @Override
    public ToolResult execute(Map<String, Object> args, String chatId) {
        Optional<ChatRecord> chat = chatStore.findChat(chatId);
        if (chat.isEmpty()) {
            return ToolResult.error(name(), "No chat data for " + chatId);
        }
        List<Map<String, Object>> summaries = new ArrayList<>();
        for (String placeId : chat.get().getPlaces()) {
            chatStore.findPlaceSummary(placeId).ifPresentOrElse(
                    summaries::add,
                    () -> log.warn("No document found for placeId={}", placeId));
        }
        log.info("Returning {} place summaries chatId={}", summaries.size(), chatId);
        return ToolResult.ok(name(), summaries);
    }
}
