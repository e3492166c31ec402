package com.mealscout.tools.impl;

import com.mealscout.model.ChatRecord;
import com.mealscout.model.GeoLocation;
import com.mealscout.service.ChatStore;
import com.mealscout.tools.AiTool;
import com.mealscout.tools.ToolResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class GetUserLocationTool implements AiTool {

    private final ChatStore chatStore;

    @Override
    public String name() {
        return "get_user_location";
    }

    @Override
    public String description() {
        return "Get the location of the user chatting with you";
    }

    @Override
    public Map<String, Object> openAiJsonSchema() {
        return Map.of("type", "object", "properties", Map.of(), "required", List.of());
    }

    @Override
    public ToolResult execute(Map<String, Object> args, String chatId) {
        Optional<GeoLocation> location = chatStore.findChat(chatId).map(ChatRecord::getLocation);
        return ToolResult.ok(name(), location.isPresent() ? location.get() : Map.of());
    }
}
