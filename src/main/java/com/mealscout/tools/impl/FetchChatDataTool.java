package com.mealscout.tools.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mealscout.service.ChatStore;
import com.mealscout.tools.AiTool;
import com.mealscout.tools.ToolResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class FetchChatDataTool implements AiTool {

    private final ChatStore chatStore;
    private final ObjectMapper mapper;

    @Override
    public String name() {
        return "fetch_chat_data";
    }

    @Override
    public String description() {
        return "Fetch all chat data so far (use this function sparingly and only when necessary to avoid processing a lot of data)";
    }

    @Override
    public Map<String, Object> openAiJsonSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(),
                "required", List.of()
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> args, String chatId) {
        Object payload = chatStore.findChat(chatId)
                .<Object>map(chat -> mapper.convertValue(chat, Map.class))
                .orElse(Map.of());
        return ToolResult.ok(name(), payload);
    }
}
