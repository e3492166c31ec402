package com.mealscout.tools.impl;

import com.mealscout.integrations.ContentSearchClient;
import com.mealscout.tools.AiTool;
import com.mealscout.tools.ToolArguments;
import com.mealscout.tools.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class SearchWebsiteTool implements AiTool {

    private final ContentSearchClient contentSearchClient;

    @Override
    public String name() {
        return "search_website";
    }

    @Override
    public String description() {
        return "Search a specific website's content for information using Exa. Use this to find menu items, business hours, or other details from a business's website.";
    }

    @Override
    public Map<String, Object> openAiJsonSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "domain", Map.of("type", "string",
                                "description", "The website domain to search (e.g., 'restaurant.com')"),
                        "query", Map.of("type", "string",
                                "description", "What to search for on the website (e.g., 'lunch menu', 'business hours')")
                ),
                "required", List.of("domain", "query")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> args, String chatId) {
        String domain = ToolArguments.string(args, "domain", null);
        String query = ToolArguments.string(args, "query", null);
        if (domain == null || query == null) {
            return failure("Invalid input parameters: Both domain and query parameters are required");
        }
        log.info("Searching website domain={} query='{}'", domain, query);
        try {
            List<String> results = contentSearchClient.searchDomain(domain, query);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("results", results);
            payload.put("count", results.size());
            return ToolResult.ok(name(), payload);
        } catch (RuntimeException e) {
            log.error("Website search failed domain={}", domain, e);
            return failure("Error performing website search: " + e.getMessage());
        }
    }

    private ToolResult failure(String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", message);
        payload.put("results", List.of());
        payload.put("count", 0);
        return new ToolResult(name(), payload, true);
    }
}
