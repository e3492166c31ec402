package com.mealscout.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dispatches assistant tool calls to registered tools. Never throws: unknown tools and
 * tool failures come back as error results the assistant can read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AiToolExecutor {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ToolRegistry registry;
    private final ObjectMapper mapper;

    public Map<String, Object> parseArguments(String argumentsJson) throws JsonProcessingException {
        if (argumentsJson == null || argumentsJson.isBlank()) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> args = mapper.readValue(argumentsJson, MAP_TYPE);
        return args == null ? new LinkedHashMap<>() : new LinkedHashMap<>(args);
    }

    public ToolResult invoke(String toolName, Map<String, Object> args, String chatId) {
        AiTool tool = registry.get(toolName).orElse(null);
        if (tool == null) {
            log.error("Unknown function '{}' chatId={}", toolName, chatId);
            return ToolResult.error(toolName, "Function '" + toolName + "' not recognized.");
        }
        log.info("Handling function call '{}' chatId={}", tool.name(), chatId);
        log.debug("Function arguments {}", args);
        try {
            ToolResult result = tool.execute(args, chatId);
            if (result.error()) {
                log.warn("Tool '{}' returned error chatId={}: {}", tool.name(), chatId, result.errorMessage());
            }
            return result;
        } catch (Exception ex) {
            log.error("Error executing function '{}' chatId={}", tool.name(), chatId, ex);
            return ToolResult.error(tool.name(), "Error executing function: " + ex.getMessage());
        }
    }

    /**
     * The tool output string submitted back to the run.
     */
    public String toOutputJson(ToolResult result) {
        try {
            return mapper.writeValueAsString(result.payload());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize output of tool '{}'", result.name(), e);
            return "{\"error\":\"Error executing function: unserializable result\"}";
        }
    }
}
