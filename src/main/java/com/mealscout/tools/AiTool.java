package com.mealscout.tools;

import java.util.Map;

/**
 * A function the assistant can call. Implementations return validation and not-found
 * problems as {@link ToolResult#error} results and may throw for anything else.
 */
public interface AiTool {
    String name();

    String description();

    Map<String, Object> openAiJsonSchema();

    /**
     * @param args   decoded JSON arguments from the assistant
     * @param chatId the chat the run belongs to
     */
    ToolResult execute(Map<String, Object> args, String chatId) throws Exception;
}
