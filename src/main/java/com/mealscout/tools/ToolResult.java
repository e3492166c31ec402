package com.mealscout.tools;

import java.util.Map;

/**
 * Outcome of one tool invocation. {@code payload} is serialized as the tool output;
 * error results carry an {@code error} entry.
 */
public record ToolResult(String name, Object payload, boolean error) {

    public static ToolResult ok(String name, Object payload) {
        return new ToolResult(name, payload, false);
    }

    public static ToolResult error(String name, String message) {
        return new ToolResult(name, Map.of("error", message), true);
    }

    public String errorMessage() {
        if (error && payload instanceof Map<?, ?> map && map.get("error") != null) {
            return map.get("error").toString();
        }
        return null;
    }
}
