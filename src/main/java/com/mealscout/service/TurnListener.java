package com.mealscout.service;

import java.util.Map;

/**
 * Callback for progress inside a turn.
 */
@FunctionalInterface
public interface TurnListener {

    TurnListener NONE = (chatId, toolName, arguments) -> { };

    void onToolCall(String chatId, String toolName, Map<String, Object> arguments);
}
