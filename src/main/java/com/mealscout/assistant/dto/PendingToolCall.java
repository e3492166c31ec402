package com.mealscout.assistant.dto;

public record PendingToolCall(String id, String name, String argumentsJson) {
}
