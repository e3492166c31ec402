package com.mealscout.assistant.dto;

public record ThreadMessage(String id, String role, String text) {
}
