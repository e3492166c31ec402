package com.mealscout.assistant.dto;

import java.util.List;
import java.util.Map;

public record AssistantDefinition(String name, String model, String instructions, List<Map<String, Object>> tools) {
}
