package com.mealscout.tools;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTest {

    @Test
    void duplicateNamesAreRejected() {
        assertThatThrownBy(() -> new ToolRegistry(List.of(new NamedTool("lookup"), new NamedTool("lookup"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("lookup");
    }

    @Test
    void lookupFallsBackToLowerCase() {
        ToolRegistry registry = new ToolRegistry(List.of(new NamedTool("get_user_location")));

        assertThat(registry.get("GET_USER_LOCATION")).isPresent();
        assertThat(registry.get("unknown")).isEmpty();
        assertThat(registry.get(null)).isEmpty();
    }

    @Test
    void schemaListsEveryToolAsFunction() {
        ToolRegistry registry = new ToolRegistry(List.of(new NamedTool("a"), new NamedTool("b")));

        List<Map<String, Object>> schema = registry.openAiToolsSchema();

        assertThat(registry.names()).containsExactly("a", "b");
        assertThat(schema).hasSize(2);
        assertThat(schema.get(0)).containsEntry("type", "function");
        assertThat(schema.get(1).get("function")).isEqualTo(Map.of(
                "name", "b",
                "description", "tool b",
                "parameters", Map.of("type", "object")));
    }

    private record NamedTool(String name) implements AiTool {

        @Override
        public String description() {
            return "tool " + name;
        }

        @Override
        public Map<String, Object> openAiJsonSchema() {
            return Map.of("type", "object");
        }

        @Override
        public ToolResult execute(Map<String, Object> args, String chatId) {
            return ToolResult.ok(name, Map.of());
        }
    }
}
