package com.mealscout.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AiToolExecutorTests {

    @Test
    void invokePassesArgumentsAndChatId() throws Exception {
        CapturingTool tool = new CapturingTool();
        AiToolExecutor executor = new AiToolExecutor(new ToolRegistry(List.of(tool)), new ObjectMapper());

        Map<String, Object> args = executor.parseArguments("""
                {"query":"tacos","radius":1200}
                """);
        ToolResult result = executor.invoke("capture", args, "chat-1");

        assertThat(result.error()).isFalse();
        assertThat(tool.lastChatId).isEqualTo("chat-1");
        assertThat(tool.lastArgs).containsEntry("query", "tacos").containsEntry("radius", 1200);
        assertThat(executor.toOutputJson(result)).isEqualTo("{\"status\":\"ok\"}");
    }

    @Test
    void unknownToolBecomesErrorResult() {
        AiToolExecutor executor = new AiToolExecutor(new ToolRegistry(List.of()), new ObjectMapper());

        ToolResult result = executor.invoke("teleport", Map.of(), "chat-1");

        assertThat(result.error()).isTrue();
        assertThat(result.errorMessage()).isEqualTo("Function 'teleport' not recognized.");
        assertThat(executor.toOutputJson(result)).isEqualTo("{\"error\":\"Function 'teleport' not recognized.\"}");
    }

    @Test
    void throwingToolBecomesErrorResult() {
        CapturingTool tool = new CapturingTool();
        tool.failure = new IllegalStateException("upstream down");
        AiToolExecutor executor = new AiToolExecutor(new ToolRegistry(List.of(tool)), new ObjectMapper());

        ToolResult result = executor.invoke("capture", Map.of(), "chat-1");

        assertThat(result.errorMessage()).isEqualTo("Error executing function: upstream down");
    }

    @Test
    void parseArgumentsHandlesBlankAndRejectsMalformedJson() throws Exception {
        AiToolExecutor executor = new AiToolExecutor(new ToolRegistry(List.of()), new ObjectMapper());

        assertThat(executor.parseArguments("")).isEmpty();
        assertThat(executor.parseArguments(null)).isEmpty();
        assertThatThrownBy(() -> executor.parseArguments("{broken"))
                .isInstanceOf(JsonProcessingException.class);
    }

    private static final class CapturingTool implements AiTool {
        private Map<String, Object> lastArgs = Map.of();
        private String lastChatId;
        private Exception failure;

        @Override
        public String name() {
            return "capture";
        }

        @Override
        public String description() {
            return "test tool";
        }

        @Override
        public Map<String, Object> openAiJsonSchema() {
            return Map.of();
        }

        @Override
        public ToolResult execute(Map<String, Object> args, String chatId) throws Exception {
            if (failure != null) {
                throw failure;
            }
            this.lastArgs = new HashMap<>(args);
            this.lastChatId = chatId;
            return ToolResult.ok(name(), Map.of("status", "ok"));
        }
    }
}
