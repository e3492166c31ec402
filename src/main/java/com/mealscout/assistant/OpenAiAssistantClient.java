package com.mealscout.assistant;

import com.fasterxml.jackson.databind.JsonNode;
import com.mealscout.assistant.dto.AssistantDefinition;
import com.mealscout.assistant.dto.PendingToolCall;
import com.mealscout.assistant.dto.RunSnapshot;
import com.mealscout.assistant.dto.RunStatus;
import com.mealscout.assistant.dto.ThreadMessage;
import com.mealscout.assistant.dto.ToolOutput;
import com.mealscout.config.AiProperties;
import com.mealscout.integrations.HttpCallPolicy;
import com.mealscout.integrations.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assistants API (v2) over {@link WebClient}. Responses are read as {@link JsonNode} and
 * reduced to the few fields the conversation loop needs.
 */
@Component
@Slf4j
public class OpenAiAssistantClient implements AssistantClient {

    private static final String SERVICE = "OpenAI assistant";

    private final WebClient webClient;
    private final HttpCallPolicy policy;

    public OpenAiAssistantClient(@Qualifier("assistantWebClient") WebClient webClient, AiProperties properties) {
        this.webClient = webClient;
        AiProperties.Client client = properties.getClient();
        this.policy = new HttpCallPolicy(SERVICE, client.getTimeoutMs(),
                client.getRetry().getMaxAttempts(), client.getRetry().getBackoffMs());
    }

    @Override
    public Optional<String> retrieveAssistant(String assistantId) {
        JsonNode node = policy.await(webClient.get()
                .uri("/assistants/{id}", assistantId)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty()));
        return node == null ? Optional.empty() : Optional.ofNullable(node.path("id").asText(null));
    }

    @Override
    public String createAssistant(AssistantDefinition definition) {
        JsonNode node = post("/assistants", Map.of(
                "name", definition.name(),
                "model", definition.model(),
                "instructions", definition.instructions(),
                "tools", definition.tools()));
        return requireText(node, "id");
    }

    @Override
    public String createThread() {
        return requireText(post("/threads", Map.of()), "id");
    }

    @Override
    public void addUserMessage(String threadId, String content) {
        post("/threads/" + threadId + "/messages", Map.of("role", "user", "content", content));
        log.debug("Added user message threadId={} length={}", threadId, content.length());
    }

    @Override
    public RunSnapshot createRun(String threadId, String assistantId) {
        return toRun(post("/threads/" + threadId + "/runs", Map.of("assistant_id", assistantId)));
    }

    @Override
    public RunSnapshot retrieveRun(String threadId, String runId) {
        JsonNode node = policy.await(webClient.get()
                .uri("/threads/{threadId}/runs/{runId}", threadId, runId)
                .retrieve()
                .bodyToMono(JsonNode.class));
        return toRun(node);
    }

    @Override
    public RunSnapshot submitToolOutputs(String threadId, String runId, List<ToolOutput> outputs) {
        log.debug("Submitting {} tool output(s) threadId={} runId={}", outputs.size(), threadId, runId);
        return toRun(post("/threads/" + threadId + "/runs/" + runId + "/submit_tool_outputs",
                Map.of("tool_outputs", outputs)));
    }

    @Override
    public RunSnapshot cancelRun(String threadId, String runId) {
        return toRun(post("/threads/" + threadId + "/runs/" + runId + "/cancel", Map.of()));
    }

    @Override
    public List<ThreadMessage> listMessages(String threadId) {
        JsonNode node = policy.await(webClient.get()
                .uri(uri -> uri.path("/threads/{threadId}/messages")
                        .queryParam("order", "desc")
                        .queryParam("limit", 20)
                        .build(threadId))
                .retrieve()
                .bodyToMono(JsonNode.class));
        List<ThreadMessage> messages = new ArrayList<>();
        if (node == null) {
            return messages;
        }
        for (JsonNode message : node.path("data")) {
            messages.add(new ThreadMessage(
                    message.path("id").asText(null),
                    message.path("role").asText(null),
                    textOf(message.path("content"))));
        }
        return messages;
    }

    private JsonNode post(String path, Object body) {
        return policy.await(webClient.post()
                .uri(path)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class));
    }

    private RunSnapshot toRun(JsonNode node) {
        if (node == null) {
            throw new UpstreamException(SERVICE, "Empty run response");
        }
        String rawStatus = node.path("status").asText(null);
        List<PendingToolCall> calls = new ArrayList<>();
        for (JsonNode call : node.path("required_action").path("submit_tool_outputs").path("tool_calls")) {
            JsonNode function = call.path("function");
            calls.add(new PendingToolCall(
                    call.path("id").asText(null),
                    function.path("name").asText(null),
                    function.path("arguments").asText("{}")));
        }
        return new RunSnapshot(
                requireText(node, "id"),
                node.path("thread_id").asText(null),
                RunStatus.fromValue(rawStatus),
                rawStatus,
                calls);
    }

    private static String textOf(JsonNode content) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : content) {
            if (!"text".equals(part.path("type").asText())) {
                continue;
            }
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(part.path("text").path("value").asText(""));
        }
        return text.toString();
    }

    private static String requireText(JsonNode node, String field) {
        String value = node == null ? null : node.path(field).asText(null);
        if (value == null || value.isBlank()) {
            throw new UpstreamException(SERVICE, "Response is missing '" + field + "'");
        }
        return value;
    }
}
