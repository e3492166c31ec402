package com.mealscout.integrations;

import com.fasterxml.jackson.databind.JsonNode;
import com.mealscout.config.IntegrationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class ExaSearchClient implements ContentSearchClient {

    private final WebClient webClient;
    private final HttpCallPolicy policy;

    public ExaSearchClient(@Qualifier("exaWebClient") WebClient webClient, IntegrationProperties properties) {
        this.webClient = webClient;
        IntegrationProperties.Client client = properties.getClient();
        this.policy = new HttpCallPolicy("Content search", client.getTimeoutMs(),
                client.getRetryMaxAttempts(), client.getRetryBackoffMs());
    }

    @Override
    public List<String> searchDomain(String domain, String query) {
        Map<String, Object> body = Map.of(
                "query", query,
                "type", "auto",
                "includeDomains", List.of(domain),
                "contents", Map.of("text", true));

        JsonNode data = policy.await(webClient.post()
                .uri("/search")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class));

        List<String> texts = new ArrayList<>();
        if (data == null) {
            return texts;
        }
        for (JsonNode result : data.path("results")) {
            String text = result.path("text").asText("");
            if (text.isBlank()) {
                log.debug("Skipping result without text url={}", result.path("url").asText());
                continue;
            }
            texts.add(text);
        }
        log.info("Content search domain={} found {} result(s)", domain, texts.size());
        return texts;
    }
}
